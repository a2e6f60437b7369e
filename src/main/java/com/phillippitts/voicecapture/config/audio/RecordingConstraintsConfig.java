package com.phillippitts.voicecapture.config.audio;

import com.phillippitts.voicecapture.domain.RecordingConstraints;
import com.phillippitts.voicecapture.service.audio.AudioFormat;
import com.phillippitts.voicecapture.service.audio.processing.AudioProcessor;
import com.phillippitts.voicecapture.service.audio.quality.AudioQualityAnalyzer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the immutable {@link RecordingConstraints} from {@link AudioCaptureProperties}
 * and the stateless audio components that depend on them.
 */
@Configuration
public class RecordingConstraintsConfig {

    private static final Logger LOG = LogManager.getLogger(RecordingConstraintsConfig.class);

    private final AudioCaptureProperties props;

    public RecordingConstraintsConfig(AudioCaptureProperties props) {
        this.props = props;
    }

    @Bean
    public RecordingConstraints recordingConstraints() {
        RecordingConstraints constraints = new RecordingConstraints(
                props.getMaxFileSizeBytes(),
                AudioFormat.REQUIRED_SAMPLE_RATE,
                AudioFormat.REQUIRED_BITS_PER_SAMPLE,
                AudioFormat.REQUIRED_CHANNELS,
                props.getSilenceThresholdDb(),
                props.getSilenceDurationMs(),
                props.getClippingThreshold(),
                RecordingConstraints.defaults().noiseFloorDb(),
                props.getBufferMillis(),
                props.getMinRecordingDurationMs());
        LOG.info("Recording constraints: max-size={} bytes, max-duration={} ms, buffer={} ms, preset={}",
                constraints.maxFileSizeBytes(), constraints.maxRecordingDurationMs(),
                constraints.bufferDurationMs(), props.getQualityPreset());
        return constraints;
    }

    @Bean
    public AudioQualityAnalyzer audioQualityAnalyzer(RecordingConstraints recordingConstraints) {
        return new AudioQualityAnalyzer(recordingConstraints);
    }

    @Bean
    public AudioProcessor audioProcessor() {
        return new AudioProcessor(props.getQualityPreset());
    }
}

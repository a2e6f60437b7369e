package com.phillippitts.voicecapture;

import com.phillippitts.voicecapture.config.audio.AudioCaptureProperties;
import com.phillippitts.voicecapture.config.recording.RecordingProperties;
import com.phillippitts.voicecapture.config.recording.TranscriptionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioCaptureProperties.class,
        RecordingProperties.class,
        TranscriptionProperties.class
})
public class VoiceCaptureApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceCaptureApplication.class, args);
    }

}

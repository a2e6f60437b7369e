package com.phillippitts.voicecapture.service.audio.capture;

import com.phillippitts.voicecapture.config.audio.AudioCaptureProperties;
import com.phillippitts.voicecapture.domain.AudioFile;
import com.phillippitts.voicecapture.domain.RecordingConstraints;
import com.phillippitts.voicecapture.exception.CaptureErrorKind;
import com.phillippitts.voicecapture.exception.CaptureException;
import com.phillippitts.voicecapture.service.audio.AudioFormat;
import com.phillippitts.voicecapture.service.audio.Pcm16;
import com.phillippitts.voicecapture.service.audio.WavWriter;
import com.phillippitts.voicecapture.service.audio.processing.AudioProcessor;
import com.phillippitts.voicecapture.service.audio.quality.AudioMetrics;
import com.phillippitts.voicecapture.service.audio.quality.AudioQualityAnalyzer;
import com.phillippitts.voicecapture.service.audio.quality.QualityReport;
import com.phillippitts.voicecapture.service.audio.quality.RecordingStatistics;
import com.phillippitts.voicecapture.service.audio.quality.RecordingStatisticsTracker;
import com.phillippitts.voicecapture.service.audio.quality.SilenceDetector;
import com.phillippitts.voicecapture.service.audio.quality.SilenceState;
import com.phillippitts.voicecapture.util.CaptureTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import static com.phillippitts.voicecapture.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.voicecapture.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Java Sound based microphone capture producing a conditioned PCM16LE mono 16 kHz WAV file.
 * Thread-safe for a single active session.
 *
 * <p>The input line is opened on the caller's thread so device and permission failures are
 * reported by {@link #start}. Reading happens on a dedicated {@code audio-capture} thread which
 * analyzes every buffer, feeds the silence detector and statistics tracker, and accumulates the
 * samples. When the loop ends, the samples are processed and encoded on the same thread;
 * {@link #stop()} joins it and hands back the file.
 *
 * <p>This is the default implementation of {@link AudioCaptureService}.
 * Test configurations can provide alternative implementations by marking them as @Primary.
 */
@Service
public class JavaSoundAudioCaptureService implements AudioCaptureService {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioCaptureService.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final RecordingConstraints constraints;
    private final AudioQualityAnalyzer analyzer;
    private final AudioProcessor processor;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;

    private final Object lock = new Object();
    private Session current;
    private volatile QualityReport lastReport;

    @Autowired
    public JavaSoundAudioCaptureService(AudioCaptureProperties props,
                                        RecordingConstraints constraints,
                                        AudioQualityAnalyzer analyzer,
                                        AudioProcessor processor,
                                        ApplicationEventPublisher publisher) {
        this(props, constraints, analyzer, processor, publisher, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioCaptureService(AudioCaptureProperties props,
                                 RecordingConstraints constraints,
                                 AudioQualityAnalyzer analyzer,
                                 AudioProcessor processor,
                                 ApplicationEventPublisher publisher,
                                 DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.constraints = Objects.requireNonNull(constraints);
        this.analyzer = Objects.requireNonNull(analyzer);
        this.processor = Objects.requireNonNull(processor);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
    }

    @PostConstruct
    public void logSystemInfo() {
        String os = System.getProperty("os.name");
        String arch = System.getProperty("os.arch");
        int mixerCount = AudioSystem.getMixerInfo().length;
        String device = props.getDeviceName() != null ? props.getDeviceName() : "default";

        LOG.info("Audio capture initialized: OS={}, arch={}, device='{}', available-mixers={}, "
                + "buffer={}ms, max-size={} bytes, preset={}",
                os, arch, device, mixerCount, constraints.bufferDurationMs(),
                constraints.maxFileSizeBytes(), processor.preset());
    }

    @PreDestroy
    public void shutdown() {
        synchronized (lock) {
            if (current != null) {
                LOG.info("Shutting down with active session {}; forcing cleanup", current.id);
            }
        }
        cancel();
    }

    static DataLineProvider defaultProvider() {
        return (format, device) -> {
            Mixer.Info[] mixers = AudioSystem.getMixerInfo();
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : mixers) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    /** Java Sound format matching {@link AudioFormat}. */
    public static javax.sound.sampled.AudioFormat requiredFormat() {
        return new javax.sound.sampled.AudioFormat(
                AudioFormat.REQUIRED_SAMPLE_RATE,
                AudioFormat.REQUIRED_BITS_PER_SAMPLE,
                AudioFormat.REQUIRED_CHANNELS,
                AudioFormat.REQUIRED_SIGNED,
                AudioFormat.REQUIRED_BIG_ENDIAN
        );
    }

    @Override
    public void start(String sessionId, Path outputPath, CaptureListener listener) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(outputPath, "outputPath must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        synchronized (lock) {
            if (current != null) {
                throw new CaptureException(CaptureErrorKind.CONFIGURATION_ERROR, "Recording already in progress");
            }
            prepareOutput(outputPath);
            SampleAccumulator samples = newAccumulator();
            SilenceDetector silence = new SilenceDetector(constraints);
            RecordingStatisticsTracker statistics = new RecordingStatisticsTracker(constraints);

            TargetDataLine line = openLine();
            Session s;
            try {
                s = new Session(sessionId, outputPath, listener, line, silence, statistics, samples);
                Thread t = new Thread(() -> runCapture(s), "audio-capture");
                t.setDaemon(true);
                s.thread = t;
                t.start();
            } catch (RuntimeException e) {
                closeLine(line);
                throw e;
            }
            current = s;
            LOG.info("Capture session started (session={}, device='{}')", sessionId,
                    props.getDeviceName() != null ? props.getDeviceName() : "default");
        }
    }

    @Override
    public Optional<AudioFile> stop() {
        Session s;
        Thread captureThread;
        synchronized (lock) {
            if (current == null) {
                return Optional.empty();
            }
            s = current;
            s.stopRequested = true;
            s.paused = false;
            s.state = CaptureState.STOPPING;
            captureThread = s.thread;
        }
        // Join thread outside lock; finalization runs on the capture thread
        boolean terminated = joinThread(captureThread, CaptureTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
        synchronized (lock) {
            if (current == s) {
                current = null;
            }
        }
        if (!terminated) {
            s.canceled = true;
            return Optional.empty();
        }
        LOG.info("Capture session stopped (session={}, file={})", s.id, s.result != null);
        return Optional.ofNullable(s.result);
    }

    @Override
    public void cancel() {
        Session s;
        Thread captureThread;
        synchronized (lock) {
            if (current == null) {
                return;
            }
            s = current;
            s.canceled = true;
            s.paused = false;
            s.state = CaptureState.STOPPING;
            captureThread = s.thread;
            current = null;
        }
        joinThread(captureThread, CaptureTimeouts.CAPTURE_THREAD_SHUTDOWN_TIMEOUT.toMillis());
        s.samples.clear();
        deleteOutput(s);
        LOG.info("Capture session canceled (session={})", s.id);
    }

    @Override
    public void pause() {
        synchronized (lock) {
            if (current != null && current.state == CaptureState.ACTIVE) {
                current.paused = true;
                current.state = CaptureState.PAUSED;
                LOG.info("Capture paused (session={})", current.id);
            }
        }
    }

    @Override
    public void resume() {
        synchronized (lock) {
            if (current != null && current.state == CaptureState.PAUSED) {
                current.paused = false;
                current.state = CaptureState.ACTIVE;
                LOG.info("Capture resumed (session={})", current.id);
            }
        }
    }

    @Override
    public boolean isCapturing() {
        CaptureState state = state();
        return state == CaptureState.ACTIVE || state == CaptureState.PAUSED;
    }

    @Override
    public CaptureState state() {
        synchronized (lock) {
            return current == null ? CaptureState.IDLE : current.state;
        }
    }

    @Override
    public AudioMetrics currentMetrics() {
        Session s;
        synchronized (lock) {
            s = current;
        }
        if (s == null || s.latestMetrics == null) {
            return AudioMetrics.empty(constraints.noiseFloorDb());
        }
        return s.latestMetrics;
    }

    @Override
    public RecordingStatistics currentStatistics() {
        Session s;
        synchronized (lock) {
            s = current;
        }
        if (s == null) {
            return RecordingStatistics.empty();
        }
        return s.tracker.statistics(s.tracker.capturedDurationMs());
    }

    @Override
    public Optional<QualityReport> lastQualityReport() {
        return Optional.ofNullable(lastReport);
    }

    private void prepareOutput(Path outputPath) {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw reportStartFailure(new CaptureException(CaptureErrorKind.IO_ERROR,
                    "cannot create output directory " + parent, e));
        }
    }

    private SampleAccumulator newAccumulator() {
        int maxSamples = (int) ((constraints.maxFileSizeBytes() - WAV_HEADER_SIZE) / REQUIRED_BLOCK_ALIGN);
        try {
            return new SampleAccumulator(maxSamples);
        } catch (IllegalArgumentException e) {
            throw reportStartFailure(new CaptureException(CaptureErrorKind.CONFIGURATION_ERROR,
                    "size limit " + constraints.maxFileSizeBytes() + " bytes leaves no room for audio", e));
        }
    }

    private TargetDataLine openLine() {
        try {
            return provider.open(requiredFormat(), Optional.ofNullable(props.getDeviceName()));
        } catch (LineUnavailableException e) {
            throw reportStartFailure(new CaptureException(CaptureErrorKind.DEVICE_UNAVAILABLE, e.getMessage(), e));
        } catch (SecurityException e) {
            throw reportStartFailure(new CaptureException(CaptureErrorKind.PERMISSION_DENIED, e.getMessage(), e));
        } catch (IllegalArgumentException e) {
            throw reportStartFailure(new CaptureException(CaptureErrorKind.CONFIGURATION_ERROR, e.getMessage(), e));
        }
    }

    private CaptureException reportStartFailure(CaptureException e) {
        LOG.warn("Capture could not start: {}", e.getMessage());
        publisher.publishEvent(new CaptureErrorEvent(e.getKind(), Instant.now()));
        return e;
    }

    private void runCapture(Session s) {
        ThreadContext.put("sessionId", s.id);
        try {
            boolean sizeLimitReached;
            try {
                sizeLimitReached = readLoop(s);
            } finally {
                s.state = CaptureState.STOPPING;
                closeLine(s.line);
            }
            if (s.canceled) {
                return;
            }
            finalizeRecording(s);
            if (sizeLimitReached && s.result != null) {
                s.listener.onSizeLimitReached(s.result.sizeBytes());
            }
        } catch (CaptureException e) {
            fail(s, e);
        } catch (SecurityException e) {
            fail(s, new CaptureException(CaptureErrorKind.PERMISSION_DENIED, e.getMessage(), e));
        } catch (IllegalStateException e) {
            fail(s, new CaptureException(CaptureErrorKind.IO_ERROR, e.getMessage(), e));
        } catch (Throwable t) {
            fail(s, new CaptureException(CaptureErrorKind.UNKNOWN, t.toString(), t));
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    /**
     * Reads buffers until stop, cancel or the size limit.
     *
     * @return true when the loop ended because of the size limit
     */
    private boolean readLoop(Session s) {
        byte[] buf = new byte[constraints.samplesPerBuffer() * REQUIRED_BLOCK_ALIGN];
        boolean lineRunning = false;
        while (!s.stopRequested && !s.canceled) {
            if (s.paused) {
                if (lineRunning) {
                    s.line.stop();
                    s.line.flush();
                    lineRunning = false;
                }
                if (!sleepQuietly(CaptureTimeouts.PAUSE_POLL_INTERVAL.toMillis())) {
                    break;
                }
                continue;
            }
            if (!lineRunning) {
                s.line.start();
                lineRunning = true;
            }
            int n = s.line.read(buf, 0, buf.length);
            if (n < 0) {
                throw new CaptureException(CaptureErrorKind.IO_ERROR, "line read returned " + n);
            }
            if (n == 0) {
                continue;
            }
            short[] samples = Pcm16.toSamples(buf, n);
            processBuffer(s, samples);
            if (s.tracker.isSizeLimitReached()) {
                LOG.info("Size limit reached ({} of {} bytes); stopping capture",
                        s.tracker.currentFileSizeBytes(), constraints.maxFileSizeBytes());
                return true;
            }
        }
        LOG.debug("Capture loop finished (stop={}, cancel={})", s.stopRequested, s.canceled);
        return false;
    }

    private void processBuffer(Session s, short[] samples) {
        AudioMetrics metrics = analyzer.analyze(samples);
        s.latestMetrics = metrics;
        SilenceState silence = s.silence.processSample(metrics.silent());
        if (silence == SilenceState.ENTERED_SILENCE) {
            LOG.debug("Silence started");
        } else if (silence == SilenceState.EXITED_SILENCE) {
            LOG.debug("Silence ended");
        } else if (silence == SilenceState.IN_SILENCE && s.silence.shouldTrimSilence() && !s.longSilenceLogged) {
            s.longSilenceLogged = true;
            LOG.debug("Extended silence ({} ms)", s.silence.currentSilenceDuration());
        }
        if (silence == SilenceState.EXITED_SILENCE) {
            s.longSilenceLogged = false;
        }
        s.tracker.update(metrics, samples.length);
        s.samples.append(samples, samples.length);
    }

    private void finalizeRecording(Session s) {
        short[] captured = s.samples.toArray();
        if (captured.length == 0) {
            LOG.warn("No audio captured; nothing to encode");
            return;
        }
        short[] processed = processor.process(captured);
        long size = WavWriter.writeMono16kHz(processed, s.outputPath);
        long durationMs = processed.length * 1000L / constraints.sampleRate();
        QualityReport report = s.tracker.qualityReport(s.tracker.capturedDurationMs());
        s.result = new AudioFile(s.outputPath, durationMs, size, s.id);
        lastReport = report;
        LOG.info("Recording finalized: captured={}ms, encoded={}ms, size={} bytes, quality={}, issues={}",
                s.tracker.capturedDurationMs(), durationMs, size, report.overallQuality(), report.issues());
    }

    private void fail(Session s, CaptureException e) {
        synchronized (lock) {
            if (current == s) {
                current = null;
            }
        }
        deleteOutput(s);
        if (s.canceled) {
            LOG.debug("Ignoring failure of canceled session: {}", e.getMessage());
            return;
        }
        LOG.warn("Capture failed: {}", e.getMessage());
        publisher.publishEvent(new CaptureErrorEvent(e.getKind(), Instant.now()));
        try {
            s.listener.onCaptureError(e);
        } catch (RuntimeException listenerError) {
            LOG.warn("Capture listener failed: {}", listenerError.toString());
        }
    }

    private void closeLine(TargetDataLine line) {
        try {
            line.stop();
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing input line: {}", e.toString());
        }
    }

    private void deleteOutput(Session s) {
        try {
            Files.deleteIfExists(s.outputPath);
        } catch (IOException e) {
            LOG.warn("Could not delete {}: {}", s.outputPath.getFileName(), e.getMessage());
        }
    }

    private static boolean sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean joinThread(Thread thread, long timeoutMs) {
        if (thread == null || !thread.isAlive()) {
            return true;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
            return false;
        }
    }

    private static final class Session {
        final String id;
        final Path outputPath;
        final CaptureListener listener;
        final TargetDataLine line;
        final SilenceDetector silence;
        final RecordingStatisticsTracker tracker;
        final SampleAccumulator samples;
        volatile CaptureState state = CaptureState.ACTIVE;
        volatile boolean stopRequested;
        volatile boolean canceled;
        volatile boolean paused;
        volatile AudioMetrics latestMetrics;
        volatile AudioFile result;
        volatile Thread thread;
        boolean longSilenceLogged;

        Session(String id, Path outputPath, CaptureListener listener, TargetDataLine line,
                SilenceDetector silence, RecordingStatisticsTracker tracker, SampleAccumulator samples) {
            this.id = id;
            this.outputPath = outputPath;
            this.listener = listener;
            this.line = line;
            this.silence = silence;
            this.tracker = tracker;
            this.samples = samples;
        }
    }
}

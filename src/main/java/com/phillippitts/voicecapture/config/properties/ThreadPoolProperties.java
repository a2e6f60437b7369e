package com.phillippitts.voicecapture.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The recording lifecycle runs on a single-threaded executor so that state transitions
 * are serialized; timers run on a small scheduler. Transcription requests run on a separate
 * pool so a slow upload never holds the recording thread. Device arbitration notifications
 * are dispatched on their own single thread.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private RecordingPoolProperties recording = new RecordingPoolProperties();
    private TranscriptionPoolProperties transcription = new TranscriptionPoolProperties();
    private ArbiterPoolProperties arbiter = new ArbiterPoolProperties();

    public RecordingPoolProperties getRecording() {
        return recording;
    }

    public void setRecording(RecordingPoolProperties recording) {
        this.recording = recording;
    }

    public TranscriptionPoolProperties getTranscription() {
        return transcription;
    }

    public void setTranscription(TranscriptionPoolProperties transcription) {
        this.transcription = transcription;
    }

    public ArbiterPoolProperties getArbiter() {
        return arbiter;
    }

    public void setArbiter(ArbiterPoolProperties arbiter) {
        this.arbiter = arbiter;
    }

    /**
     * Recording executor and timer scheduler configuration.
     */
    public static class RecordingPoolProperties {
        private int queueCapacity = 256;
        private int schedulerPoolSize = 2;
        private String executorThreadNamePrefix = "recording-";
        private String schedulerThreadNamePrefix = "recording-timer-";

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getSchedulerPoolSize() {
            return schedulerPoolSize;
        }

        public void setSchedulerPoolSize(int schedulerPoolSize) {
            this.schedulerPoolSize = schedulerPoolSize;
        }

        public String getExecutorThreadNamePrefix() {
            return executorThreadNamePrefix;
        }

        public void setExecutorThreadNamePrefix(String executorThreadNamePrefix) {
            this.executorThreadNamePrefix = executorThreadNamePrefix;
        }

        public String getSchedulerThreadNamePrefix() {
            return schedulerThreadNamePrefix;
        }

        public void setSchedulerThreadNamePrefix(String schedulerThreadNamePrefix) {
            this.schedulerThreadNamePrefix = schedulerThreadNamePrefix;
        }
    }

    /**
     * Transcription request pool configuration.
     */
    public static class TranscriptionPoolProperties {
        private int corePoolSize = 1;
        private int maxPoolSize = 2;
        private int queueCapacity = 4;
        private String threadNamePrefix = "transcription-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Device arbiter dispatch thread configuration.
     */
    public static class ArbiterPoolProperties {
        private String threadNamePrefix = "device-arbiter-";

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}

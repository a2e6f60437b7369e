package com.phillippitts.voicecapture.config;

import com.phillippitts.voicecapture.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;

/**
 * Configuration for the executors that drive the recording lifecycle.
 *
 * <p>Pool settings come from {@link ThreadPoolProperties} ({@code threadpool.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Single-threaded executor serializing all recording state transitions.
     *
     * <p>Exactly one worker thread: tasks run in submission order, so the orchestrator never
     * observes two transitions at once. The queue is bounded; a full queue rejects the task
     * rather than running it on the caller, which would break the ordering.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext from the submitting thread to the worker
     * so the session id appears in orchestration logs.
     *
     * @return executor for recording orchestration
     */
    @Bean(name = "recordingExecutor")
    public ThreadPoolTaskExecutor recordingExecutor() {
        ThreadPoolProperties.RecordingPoolProperties props = threadPoolProperties.getRecording();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getExecutorThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler for the recording timeout, live duration ticks and the success display timer.
     * Scheduled tasks only hand work back to {@code recordingExecutor}.
     *
     * @return scheduler for recording timers
     * @since 1.1
     */
    @Bean(name = "recordingScheduler")
    public ThreadPoolTaskScheduler recordingScheduler() {
        ThreadPoolProperties.RecordingPoolProperties props = threadPoolProperties.getRecording();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix(props.getSchedulerThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Pool running transcription requests off the recording executor.
     *
     * <p>The orchestrator hands each request here and resumes on {@code recordingExecutor}
     * when the result arrives, so cancel and timers stay responsive during a slow upload.
     * A full pool rejects the request instead of running it on the caller; the orchestrator
     * turns the rejection into a retryable error.
     *
     * @return executor for transcription requests
     */
    @Bean(name = "transcriptionExecutor")
    public ThreadPoolTaskExecutor transcriptionExecutor() {
        ThreadPoolProperties.TranscriptionPoolProperties props = threadPoolProperties.getTranscription();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Single thread delivering device focus changes to their listeners.
     *
     * @return executor for arbiter notifications
     */
    @Bean(name = "arbiterExecutor")
    public ThreadPoolTaskExecutor arbiterExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix(threadPoolProperties.getArbiter().getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}

package com.phillippitts.voicecapture.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the recording executor's queue via Micrometer.
 *
 * <ul>
 *   <li>recording.pool.active - 1 while a recording command or timer task is running</li>
 *   <li>recording.pool.queued - tasks waiting behind it</li>
 *   <li>recording.pool.completed - cumulative count of completed tasks</li>
 *   <li>recording.pool.queue.remaining - free slots before new commands are rejected</li>
 * </ul>
 *
 * <p>A growing queue means a transcription request is blocking the orchestration thread.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> recordingExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("recordingExecutor") ObjectProvider<ThreadPoolTaskExecutor> recordingExecutorProvider) {
        this.recordingExecutorProvider = recordingExecutorProvider;
    }

    @Bean
    public MeterBinder recordingExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = recordingExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("recording.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Recording tasks currently executing")
                    .register(registry);

            Gauge.builder("recording.pool.queued", executor, e -> e.getQueue().size())
                    .description("Recording tasks waiting in the queue")
                    .register(registry);

            Gauge.builder("recording.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed recording tasks")
                    .register(registry);

            Gauge.builder("recording.pool.queue.remaining", executor, e -> e.getQueue().remainingCapacity())
                    .description("Free queue slots before recording commands are rejected")
                    .register(registry);

            LOG.info("Recording thread pool metrics registered: recording.pool.*");
        };
    }
}

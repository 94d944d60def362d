package com.phillippitts.streamwatch.config;

import com.phillippitts.streamwatch.config.properties.ThreadPoolProperties;
import com.phillippitts.streamwatch.service.schedule.PriorityLane;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the lane workers and for event offload.
 *
 * <p>Both pools copy the Log4j2 ThreadContext (MDC) of the submitting thread into the worker thread so that
 * channel and request correlation keys survive the hand-off.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * One thread per lane worker. Workers block on their queue for the lifetime of the context, so the pool has
     * no task queue and is sized exactly to {@link PriorityLane#totalWorkers()}.
     *
     * <p>Shutdown interrupts the workers instead of waiting for them, since a blocked {@code take()} never
     * completes on its own.
     */
    @Bean(name = "laneWorkerExecutor")
    public ThreadPoolTaskExecutor laneWorkerExecutor() {
        ThreadPoolProperties.LanePoolProperties laneProps = threadPoolProperties.getLane();
        int workers = PriorityLane.totalWorkers();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(laneProps.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(laneProps.getAwaitTerminationSeconds());
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Bounded pool for fire-and-forget work triggered from the scheduler or the REST layer: notification
     * delivery, resume re-checks after a recording ends and immediate checks after monitoring is started.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When pool and queue are full, the
     * submitting thread runs the task, giving backpressure instead of dropping it.
     */
    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolProperties.EventPoolProperties eventProps = threadPoolProperties.getEvent();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(eventProps.getCorePoolSize());
        executor.setMaxPoolSize(eventProps.getMaxPoolSize());
        executor.setQueueCapacity(eventProps.getQueueCapacity());
        executor.setThreadNamePrefix(eventProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(eventProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
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

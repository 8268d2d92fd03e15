package com.phillippitts.collabscribe.config;

import com.phillippitts.collabscribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the threads that drive a transcription session.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor that drains the session command queue.
     *
     * <p>Pool sizing configured via {@code threadpool.command.*} properties. One thread is enough:
     * the command queue runs at most one drain at a time no matter how many threads the executor has.
     *
     * <p>Rejection policy: {@link #callerRunsUnlessShutdown()}
     * When the pool and queue are full, the submitting thread drains the queue itself,
     * providing backpressure instead of dropping recognition events. Once the executor is shut
     * down the drain is rejected outright, so callers waiting on a session command fail fast
     * instead of waiting on a drain that never starts.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread so session and request ids survive the hop.
     *
     * @return Configured executor for session commands
     */
    @Bean(name = "sessionCommandExecutor")
    public ThreadPoolTaskExecutor sessionCommandExecutor() {
        ThreadPoolProperties.CommandPoolProperties props = threadPoolProperties.getCommand();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(callerRunsUnlessShutdown());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler for interim flush ticks.
     *
     * <p>Ticks only enqueue a flush command; they never touch session state directly.
     *
     * @return Configured scheduler for flush ticks
     */
    @Bean(name = "flushTaskScheduler")
    public ThreadPoolTaskScheduler flushTaskScheduler() {
        ThreadPoolProperties.SchedulerPoolProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Like {@link ThreadPoolExecutor.CallerRunsPolicy}, except that a shut-down pool throws
     * {@link RejectedExecutionException} where the JDK policy silently drops the task.
     */
    static RejectedExecutionHandler callerRunsUnlessShutdown() {
        return (runnable, pool) -> {
            if (pool.isShutdown()) {
                throw new RejectedExecutionException("Session command executor is shut down");
            }
            runnable.run();
        };
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

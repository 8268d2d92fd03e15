package com.phillippitts.collabscribe.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the session command executor through Micrometer.
 *
 * <ul>
 *   <li>collabscribe.command.pool.size - threads currently in the pool</li>
 *   <li>collabscribe.command.pool.active - threads draining commands</li>
 *   <li>collabscribe.command.pool.queued - drain tasks waiting for a thread</li>
 *   <li>collabscribe.command.pool.completed - drain tasks completed so far</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> commandExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("sessionCommandExecutor") ObjectProvider<ThreadPoolTaskExecutor> commandExecutorProvider) {
        this.commandExecutorProvider = commandExecutorProvider;
    }

    @Bean
    public MeterBinder sessionCommandExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = commandExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("collabscribe.command.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the session command pool")
                    .register(registry);

            Gauge.builder("collabscribe.command.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Threads currently draining session commands")
                    .register(registry);

            Gauge.builder("collabscribe.command.pool.queued", executor, e -> e.getQueue().size())
                    .description("Drain tasks waiting for a thread")
                    .register(registry);

            Gauge.builder("collabscribe.command.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed drain tasks")
                    .register(registry);

            LOG.info("Session command pool metrics registered: collabscribe.command.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = commandExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Session command pool: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}

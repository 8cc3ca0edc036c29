package com.phillippitts.telesession.config;

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
 * Exposes analysis executor metrics via Micrometer:
 * <ul>
 *   <li>analysis.pool.size - Current number of threads in the pool</li>
 *   <li>analysis.pool.active - Number of actively executing analysis calls</li>
 *   <li>analysis.pool.queued - Number of analysis calls waiting in the queue</li>
 *   <li>analysis.pool.completed - Cumulative count of completed analysis calls</li>
 * </ul>
 *
 * <p>Available via {@code GET /actuator/metrics/analysis.pool.active}. A health summary is
 * also logged every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> analysisExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("analysisExecutor") ObjectProvider<ThreadPoolTaskExecutor> analysisExecutorProvider) {
        this.analysisExecutorProvider = analysisExecutorProvider;
    }

    @Bean
    public MeterBinder analysisExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = analysisExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("analysis.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the analysis pool")
                    .register(registry);

            Gauge.builder("analysis.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively running analysis calls")
                    .register(registry);

            Gauge.builder("analysis.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of analysis calls waiting in the queue")
                    .register(registry);

            Gauge.builder("analysis.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed analysis calls")
                    .register(registry);

            LOG.info("Analysis thread pool metrics registered: analysis.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = analysisExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Analysis Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}

package com.phillippitts.telesession.config;

import com.phillippitts.telesession.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools of the session layer.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Bounded pool that runs calls to the analysis collaborator.
     *
     * <p>Pool sizing is configured via {@code threadpool.analysis.*} properties.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}
     * When the pool and queue are full, the submission fails at once and the frame degrades
     * to an analysis failure. Socket threads never run analysis calls themselves.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext from the submitting thread so that
     * {@code sessionId} stays on analysis logs.
     *
     * @return configured executor for analysis calls
     */
    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor() {
        ThreadPoolProperties.AnalysisPoolProperties props = threadPoolProperties.getAnalysis();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(threadContextDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler for lifecycle sweeps and client reconnect retries.
     *
     * @return configured scheduler, also used for {@code @Scheduled} methods
     */
    @Bean(name = {"sessionScheduler", "taskScheduler"})
    public ThreadPoolTaskScheduler sessionScheduler() {
        ThreadPoolProperties.SchedulerPoolProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setTaskDecorator(threadContextDecorator());
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Clock used for deadlines, throttling windows and session timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static TaskDecorator threadContextDecorator() {
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

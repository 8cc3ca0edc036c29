package com.phillippitts.telesession.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the analysis executor and the session scheduler.
 * Defaults are conservative but can be adjusted based on hardware and workload.
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private AnalysisPoolProperties analysis = new AnalysisPoolProperties();
    @Valid
    private SchedulerPoolProperties scheduler = new SchedulerPoolProperties();

    public AnalysisPoolProperties getAnalysis() {
        return analysis;
    }

    public void setAnalysis(AnalysisPoolProperties analysis) {
        this.analysis = analysis;
    }

    public SchedulerPoolProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerPoolProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Analysis executor pool configuration. One analysis request is in flight per session
     * at most, so the pool bounds how many sessions are analysed concurrently.
     */
    public static class AnalysisPoolProperties {
        @Positive
        private int corePoolSize = 4;
        @Positive
        private int maxPoolSize = 16;
        @PositiveOrZero
        private int queueCapacity = 100;
        @PositiveOrZero
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "analysis-pool-";

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

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Session scheduler configuration (lifecycle sweeps, client reconnect retries).
     */
    public static class SchedulerPoolProperties {
        @Positive
        private int poolSize = 2;
        private String threadNamePrefix = "session-sched-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}

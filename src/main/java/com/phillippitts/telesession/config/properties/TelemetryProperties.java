package com.phillippitts.telesession.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the streaming telemetry pipeline.
 *
 * <p>Properties:
 * <ul>
 *   <li>telemetry.min-interval-ms - minimum gap between accepted frames per session (default: 500)</li>
 *   <li>telemetry.analysis-timeout-ms - analysis call timeout (default: 5000)</li>
 *   <li>telemetry.analysis.url - analysis endpoint; unset means analysis is unavailable</li>
 *   <li>telemetry.analysis.connect-timeout-ms - HTTP connect timeout (default: 2000)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "telemetry")
public class TelemetryProperties {

    @Positive(message = "Minimum frame interval must be positive")
    private long minIntervalMs = 500;

    @Positive(message = "Analysis timeout must be positive")
    private long analysisTimeoutMs = 5_000;

    @Valid
    private Analysis analysis = new Analysis();

    public long getMinIntervalMs() {
        return minIntervalMs;
    }

    public void setMinIntervalMs(long minIntervalMs) {
        this.minIntervalMs = minIntervalMs;
    }

    public long getAnalysisTimeoutMs() {
        return analysisTimeoutMs;
    }

    public void setAnalysisTimeoutMs(long analysisTimeoutMs) {
        this.analysisTimeoutMs = analysisTimeoutMs;
    }

    public Analysis getAnalysis() {
        return analysis;
    }

    public void setAnalysis(Analysis analysis) {
        this.analysis = analysis;
    }

    /**
     * Remote analysis collaborator settings.
     */
    public static class Analysis {
        private String url;

        @Positive
        private int connectTimeoutMs = 2_000;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }
    }
}

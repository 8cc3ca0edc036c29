package com.phillippitts.telesession.config.telemetry;

import com.phillippitts.telesession.config.properties.TelemetryProperties;
import com.phillippitts.telesession.service.telemetry.AnalysisClient;
import com.phillippitts.telesession.service.telemetry.LoggingTelemetryPersistence;
import com.phillippitts.telesession.service.telemetry.RemoteAnalysisClient;
import com.phillippitts.telesession.service.telemetry.TelemetryMessageCodec;
import com.phillippitts.telesession.service.telemetry.TelemetryPersistence;
import com.phillippitts.telesession.service.telemetry.UnavailableAnalysisClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the telemetry collaborators: the analysis client and the persistence hook.
 *
 * <p>With {@code telemetry.analysis.url} set, frames go to {@link RemoteAnalysisClient};
 * otherwise {@link UnavailableAnalysisClient} is used and every accepted frame degrades to an
 * {@code analysis-pending} update. Both beans back off when the application defines its own.
 */
@Configuration
public class TelemetryConfig {

    private static final Logger LOG = LogManager.getLogger(TelemetryConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public AnalysisClient analysisClient(TelemetryProperties properties,
                                         RestTemplateBuilder restTemplateBuilder,
                                         TelemetryMessageCodec codec) {
        TelemetryProperties.Analysis analysis = properties.getAnalysis();
        if (!analysis.isConfigured()) {
            LOG.warn("telemetry.analysis.url not set; live analysis is unavailable");
            return new UnavailableAnalysisClient();
        }
        LOG.info("Analysis collaborator at {}", analysis.getUrl());
        return new RemoteAnalysisClient(
                restTemplateBuilder
                        .setConnectTimeout(Duration.ofMillis(analysis.getConnectTimeoutMs()))
                        .setReadTimeout(Duration.ofMillis(properties.getAnalysisTimeoutMs()))
                        .build(),
                analysis.getUrl(),
                codec);
    }

    @Bean
    @ConditionalOnMissingBean
    public TelemetryPersistence telemetryPersistence() {
        return new LoggingTelemetryPersistence();
    }
}

package com.phillippitts.telesession.service.health;

import com.phillippitts.telesession.domain.SessionState;
import com.phillippitts.telesession.service.session.SessionRegistry;
import com.phillippitts.telesession.service.telemetry.AnalysisClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health indicator for the session layer.
 *
 * <ul>
 *   <li>UP: signaling is available and the analysis collaborator is configured</li>
 *   <li>DEGRADED: signaling works, but telemetry only yields pending updates</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health as {@code sessions}.
 */
@Component("sessions")
public class SessionHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final SessionRegistry registry;
    private final AnalysisClient analysisClient;

    public SessionHealthIndicator(SessionRegistry registry, AnalysisClient analysisClient) {
        this.registry = registry;
        this.analysisClient = analysisClient;
    }

    @Override
    public Health health() {
        Map<SessionState, Integer> counts = registry.countByState();
        int reconnecting = counts.getOrDefault(SessionState.RECONNECTING, 0);
        int connected = counts.getOrDefault(SessionState.CONNECTED, 0);

        Health.Builder builder = analysisClient.isAvailable()
                ? Health.up().withDetail("analysis", "available")
                : Health.status(DEGRADED).withDetail("analysis", "not configured");

        return builder
                .withDetail("sessions", registry.size())
                .withDetail("connected", connected)
                .withDetail("reconnecting", reconnecting)
                .withDetail("byState", counts)
                .build();
    }
}

package com.phillippitts.telesession.service.events;

import com.phillippitts.telesession.service.signaling.event.SignalingErrorEvent;
import com.phillippitts.telesession.service.telemetry.event.AnalysisFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central handler for error events. Content-free and throttled to avoid log spam when a
 * misbehaving client or a failing analysis endpoint produces the same error repeatedly.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Clock clock;

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onSignalingError(SignalingErrorEvent e) {
        String key = "signaling-" + e.code() + '-' + e.sessionId();
        if (shouldLog(key)) {
            LOG.warn("Signaling error: code={}, session={}, channel={}: {}",
                    e.code().wireName(), e.sessionId(), e.channelId(), e.message());
        }
    }

    @EventListener
    void onAnalysisFailure(AnalysisFailureEvent e) {
        String key = "analysis-" + e.code();
        if (shouldLog(key)) {
            LOG.warn("Analysis degraded: code={}, session={}, frame={}. Check telemetry.analysis.url.",
                    e.code().wireName(), e.sessionId(), e.sequenceNumber());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}

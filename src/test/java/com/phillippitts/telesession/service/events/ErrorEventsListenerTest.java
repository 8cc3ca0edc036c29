package com.phillippitts.telesession.service.events;

import com.phillippitts.telesession.exception.ErrorCode;
import com.phillippitts.telesession.service.signaling.event.SignalingErrorEvent;
import com.phillippitts.telesession.service.telemetry.event.AnalysisFailureEvent;
import com.phillippitts.telesession.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-02T10:00:00Z");

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener(clock);

        assertThat(l.shouldLog("analysis-ANALYSIS_TIMEOUT")).isTrue();
        assertThat(l.shouldLog("analysis-ANALYSIS_TIMEOUT")).isFalse();
        assertThat(l.shouldLog("analysis-ANALYSIS_FAILURE")).isTrue();
    }

    @Test
    void logsAgainAfterThrottleWindow() {
        ErrorEventsListener l = new ErrorEventsListener(clock);
        l.shouldLog("signaling-SESSION_FULL-s-1");

        clock.advance(Duration.ofSeconds(60));
        assertThat(l.shouldLog("signaling-SESSION_FULL-s-1")).isFalse();

        clock.advanceMillis(1);
        assertThat(l.shouldLog("signaling-SESSION_FULL-s-1")).isTrue();
    }

    @Test
    void handlesEventsWithoutFailing() {
        ErrorEventsListener l = new ErrorEventsListener(clock);

        assertThatCode(() -> {
            l.onSignalingError(new SignalingErrorEvent("s-1", "ws-1", ErrorCode.SESSION_FULL, "full", clock.instant()));
            l.onSignalingError(new SignalingErrorEvent("s-1", "ws-1", ErrorCode.SESSION_FULL, "full", clock.instant()));
            l.onAnalysisFailure(new AnalysisFailureEvent("s-1", 4, ErrorCode.ANALYSIS_TIMEOUT, "slow", clock.instant()));
        }).doesNotThrowAnyException();
        assertThat(l.shouldLog("signaling-SESSION_FULL-s-1")).isFalse();
        assertThat(l.shouldLog("analysis-ANALYSIS_TIMEOUT")).isFalse();
    }
}

package com.phillippitts.telesession.service.session.event;

import com.phillippitts.telesession.domain.SessionKind;
import com.phillippitts.telesession.domain.SessionState;

import java.time.Instant;

/**
 * Published after every state change of a session, including creation ({@code from == null}).
 */
public record SessionStateChangedEvent(
        String sessionId,
        SessionKind kind,
        SessionState from,
        SessionState to,
        String trigger,
        Instant at
) {
    public SessionStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}

package com.phillippitts.telesession.service.session;

import com.phillippitts.telesession.domain.EndReason;

import java.util.Map;

/**
 * Releases per-session resources before a session becomes ENDED.
 *
 * <p>Hooks run in {@link org.springframework.core.annotation.Order} order while the session
 * lock is held, so no new message for the session can race the cleanup. Implementations may
 * add statistics to {@code details}; they end up in the
 * {@link com.phillippitts.telesession.domain.SessionSummary}.
 */
public interface SessionTeardownHook {

    void onSessionEnding(String sessionId, EndReason reason, Map<String, Object> details);
}

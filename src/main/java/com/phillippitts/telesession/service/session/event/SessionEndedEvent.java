package com.phillippitts.telesession.service.session.event;

import com.phillippitts.telesession.domain.SessionSummary;

/**
 * Published once per session, after teardown hooks ran and the state became ENDED.
 */
public record SessionEndedEvent(SessionSummary summary) {
}

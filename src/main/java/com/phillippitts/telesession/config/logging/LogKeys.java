package com.phillippitts.telesession.config.logging;

/**
 * ThreadContext keys referenced by {@code log4j2-spring.xml}.
 */
public final class LogKeys {

    public static final String REQUEST_ID = "requestId";
    public static final String SESSION_ID = "sessionId";
    public static final String PARTICIPANT_ID = "participantId";

    private LogKeys() {
    }
}

package com.phillippitts.telesession.service.session;

/**
 * Result of a {@code start-session} handshake against an existing session.
 */
public enum JoinOutcome {
    /** The participant was added to the session. */
    JOINED,
    /** The participant was already part of the session and simply re-bound. */
    ALREADY_JOINED,
    /** A dropped participant came back within the grace window. */
    RESUMED
}

package com.phillippitts.telesession.exception;

/**
 * Raised when the analysis collaborator does not answer within the configured timeout.
 * Degrades to "keep previous result"; never fails the session.
 */
public class AnalysisTimeoutException extends TeleSessionException {

    private final long timeoutMs;

    public AnalysisTimeoutException(String sessionId, long sequenceNumber, long timeoutMs) {
        super(ErrorCode.ANALYSIS_TIMEOUT,
                "Analysis of frame " + sequenceNumber + " timed out after " + timeoutMs
                        + "ms (session: " + sessionId + ")");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}

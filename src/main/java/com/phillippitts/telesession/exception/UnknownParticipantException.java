package com.phillippitts.telesession.exception;

/**
 * Thrown when a message sender is not a participant of the referenced session, or does not
 * match the participant bound to the connection.
 */
public class UnknownParticipantException extends SessionException {

    private final String participantId;

    public UnknownParticipantException(String sessionId, String participantId) {
        super(ErrorCode.UNKNOWN_PARTICIPANT, sessionId, "Unknown participant " + participantId);
        this.participantId = participantId;
    }

    public String getParticipantId() {
        return participantId;
    }
}

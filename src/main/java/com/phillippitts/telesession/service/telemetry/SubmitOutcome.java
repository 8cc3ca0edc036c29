package com.phillippitts.telesession.service.telemetry;

import java.util.Objects;

/**
 * Immediate answer to {@link TelemetryPipeline#submitFrame}.
 *
 * @param sequenceNumber sequence number of the submitted frame
 * @param status         what happened to the frame
 * @param reason         why it was throttled or rejected, {@link Reason#NONE} when accepted
 */
public record SubmitOutcome(long sequenceNumber, Status status, Reason reason) {

    public enum Status { ACCEPTED, THROTTLED, REJECTED }

    public enum Reason {
        NONE,
        /** Another analysis for the session is still running. */
        IN_FLIGHT,
        /** Less than the minimum interval since the last accepted frame. */
        INTERVAL,
        /** Duplicate or out-of-order sequence number. */
        STALE_SEQUENCE,
        /** Session unknown, ended, or not streaming. */
        SESSION_CLOSED
    }

    public SubmitOutcome {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    public static SubmitOutcome accepted(long sequenceNumber) {
        return new SubmitOutcome(sequenceNumber, Status.ACCEPTED, Reason.NONE);
    }

    public static SubmitOutcome throttled(long sequenceNumber, Reason reason) {
        return new SubmitOutcome(sequenceNumber, Status.THROTTLED, reason);
    }

    public static SubmitOutcome rejected(long sequenceNumber) {
        return new SubmitOutcome(sequenceNumber, Status.REJECTED, Reason.SESSION_CLOSED);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}

package com.phillippitts.telesession.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One captured pose frame. Sequence numbers increase strictly per session; the telemetry
 * pipeline drops frames that are not newer than the last one it has seen.
 */
public record PoseFrame(
        String sessionId,
        long sequenceNumber,
        Instant capturedAt,
        List<Keypoint> keypoints
) {

    public PoseFrame {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("sequenceNumber must not be negative, got: " + sequenceNumber);
        }
        keypoints = keypoints == null ? List.of() : List.copyOf(keypoints);
    }
}

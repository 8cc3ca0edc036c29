package com.phillippitts.telesession.domain.signal;

import java.util.Objects;

/**
 * A trickled ICE candidate, mirroring {@code RTCIceCandidateInit}.
 *
 * @param sdpMLineIndex media line index, {@code null} when absent
 */
public record IceCandidate(
        String candidate,
        String sdpMid,
        Integer sdpMLineIndex,
        String usernameFragment
) implements SignalPayload {

    public IceCandidate {
        Objects.requireNonNull(candidate, "candidate must not be null");
    }
}

package com.phillippitts.telesession.domain.signal;

import java.util.Objects;

/**
 * Session description carried by {@code offer} and {@code answer}.
 *
 * @param sdpType {@code offer} or {@code answer}; must match the enclosing message type
 * @param sdp     the SDP blob, opaque to the server
 */
public record SdpPayload(String sdpType, String sdp) implements SignalPayload {

    public SdpPayload {
        Objects.requireNonNull(sdpType, "sdpType must not be null");
        Objects.requireNonNull(sdp, "sdp must not be null");
    }
}

package com.phillippitts.telesession.domain.signal;

import java.util.List;
import java.util.Objects;

/**
 * One STUN/TURN server in {@code RTCIceServer} shape, as sent in the {@code start-session} reply.
 *
 * @param urls       one or more {@code stun:}/{@code turn:} URLs
 * @param username   TURN username, {@code null} for STUN
 * @param credential TURN credential, {@code null} for STUN
 */
public record IceServer(List<String> urls, String username, String credential) {

    public IceServer {
        Objects.requireNonNull(urls, "urls must not be null");
        if (urls.isEmpty()) {
            throw new IllegalArgumentException("urls must not be empty");
        }
        urls = List.copyOf(urls);
    }
}

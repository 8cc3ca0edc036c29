package com.phillippitts.telesession.domain.signal;

import java.util.Optional;

/**
 * Discriminator of the signaling wire protocol. Each type fixes the payload shape.
 */
public enum SignalType {
    START_SESSION("start-session"),
    OFFER("offer"),
    ANSWER("answer"),
    ICE_CANDIDATE("ice-candidate"),
    END_SESSION("end-session"),
    ERROR("error");

    private final String wireName;

    SignalType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SignalType> fromWire(String value) {
        for (SignalType type : values()) {
            if (type.wireName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

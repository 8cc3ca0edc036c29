package com.phillippitts.telesession.presentation.controller.dto;

import com.phillippitts.telesession.domain.Session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record SessionResponse(
        String sessionId,
        String state,
        String kind,
        List<String> participantIds,
        Instant createdAt,
        Instant endedAt,
        Map<String, String> metadata
) {

    public static SessionResponse from(Session session) {
        return new SessionResponse(
                session.id(),
                session.state().name(),
                session.kind().wireName(),
                new ArrayList<>(session.participantIds()),
                session.createdAt(),
                session.endedAt(),
                session.metadata());
    }
}

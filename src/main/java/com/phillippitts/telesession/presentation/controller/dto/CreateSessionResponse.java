package com.phillippitts.telesession.presentation.controller.dto;

import java.util.List;
import java.util.Map;

/**
 * Everything a client needs to open its sockets for a new session.
 */
public record CreateSessionResponse(
        String sessionId,
        String state,
        String kind,
        List<String> participantIds,
        List<Map<String, Object>> iceServers,
        String signalingPath,
        String telemetryPath
) {
}

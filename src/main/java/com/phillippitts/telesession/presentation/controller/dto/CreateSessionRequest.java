package com.phillippitts.telesession.presentation.controller.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/sessions}.
 *
 * @param kind {@code peer-call} (default) or {@code ai-call}
 */
public record CreateSessionRequest(
        @NotEmpty(message = "participantIds must contain at least one participant")
        List<String> participantIds,
        String kind,
        Map<String, String> metadata
) {
}

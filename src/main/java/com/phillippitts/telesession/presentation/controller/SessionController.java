package com.phillippitts.telesession.presentation.controller;

import com.phillippitts.telesession.config.websocket.WebSocketConfig;
import com.phillippitts.telesession.domain.EndReason;
import com.phillippitts.telesession.domain.Session;
import com.phillippitts.telesession.domain.SessionKind;
import com.phillippitts.telesession.presentation.controller.dto.CreateSessionRequest;
import com.phillippitts.telesession.presentation.controller.dto.CreateSessionResponse;
import com.phillippitts.telesession.presentation.controller.dto.SessionResponse;
import com.phillippitts.telesession.presentation.controller.dto.SessionSummaryResponse;
import com.phillippitts.telesession.service.session.SessionLifecycleService;
import com.phillippitts.telesession.service.signaling.IceServerCatalog;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * REST surface for session lifecycle: create, end, inspect and list sessions, and fetch the
 * ICE server configuration.
 */
@RestController
@RequestMapping("/api/v1/sessions")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final SessionLifecycleService lifecycle;
    private final IceServerCatalog iceServers;

    SessionController(SessionLifecycleService lifecycle, IceServerCatalog iceServers) {
        this.lifecycle = lifecycle;
        this.iceServers = iceServers;
    }

    @PostMapping
    ResponseEntity<CreateSessionResponse> create(@Valid @RequestBody CreateSessionRequest request) {
        SessionKind kind = request.kind() == null || request.kind().isBlank()
                ? SessionKind.PEER_CALL
                : SessionKind.fromWire(request.kind());
        Session session = lifecycle.startSession(request.participantIds(), kind, request.metadata());
        LOG.info("Created session {} via API", session.id());
        return ResponseEntity.status(HttpStatus.CREATED).body(new CreateSessionResponse(
                session.id(),
                session.state().name(),
                session.kind().wireName(),
                new ArrayList<>(session.participantIds()),
                iceServers.servers(),
                WebSocketConfig.SIGNALING_PATH,
                WebSocketConfig.TELEMETRY_PATH + "?sessionId=" + session.id()));
    }

    @PostMapping("/{sessionId}/end")
    ResponseEntity<SessionSummaryResponse> end(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionSummaryResponse.from(lifecycle.endSession(sessionId, EndReason.API_REQUEST)));
    }

    @GetMapping("/{sessionId}")
    ResponseEntity<SessionResponse> get(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionResponse.from(lifecycle.getSession(sessionId)));
    }

    @GetMapping
    ResponseEntity<List<SessionResponse>> list() {
        return ResponseEntity.ok(lifecycle.activeSessions().stream().map(SessionResponse::from).toList());
    }

    @GetMapping("/ice-servers")
    ResponseEntity<Map<String, Object>> iceServers() {
        return ResponseEntity.ok(Map.of("iceServers", iceServers.servers()));
    }
}

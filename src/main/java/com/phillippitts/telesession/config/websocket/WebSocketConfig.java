package com.phillippitts.telesession.config.websocket;

import com.phillippitts.telesession.config.properties.SignalingProperties;
import com.phillippitts.telesession.presentation.websocket.SignalingWebSocketHandler;
import com.phillippitts.telesession.presentation.websocket.TelemetryWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the signaling and telemetry socket endpoints.
 *
 * <p>Allowed origins come from {@code signaling.allowed-origins} and are applied as origin
 * patterns, so {@code *} and wildcard hosts both work.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String SIGNALING_PATH = "/ws/signaling";
    public static final String TELEMETRY_PATH = "/ws/telemetry";

    private final SignalingWebSocketHandler signalingHandler;
    private final TelemetryWebSocketHandler telemetryHandler;
    private final SignalingProperties properties;

    public WebSocketConfig(SignalingWebSocketHandler signalingHandler,
                           TelemetryWebSocketHandler telemetryHandler,
                           SignalingProperties properties) {
        this.signalingHandler = signalingHandler;
        this.telemetryHandler = telemetryHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = properties.getAllowedOrigins().toArray(new String[0]);
        registry.addHandler(signalingHandler, SIGNALING_PATH).setAllowedOriginPatterns(origins);
        registry.addHandler(telemetryHandler, TELEMETRY_PATH).setAllowedOriginPatterns(origins);
    }
}

package com.phillippitts.telesession.service.signaling;

import com.phillippitts.telesession.config.properties.SignalingProperties;
import com.phillippitts.telesession.domain.signal.IceServer;
import com.phillippitts.telesession.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * STUN/TURN servers handed to clients, in {@code RTCIceServer} shape.
 */
@Component
public class IceServerCatalog {

    private static final Logger LOG = LogManager.getLogger(IceServerCatalog.class);

    private final List<Map<String, Object>> servers;
    private final List<IceServer> iceServers;

    public IceServerCatalog(SignalingProperties properties) {
        List<Map<String, Object>> list = new ArrayList<>();
        List<IceServer> typed = new ArrayList<>();
        for (SignalingProperties.IceServer server : properties.getIceServers()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("urls", List.copyOf(server.getUrls()));
            if (server.getUsername() != null) {
                entry.put("username", server.getUsername());
            }
            if (server.getCredential() != null) {
                entry.put("credential", server.getCredential());
            }
            list.add(Map.copyOf(entry));
            typed.add(new IceServer(server.getUrls(), server.getUsername(), server.getCredential()));
            LOG.info("ICE server {} (username={}, credential={})", server.getUrls(),
                    server.getUsername(), LogSanitizer.mask(server.getCredential()));
        }
        this.servers = List.copyOf(list);
        this.iceServers = List.copyOf(typed);
    }

    /**
     * Servers as maps with {@code urls}, and {@code username}/{@code credential} for TURN.
     */
    public List<Map<String, Object>> servers() {
        return servers;
    }

    /**
     * Servers for the {@code start-session} reply payload.
     */
    public List<IceServer> iceServers() {
        return iceServers;
    }
}

package com.phillippitts.telesession.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the signaling side of the session layer.
 *
 * <p>Properties:
 * <ul>
 *   <li>signaling.reconnect-grace-ms - how long a dropped participant may resume (default: 30000)</li>
 *   <li>signaling.ended-retention-ms - how long ended sessions stay queryable (default: 60000)</li>
 *   <li>signaling.negotiation-timeout-ms - max time from creation to connected (default: 120000)</li>
 *   <li>signaling.sweep-interval-ms - lifecycle sweep period (default: 1000)</li>
 *   <li>signaling.ice-buffer-capacity - held ICE candidates per recipient (default: 64)</li>
 *   <li>signaling.pending-message-capacity - held messages per absent participant (default: 128)</li>
 *   <li>signaling.ice-servers[n].urls / username / credential - STUN/TURN servers handed to clients</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "signaling")
public class SignalingProperties {

    @Positive(message = "Reconnect grace must be positive")
    private long reconnectGraceMs = 30_000;

    @Positive(message = "Ended-session retention must be positive")
    private long endedRetentionMs = 60_000;

    @Positive(message = "Negotiation timeout must be positive")
    private long negotiationTimeoutMs = 120_000;

    @Positive(message = "Sweep interval must be positive")
    private long sweepIntervalMs = 1_000;

    @Positive(message = "ICE buffer capacity must be positive")
    private int iceBufferCapacity = 64;

    @Positive(message = "Pending message capacity must be positive")
    private int pendingMessageCapacity = 128;

    /** Origins allowed to open signaling and telemetry sockets. */
    @NotEmpty
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    @Valid
    private List<IceServer> iceServers = new ArrayList<>(List.of(IceServer.stun("stun:stun.l.google.com:19302")));

    public long getReconnectGraceMs() {
        return reconnectGraceMs;
    }

    public void setReconnectGraceMs(long reconnectGraceMs) {
        this.reconnectGraceMs = reconnectGraceMs;
    }

    public long getEndedRetentionMs() {
        return endedRetentionMs;
    }

    public void setEndedRetentionMs(long endedRetentionMs) {
        this.endedRetentionMs = endedRetentionMs;
    }

    public long getNegotiationTimeoutMs() {
        return negotiationTimeoutMs;
    }

    public void setNegotiationTimeoutMs(long negotiationTimeoutMs) {
        this.negotiationTimeoutMs = negotiationTimeoutMs;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public int getIceBufferCapacity() {
        return iceBufferCapacity;
    }

    public void setIceBufferCapacity(int iceBufferCapacity) {
        this.iceBufferCapacity = iceBufferCapacity;
    }

    public int getPendingMessageCapacity() {
        return pendingMessageCapacity;
    }

    public void setPendingMessageCapacity(int pendingMessageCapacity) {
        this.pendingMessageCapacity = pendingMessageCapacity;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public List<IceServer> getIceServers() {
        return iceServers;
    }

    public void setIceServers(List<IceServer> iceServers) {
        this.iceServers = iceServers;
    }

    /**
     * One STUN or TURN server. TURN servers need {@code username} and {@code credential}.
     */
    public static class IceServer {
        @NotEmpty
        private List<String> urls = new ArrayList<>();
        private String username;
        private String credential;

        static IceServer stun(String url) {
            IceServer server = new IceServer();
            server.setUrls(new ArrayList<>(List.of(url)));
            return server;
        }

        public List<String> getUrls() {
            return urls;
        }

        public void setUrls(List<String> urls) {
            this.urls = urls;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getCredential() {
            return credential;
        }

        public void setCredential(String credential) {
            this.credential = credential;
        }
    }
}

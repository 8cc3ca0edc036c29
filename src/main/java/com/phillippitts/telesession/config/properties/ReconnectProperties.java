package com.phillippitts.telesession.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Client-side reconnect policy used by {@code SignalingClient}.
 *
 * <p>Delay for attempt {@code n} (1-based) is {@code min(maxDelay, baseDelay * factor^(n-1))},
 * then jittered by {@code ±jitter}.
 */
@Validated
@ConfigurationProperties(prefix = "reconnect")
public class ReconnectProperties {

    @Positive
    private long baseDelayMs = 1_000;

    @DecimalMin("1.0")
    private double factor = 2.0;

    @Positive
    private long maxDelayMs = 30_000;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitter = 0.2;

    @Positive
    private int maxAttempts = 10;

    /** Signaling endpoint the Java client connects to. */
    private String signalingUrl = "ws://localhost:8080/ws/signaling";

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
        this.baseDelayMs = baseDelayMs;
    }

    public double getFactor() {
        return factor;
    }

    public void setFactor(double factor) {
        this.factor = factor;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
        this.maxDelayMs = maxDelayMs;
    }

    public double getJitter() {
        return jitter;
    }

    public void setJitter(double jitter) {
        this.jitter = jitter;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public String getSignalingUrl() {
        return signalingUrl;
    }

    public void setSignalingUrl(String signalingUrl) {
        this.signalingUrl = signalingUrl;
    }
}

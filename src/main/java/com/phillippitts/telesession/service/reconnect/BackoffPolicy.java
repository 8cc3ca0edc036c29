package com.phillippitts.telesession.service.reconnect;

import com.phillippitts.telesession.config.properties.ReconnectProperties;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Bounded exponential backoff with symmetric jitter.
 *
 * <p>Attempt {@code n} (1-based) waits {@code min(maxDelay, baseDelay * factor^(n-1))}, scaled
 * by a random factor in {@code [1 - jitter, 1 + jitter)} and clamped to {@code maxDelay}.
 *
 * @param maxAttempts retries allowed before the reconnect is reported as exhausted
 */
public record BackoffPolicy(Duration baseDelay, double factor, Duration maxDelay, double jitter, int maxAttempts) {

    public BackoffPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be below baseDelay");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("factor must be >= 1.0, got: " + factor);
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be within [0, 1], got: " + jitter);
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, got: " + maxAttempts);
        }
    }

    public static BackoffPolicy from(ReconnectProperties properties) {
        return new BackoffPolicy(
                Duration.ofMillis(properties.getBaseDelayMs()),
                properties.getFactor(),
                Duration.ofMillis(properties.getMaxDelayMs()),
                properties.getJitter(),
                properties.getMaxAttempts());
    }

    /**
     * Delay before the given attempt without jitter.
     */
    public Duration nominalDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based, got: " + attempt);
        }
        double millis = baseDelay.toMillis() * Math.pow(factor, attempt - 1);
        return Duration.ofMillis((long) Math.min(maxDelay.toMillis(), millis));
    }

    /**
     * Delay before the given attempt.
     *
     * @param random source of uniform values in {@code [0, 1)}
     */
    public Duration delayFor(int attempt, DoubleSupplier random) {
        long nominal = nominalDelay(attempt).toMillis();
        double scale = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        long jittered = Math.round(nominal * scale);
        return Duration.ofMillis(Math.max(0L, Math.min(maxDelay.toMillis(), jittered)));
    }

    public boolean allowsAttempt(int attempt) {
        return attempt <= maxAttempts;
    }
}

package com.phillippitts.telesession.service.reconnect;

import com.phillippitts.telesession.config.properties.ReconnectProperties;
import com.phillippitts.telesession.exception.SocketDroppedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleSupplier;

/**
 * Retries a dropped signaling connection with {@link BackoffPolicy} delays.
 *
 * <p>Each run schedules attempts on the session scheduler. Before every attempt the run checks
 * its {@link CancellationToken} and the caller's "still reconnecting" check, so an explicit
 * end-session or a session that already left RECONNECTING stops further retries. Cancelling
 * the token also cancels the pending scheduled attempt.
 *
 * <p>Exactly one {@link ReconnectListener} callback fires per run.
 *
 * @since 1.0
 */
@Component
public class ReconnectManager {

    private static final Logger LOG = LogManager.getLogger(ReconnectManager.class);

    /**
     * One reconnect attempt. Returning normally means the connection is back.
     */
    @FunctionalInterface
    public interface Connector {
        void connect() throws Exception;
    }

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final BackoffPolicy policy;
    private final DoubleSupplier random;

    @Autowired
    public ReconnectManager(@Qualifier("sessionScheduler") TaskScheduler scheduler,
                            Clock clock,
                            ReconnectProperties properties) {
        this(scheduler, clock, BackoffPolicy.from(properties), () -> ThreadLocalRandom.current().nextDouble());
    }

    public ReconnectManager(TaskScheduler scheduler, Clock clock, BackoffPolicy policy, DoubleSupplier random) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public BackoffPolicy getPolicy() {
        return policy;
    }

    /**
     * Starts a reconnect run. The first attempt happens after the attempt-1 delay.
     *
     * @param connector          performs one attempt
     * @param stillReconnecting  {@code false} once the session left RECONNECTING by other means
     * @param token              cancelled when the session is ended explicitly
     * @param listener           receives the outcome
     */
    public void start(Connector connector,
                      BooleanSupplier stillReconnecting,
                      CancellationToken token,
                      ReconnectListener listener) {
        resume(0, connector, stillReconnecting, token, listener);
    }

    /**
     * Continues a reconnect budget of which {@code attemptsMade} attempts were already spent,
     * e.g. when a reopened socket dropped again before the session was resumed. Delays keep
     * growing from that attempt number.
     */
    public void resume(int attemptsMade,
                       Connector connector,
                       BooleanSupplier stillReconnecting,
                       CancellationToken token,
                       ReconnectListener listener) {
        Run run = new Run(connector, stillReconnecting, token, listener);
        run.attemptsMade = attemptsMade;
        token.onCancel(run::onCancelled);
        if (!policy.allowsAttempt(attemptsMade + 1)) {
            run.exhaust(attemptsMade, new SocketDroppedException(
                    "Signaling socket dropped with no reconnect attempts left"));
            return;
        }
        run.scheduleAttempt(attemptsMade + 1);
    }

    private final class Run {

        private final Connector connector;
        private final BooleanSupplier stillReconnecting;
        private final CancellationToken token;
        private final ReconnectListener listener;
        private final AtomicReference<ScheduledFuture<?>> pending = new AtomicReference<>();
        private final AtomicBoolean finished = new AtomicBoolean();
        private volatile int attemptsMade;

        Run(Connector connector, BooleanSupplier stillReconnecting, CancellationToken token, ReconnectListener listener) {
            this.connector = connector;
            this.stillReconnecting = stillReconnecting;
            this.token = token;
            this.listener = listener;
        }

        void scheduleAttempt(int attempt) {
            if (token.isCancelled()) {
                abandon();
                return;
            }
            Duration delay = policy.delayFor(attempt, random);
            LOG.info("Reconnect attempt {}/{} in {}ms", attempt, policy.maxAttempts(), delay.toMillis());
            pending.set(scheduler.schedule(() -> attempt(attempt), clock.instant().plus(delay)));
        }

        void attempt(int attempt) {
            if (finished.get()) {
                return;
            }
            if (token.isCancelled() || !stillReconnecting.getAsBoolean()) {
                abandon();
                return;
            }
            attemptsMade = attempt;
            try {
                connector.connect();
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                LOG.warn("Reconnect attempt {} failed: {}", attempt, e.getMessage());
                if (policy.allowsAttempt(attempt + 1)) {
                    scheduleAttempt(attempt + 1);
                } else {
                    exhaust(attempt, e);
                }
                return;
            }
            if (finished.compareAndSet(false, true)) {
                LOG.info("Reconnected after {} attempt(s)", attempt);
                listener.onReconnected(attempt);
            }
        }

        void onCancelled() {
            ScheduledFuture<?> future = pending.get();
            if (future != null) {
                future.cancel(false);
            }
            abandon();
        }

        void exhaust(int attempts, Throwable lastFailure) {
            if (finished.compareAndSet(false, true)) {
                LOG.error("Reconnect gave up after {} attempts", attempts);
                listener.onExhausted(attempts, lastFailure);
            }
        }

        private void abandon() {
            if (finished.compareAndSet(false, true)) {
                LOG.info("Reconnect stopped after {} attempt(s)", attemptsMade);
                listener.onAbandoned(attemptsMade);
            }
        }
    }
}

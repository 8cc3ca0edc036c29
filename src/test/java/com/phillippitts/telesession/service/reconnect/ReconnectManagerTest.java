package com.phillippitts.telesession.service.reconnect;

import com.phillippitts.telesession.config.properties.ReconnectProperties;
import com.phillippitts.telesession.exception.SocketDroppedException;
import com.phillippitts.telesession.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ReconnectManagerTest {

    private static final String START = "2026-03-02T10:00:00Z";

    private final List<Runnable> scheduled = new ArrayList<>();
    private final List<Instant> scheduledAt = new ArrayList<>();
    private final RecordingListener listener = new RecordingListener();
    private MutableClock clock;
    private ScheduledFuture<?> future;
    private ReconnectManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(START);
        future = mock(ScheduledFuture.class);
        TaskScheduler scheduler = mock(TaskScheduler.class);
        doAnswer(invocation -> {
            scheduled.add(invocation.getArgument(0));
            scheduledAt.add(invocation.getArgument(1));
            return future;
        }).when(scheduler).schedule(any(Runnable.class), any(Instant.class));
        manager = new ReconnectManager(scheduler, clock, BackoffPolicy.from(new ReconnectProperties()), () -> 0.5);
    }

    @Test
    void reconnectsOnThirdAttempt() {
        AtomicInteger calls = new AtomicInteger();
        ReconnectManager.Connector connector = () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("connection refused");
            }
        };

        manager.start(connector, () -> true, new CancellationToken(), listener);
        runScheduled(3);

        assertThat(listener.events).containsExactly("reconnected:3");
        assertThat(scheduledAt).containsExactly(
                Instant.parse(START).plusSeconds(1),
                Instant.parse(START).plusSeconds(3),
                Instant.parse(START).plusSeconds(7));
    }

    @Test
    void reportsExhaustionAfterMaxAttempts() {
        manager.start(() -> {
            throw new IOException("down");
        }, () -> true, new CancellationToken(), listener);

        runScheduled(10);

        assertThat(scheduled).hasSize(10);
        assertThat(listener.events).containsExactly("exhausted:10");
        assertThat(listener.lastFailure).isInstanceOf(IOException.class).hasMessage("down");
        assertThat(Duration.between(scheduledAt.get(4), scheduledAt.get(5))).isEqualTo(Duration.ofSeconds(30));
        assertThat(Duration.between(scheduledAt.get(8), scheduledAt.get(9))).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void cancellationStopsPendingAttempt() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        manager.start(calls::incrementAndGet, () -> true, token, listener);

        token.cancel();
        scheduled.get(0).run();

        assertThat(calls).hasValue(0);
        assertThat(listener.events).containsExactly("abandoned:0");
        verify(future).cancel(anyBoolean());
    }

    @Test
    void stopsWhenSessionLeftReconnecting() {
        AtomicInteger calls = new AtomicInteger();
        manager.start(() -> {
            calls.incrementAndGet();
            throw new IOException("down");
        }, () -> calls.get() < 2, new CancellationToken(), listener);

        runScheduled(3);

        assertThat(calls).hasValue(2);
        assertThat(listener.events).containsExactly("abandoned:2");
    }

    @Test
    void alreadyCancelledTokenNeverSchedules() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        manager.start(() -> { }, () -> true, token, listener);

        assertThat(scheduled).isEmpty();
        assertThat(listener.events).containsExactly("abandoned:0");
    }

    @Test
    void resumedRunContinuesBackoffAndBudget() {
        manager.resume(3, () -> {
            throw new IOException("down");
        }, () -> true, new CancellationToken(), listener);

        runScheduled(10);

        assertThat(scheduledAt.get(0)).isEqualTo(Instant.parse(START).plusSeconds(8));
        assertThat(scheduled).hasSize(7);
        assertThat(listener.events).containsExactly("exhausted:10");
    }

    @Test
    void resumedRunWithSpentBudgetIsExhaustedAtOnce() {
        manager.resume(10, () -> { }, () -> true, new CancellationToken(), listener);

        assertThat(scheduled).isEmpty();
        assertThat(listener.events).containsExactly("exhausted:10");
        assertThat(listener.lastFailure).isInstanceOf(SocketDroppedException.class);
    }

    private void runScheduled(int count) {
        for (int i = 0; i < count && i < scheduled.size(); i++) {
            clock.advance(Duration.between(clock.instant(), scheduledAt.get(i)));
            scheduled.get(i).run();
        }
    }

    private static final class RecordingListener implements ReconnectListener {
        final List<String> events = new ArrayList<>();
        Throwable lastFailure;

        @Override
        public void onReconnected(int attempts) {
            events.add("reconnected:" + attempts);
        }

        @Override
        public void onExhausted(int attempts, Throwable lastError) {
            events.add("exhausted:" + attempts);
            lastFailure = lastError;
        }

        @Override
        public void onAbandoned(int attempts) {
            events.add("abandoned:" + attempts);
        }
    }
}

package com.phillippitts.telesession.service.signaling;

import com.phillippitts.telesession.domain.signal.SignalMessage;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Bounded FIFO of ICE candidates for one recipient, held until that recipient has applied
 * its remote description.
 *
 * <p>Before {@link #flush()} candidates are buffered; once the capacity is reached the oldest
 * candidate is dropped. {@code flush()} drains the buffer in enqueue order and switches to
 * pass-through, so every candidate is forwarded exactly once. After {@link #discard()} the
 * buffer forwards nothing.
 *
 * <p><b>Thread Safety:</b> methods are synchronized; the forwarder runs while the monitor is held.
 *
 * @since 1.0
 */
public final class IceCandidateBuffer {

    private final int capacity;
    private final Consumer<SignalMessage> forwarder;
    private final Deque<SignalMessage> queue = new ArrayDeque<>();

    private boolean remoteDescriptionSet;
    private boolean discarded;
    private long dropped;

    /**
     * @param capacity  maximum number of held candidates; must be positive
     * @param forwarder delivers a candidate to the recipient
     */
    public IceCandidateBuffer(int capacity, Consumer<SignalMessage> forwarder) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.forwarder = Objects.requireNonNull(forwarder, "forwarder must not be null");
    }

    /**
     * Buffers the candidate, or forwards it right away once the remote description is set.
     *
     * @return {@code true} if the candidate was forwarded immediately
     */
    public synchronized boolean enqueue(SignalMessage candidate) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        if (discarded) {
            return false;
        }
        if (remoteDescriptionSet) {
            forwarder.accept(candidate);
            return true;
        }
        if (queue.size() == capacity) {
            queue.pollFirst();
            dropped++;
        }
        queue.addLast(candidate);
        return false;
    }

    /**
     * Marks the remote description as applied and forwards held candidates in order.
     *
     * @return number of candidates forwarded
     */
    public synchronized int flush() {
        if (discarded) {
            return 0;
        }
        remoteDescriptionSet = true;
        int forwarded = 0;
        SignalMessage next;
        while ((next = queue.pollFirst()) != null) {
            forwarder.accept(next);
            forwarded++;
        }
        return forwarded;
    }

    /**
     * Drops every held candidate; later calls become no-ops.
     */
    public synchronized void discard() {
        queue.clear();
        discarded = true;
    }

    public synchronized int size() {
        return queue.size();
    }

    public synchronized long droppedCount() {
        return dropped;
    }

    public synchronized boolean isRemoteDescriptionSet() {
        return remoteDescriptionSet;
    }
}

package com.phillippitts.telesession.service.telemetry;

import java.util.concurrent.Semaphore;

/**
 * Capacity-one gate that never waits: a caller either takes the only permit or is told the
 * gate is held.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * if (!gate.tryAcquire()) {
 *     return throttled(IN_FLIGHT);
 * }
 * // ... start the analysis, release the gate when it completes ...
 * }</pre>
 *
 * <p><b>Thread Safety:</b> acquisition is atomic through the underlying {@link Semaphore}.
 * {@link #release()} ignores extra releases so cancellation and completion may both call it.
 *
 * @since 1.0
 */
public final class SingleFlightGate {

    private final Semaphore semaphore = new Semaphore(1);

    /**
     * Takes the permit if it is free.
     *
     * @return {@code true} if the caller now holds the gate
     */
    public boolean tryAcquire() {
        return semaphore.tryAcquire();
    }

    /**
     * Releases the permit if it is held.
     */
    public synchronized void release() {
        if (semaphore.availablePermits() == 0) {
            semaphore.release();
        }
    }

    public boolean isHeld() {
        return semaphore.availablePermits() == 0;
    }
}

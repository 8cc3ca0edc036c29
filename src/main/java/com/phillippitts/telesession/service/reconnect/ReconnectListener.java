package com.phillippitts.telesession.service.reconnect;

/**
 * Outcome callbacks of one reconnect run. Exactly one of them is called.
 */
public interface ReconnectListener {

    void onReconnected(int attempts);

    /**
     * The retry budget ran out; the caller treats the session as ended.
     */
    void onExhausted(int attempts, Throwable lastFailure);

    /**
     * The run stopped early: the token was cancelled or the session left RECONNECTING.
     */
    default void onAbandoned(int attempts) {
    }
}

package com.phillippitts.telesession.domain.signal;

/**
 * Marker for the typed payloads of a {@link SignalMessage}. The message type decides which
 * implementation is legal; the codec enforces the pairing.
 */
public interface SignalPayload {
}

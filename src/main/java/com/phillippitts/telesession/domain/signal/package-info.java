/**
 * Wire types of the signaling protocol.
 *
 * <p>{@link com.phillippitts.telesession.domain.signal.SignalMessage} pairs a
 * {@link com.phillippitts.telesession.domain.signal.SignalType} with one typed
 * {@link com.phillippitts.telesession.domain.signal.SignalPayload}. The codec in
 * {@code service.signaling.codec} is the only place that builds these from untrusted input.
 *
 * @since 1.0
 */
package com.phillippitts.telesession.domain.signal;

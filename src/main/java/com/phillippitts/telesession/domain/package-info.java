/**
 * Immutable domain records for sessions and telemetry.
 *
 * <p>{@link com.phillippitts.telesession.domain.Session} is a snapshot; the mutable record
 * lives inside the session registry and is only changed by the session state machine.
 * Signal wire types live in {@code domain.signal}.
 *
 * @since 1.0
 */
package com.phillippitts.telesession.domain;

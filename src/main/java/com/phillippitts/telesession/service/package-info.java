/**
 * Service layer of the session system.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.session} - registry, state machine and lifecycle of sessions</li>
 *   <li>{@code service.signaling} - message codec, dispatcher, relay and ICE candidate buffering</li>
 *   <li>{@code service.telemetry} - throttled pose-frame streaming and analysis fan-out</li>
 *   <li>{@code service.reconnect} - client-side backoff and the reconnecting signaling client</li>
 *   <li>{@code service.metrics}, {@code service.health}, {@code service.events} - observability</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services use constructor injection (not field injection)</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 *   <li>All state of one session is guarded by that session's lock</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.telesession.service;

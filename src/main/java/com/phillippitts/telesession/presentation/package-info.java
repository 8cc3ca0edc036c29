/**
 * Presentation layer (REST controllers, WebSocket handlers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers and their DTOs</li>
 *   <li>{@code presentation.websocket} - socket handlers for {@code /ws/signaling} and {@code /ws/telemetry}</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.telesession.presentation;

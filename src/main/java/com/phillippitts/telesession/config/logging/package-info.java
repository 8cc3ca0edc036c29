/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.telesession.config.logging.MdcFilter} - Servlet filter
 *       that injects {@code requestId} into MDC for every HTTP request</li>
 *   <li>{@link com.phillippitts.telesession.config.logging.LogKeys} - MDC key names</li>
 * </ul>
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code sessionId} - Call session, set per socket frame and copied to analysis workers</li>
 *   <li>{@code participantId} - Participant bound to the socket or named by the request header</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 15:42:32.529 [thread-name] [requestId] [sessionId] [participantId] LEVEL logger.name - message
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.telesession.config.logging;

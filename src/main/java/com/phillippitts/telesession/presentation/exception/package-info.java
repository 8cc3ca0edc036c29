/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.telesession.exception.SessionNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.telesession.exception.SessionFullException},
 *       {@link com.phillippitts.telesession.exception.ConflictingOfferException} → 409 Conflict</li>
 *   <li>{@link com.phillippitts.telesession.exception.SessionClosedException} → 410 Gone</li>
 *   <li>Malformed input, illegal transitions, unknown participants, bean validation → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "SessionFullException",
 *   "message": "Request conflicts with the session state",
 *   "details": "Participant carol cannot join a full session (session: 6f1c...)",
 *   "timestamp": "2026-03-02T15:42:32.529Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.telesession.exception
 * @since 1.0
 */
package com.phillippitts.telesession.presentation.exception;

/**
 * Application-specific exception hierarchy.
 *
 * <p>Every exception extends {@link com.phillippitts.telesession.exception.TeleSessionException}
 * and carries an {@link com.phillippitts.telesession.exception.ErrorCode}. The same code is used
 * for socket {@code error} messages and for HTTP responses built by
 * {@code GlobalExceptionHandler}.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@code MalformedMessageException} - codec rejected an inbound message</li>
 *   <li>{@code SessionException} - rejections tied to a session: {@code ConflictingOfferException},
 *       {@code SessionFullException}, {@code SessionClosedException},
 *       {@code SessionNotFoundException}, {@code UnknownParticipantException},
 *       {@code InvalidTransitionException}</li>
 *   <li>{@code AnalysisTimeoutException}, {@code AnalysisFailureException} - telemetry
 *       degradations, never fatal</li>
 *   <li>{@code SocketDroppedException} - transport loss, handled by reconnection</li>
 * </ul>
 *
 * @see com.phillippitts.telesession.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.telesession.exception;

/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/sessions} - create a session, returns socket paths and ICE servers</li>
 *   <li>{@code POST /api/v1/sessions/{id}/end} - end a session (idempotent)</li>
 *   <li>{@code GET /api/v1/sessions/{id}} - session snapshot</li>
 *   <li>{@code GET /api/v1/sessions} - active sessions</li>
 *   <li>{@code GET /api/v1/sessions/ice-servers} - STUN/TURN configuration</li>
 * </ul>
 *
 * @see com.phillippitts.telesession.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.telesession.presentation.controller;

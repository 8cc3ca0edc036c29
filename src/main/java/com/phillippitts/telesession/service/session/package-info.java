/**
 * Session registry, state machine and lifecycle.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.telesession.service.session.SessionRegistry} - concurrent store
 *       with one lock per session</li>
 *   <li>{@link com.phillippitts.telesession.service.session.SessionStateMachine} - transition
 *       table; the only writer of session state</li>
 *   <li>{@link com.phillippitts.telesession.service.session.SessionLifecycleService} - start, end,
 *       queries and the deadline sweep</li>
 *   <li>{@link com.phillippitts.telesession.service.session.SessionTeardownHook} - per-session
 *       cleanup run before a session ends</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.telesession.service.session;

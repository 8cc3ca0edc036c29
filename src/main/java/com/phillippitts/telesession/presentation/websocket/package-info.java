/**
 * WebSocket adapters for the signaling and telemetry sockets. They translate frames and
 * closures into calls on the service layer and hold no session state of their own.
 */
package com.phillippitts.telesession.presentation.websocket;

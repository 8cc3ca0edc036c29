/**
 * Client side of the signaling protocol: backoff policy, cancellation and the reconnecting
 * WebSocket client that resumes the same session after a dropped socket.
 */
package com.phillippitts.telesession.service.reconnect;

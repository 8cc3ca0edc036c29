/**
 * Signaling between the two participants of a session: the dispatcher binds connections
 * and drives the state machine, the relay forwards or holds messages, and
 * {@link com.phillippitts.telesession.service.signaling.IceCandidateBuffer} keeps early
 * candidates until the remote description is set.
 */
package com.phillippitts.telesession.service.signaling;

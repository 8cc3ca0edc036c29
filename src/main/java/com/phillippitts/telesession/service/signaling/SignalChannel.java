package com.phillippitts.telesession.service.signaling;

import java.io.IOException;

/**
 * Outbound side of one client connection, independent of the socket technology.
 */
public interface SignalChannel {

    /**
     * Stable id of the underlying connection.
     */
    String id();

    boolean isOpen();

    /**
     * Sends one text frame.
     *
     * @throws IOException if the frame cannot be written
     */
    void send(String text) throws IOException;

    /**
     * Closes the connection; closing a closed channel does nothing.
     */
    void close() throws IOException;
}

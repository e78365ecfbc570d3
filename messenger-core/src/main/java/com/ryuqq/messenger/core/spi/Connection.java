package com.ryuqq.messenger.core.spi;

import java.io.IOException;

/**
 * Transport SPI: one pre-accepted, bidirectional, message-oriented client connection.
 *
 * <p>The network listener (TCP or local socket, WebSocket upgrade) is provided by the embedding
 * process; it hands each accepted connection to the server through this interface.
 * One call to {@link #send(byte[])} or {@link #receive()} carries exactly one protocol frame.</p>
 *
 * <p><strong>Threading:</strong></p>
 * <ul>
 *   <li>{@link #receive()} is called by a single reader thread</li>
 *   <li>{@link #send(byte[])} is called by a single writer thread</li>
 *   <li>{@link #close()} may be called from any thread and must unblock a pending {@link #receive()}</li>
 * </ul>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public interface Connection {

    /**
     * Blocks until the next inbound frame arrives.
     *
     * @return the frame, or {@code null} when the peer closed the connection
     * @throws IOException on transport failure
     */
    byte[] receive() throws IOException;

    /**
     * Writes one outbound frame.
     *
     * @param frame encoded frame
     * @throws IOException on transport failure (the connection is then considered dead)
     */
    void send(byte[] frame) throws IOException;

    /**
     * Closes the connection. Idempotent.
     */
    void close();

    /**
     * @return a short description of the peer, for logging
     */
    String describe();
}

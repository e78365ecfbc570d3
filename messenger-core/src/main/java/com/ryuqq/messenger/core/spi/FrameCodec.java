package com.ryuqq.messenger.core.spi;

import com.ryuqq.messenger.core.protocol.ClientMessage;
import com.ryuqq.messenger.core.protocol.FrameDecodingException;
import com.ryuqq.messenger.core.protocol.ServerMessage;

/**
 * Binary encoding SPI for protocol frames, shared by the server and clients.
 *
 * <p>Implementations must be thread-safe.</p>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public interface FrameCodec {

    /**
     * @param message server event
     * @return encoded frame
     */
    byte[] encodeServerMessage(ServerMessage message);

    /**
     * @param frame encoded frame
     * @return decoded client request
     * @throws FrameDecodingException if the frame is malformed or of an unknown type
     */
    ClientMessage decodeClientMessage(byte[] frame);

    /**
     * @param message client request
     * @return encoded frame
     */
    byte[] encodeClientMessage(ClientMessage message);

    /**
     * @param frame encoded frame
     * @return decoded server event
     * @throws FrameDecodingException if the frame is malformed or of an unknown type
     */
    ServerMessage decodeServerMessage(byte[] frame);
}

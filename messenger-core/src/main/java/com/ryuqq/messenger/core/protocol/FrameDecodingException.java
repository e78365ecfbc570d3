package com.ryuqq.messenger.core.protocol;

/**
 * An inbound frame could not be decoded into a protocol message.
 *
 * <p>Not fatal: the connection logs and drops the frame.</p>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public class FrameDecodingException extends RuntimeException {

    public FrameDecodingException(String message) {
        super(message);
    }

    public FrameDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}

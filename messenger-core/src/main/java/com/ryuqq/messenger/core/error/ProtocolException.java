package com.ryuqq.messenger.core.error;

/**
 * Validation or session-state failure detected by the connection layer before the store is touched.
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public class ProtocolException extends MessengerException {

    public ProtocolException(ErrorCode code, String message) {
        super(code, message, null);
    }
}

package com.ryuqq.messenger.core.error;

/**
 * Base class of all per-request failures.
 *
 * <p>Instances are caught at the request dispatch boundary and converted into an
 * {@code Error} event for the originating caller only. They never end a connection.</p>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public abstract class MessengerException extends RuntimeException {

    private final ErrorCode code;

    protected MessengerException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        this.code = code;
    }

    /**
     * @return the error code
     */
    public ErrorCode code() {
        return code;
    }
}

package com.ryuqq.messenger.core.error;

/**
 * Failure raised by a {@link com.ryuqq.messenger.core.spi.MessengerStore} operation.
 *
 * <p>Referential, permission and uniqueness failures abort the transaction before anything is
 * written. Engine failures are wrapped with code {@link ErrorCode#STORAGE} and keep the engine
 * exception as the cause.</p>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public class StoreException extends MessengerException {

    public StoreException(ErrorCode code, String message) {
        super(code, message, null);
    }

    public StoreException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }

    /**
     * Wraps a storage engine failure.
     *
     * @param operation name of the failed store operation
     * @param cause engine exception
     * @return StoreException with code STORAGE
     */
    public static StoreException storage(String operation, Throwable cause) {
        return new StoreException(ErrorCode.STORAGE, "Storage failure in " + operation, cause);
    }
}

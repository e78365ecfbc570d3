package com.ryuqq.messenger.core.error;

/**
 * Caller-facing error codes.
 *
 * <p>Each code carries the description sent to the client in an {@code Error} event.
 * {@link #INVALID_GROUP_ID} and {@link #PERMISSION_DENIED} are distinct, observable outcomes.
 * {@link #STORAGE} is opaque: the underlying engine failure is logged, never sent.</p>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /** Username contains characters other than letters, digits and underscore. */
    INVALID_USERNAME("Invalid username"),

    /** Username already taken, or the user already has a live session. */
    USERNAME_IN_USE("Username is already in use"),

    /** A message addressed to the sender itself. */
    SELF_MESSAGE("Cannot send a message to yourself"),

    /** One or more referenced user ids do not exist. */
    INVALID_USER_IDS("Invalid user ids"),

    /** The referenced group does not exist. */
    INVALID_GROUP_ID("Invalid group id"),

    /** The referenced message does not exist. */
    INVALID_MESSAGE_ID("Invalid message id"),

    /** The acting user is not allowed to perform the operation. */
    PERMISSION_DENIED("Permission denied"),

    /** Storage engine failure. */
    STORAGE("Internal server error");

    private final String description;

    ErrorCode(String description) {
        this.description = description;
    }

    /**
     * @return description sent to the client
     */
    public String description() {
        return description;
    }
}

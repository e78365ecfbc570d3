package com.ryuqq.messenger.core.model;

/**
 * 메시지 ID와 메시지의 쌍.
 *
 * @param id 메시지 ID
 * @param message 메시지
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public record MessageEntry(int id, Message message) {

    public MessageEntry {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative (current: " + id + ")");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
    }
}

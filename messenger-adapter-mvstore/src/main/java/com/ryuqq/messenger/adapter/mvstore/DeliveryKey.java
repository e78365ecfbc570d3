package com.ryuqq.messenger.adapter.mvstore;

import com.ryuqq.messenger.core.model.Recipient;

/**
 * Composite key of the delivery index: {@code (recipient kind, recipient id, sender id, message id)}.
 *
 * <p>Ordered component by component, so every entry for one recipient is contiguous, and within a
 * recipient every entry for one sender is contiguous. That makes both "all messages addressed to R"
 * and "all messages from S to R" single prefix range scans.</p>
 *
 * @param recipient recipient of the message
 * @param senderId sender of the message
 * @param messageId message id
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public record DeliveryKey(Recipient recipient, int senderId, int messageId) implements Comparable<DeliveryKey> {

    public DeliveryKey {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
    }

    /**
     * Lowest key of the range holding every entry addressed to {@code recipient}.
     */
    static DeliveryKey lowest(Recipient recipient) {
        return new DeliveryKey(recipient, 0, 0);
    }

    /**
     * Lowest key of the range holding every entry from {@code senderId} to {@code recipient}.
     */
    static DeliveryKey lowest(Recipient recipient, int senderId) {
        return new DeliveryKey(recipient, senderId, 0);
    }

    boolean hasPrefix(Recipient prefix) {
        return recipient.equals(prefix);
    }

    boolean hasPrefix(Recipient prefix, int prefixSender) {
        return recipient.equals(prefix) && senderId == prefixSender;
    }

    @Override
    public int compareTo(DeliveryKey other) {
        int result = recipient.compareTo(other.recipient);
        if (result != 0) {
            return result;
        }
        result = Integer.compare(senderId, other.senderId);
        if (result != 0) {
            return result;
        }
        return Integer.compare(messageId, other.messageId);
    }
}

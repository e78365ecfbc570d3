package com.ryuqq.messenger.application.presence;

/**
 * Outbound delivery handle of one live session.
 *
 * <p>Implementations must never block on socket I/O: the frame is queued for the owning session,
 * which writes it to its socket in enqueue order.</p>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DeliveryChannel {

    /**
     * Queues one encoded frame for the session.
     *
     * @param frame encoded server event
     * @return false if the frame was not queued (mailbox full or session gone)
     */
    boolean deliver(byte[] frame);
}

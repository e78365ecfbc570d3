package com.ryuqq.messenger.adapter.mvstore;

import com.ryuqq.messenger.core.model.Recipient;
import org.h2.mvstore.WriteBuffer;
import org.h2.mvstore.type.BasicDataType;

import java.nio.ByteBuffer;

/**
 * MVStore key type for {@link DeliveryKey}.
 *
 * <p>Fixed 13-byte layout: kind (1) | recipient id (4) | sender id (4) | message id (4).
 * Comparison delegates to {@link DeliveryKey#compareTo(DeliveryKey)}.</p>
 *
 * <p>The engine records this class name in the map metadata and re-instantiates it through
 * {@link #INSTANCE} when an existing file is reopened.</p>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public final class DeliveryKeyType extends BasicDataType<DeliveryKey> {

    public static final DeliveryKeyType INSTANCE = new DeliveryKeyType();

    public DeliveryKeyType() {
    }

    @Override
    public int getMemory(DeliveryKey key) {
        return 48;
    }

    @Override
    public void write(WriteBuffer buff, DeliveryKey key) {
        buff.put((byte) key.recipient().kind().ordinal())
            .putInt(key.recipient().id())
            .putInt(key.senderId())
            .putInt(key.messageId());
    }

    @Override
    public DeliveryKey read(ByteBuffer buff) {
        Recipient.Kind kind = Recipient.Kind.values()[buff.get()];
        int recipientId = buff.getInt();
        int senderId = buff.getInt();
        int messageId = buff.getInt();
        return new DeliveryKey(Recipient.of(kind, recipientId), senderId, messageId);
    }

    @Override
    public int compare(DeliveryKey a, DeliveryKey b) {
        return a.compareTo(b);
    }

    @Override
    public DeliveryKey[] createStorage(int size) {
        return new DeliveryKey[size];
    }
}

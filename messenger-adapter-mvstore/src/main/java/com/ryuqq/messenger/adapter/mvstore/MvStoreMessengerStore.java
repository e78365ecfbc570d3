package com.ryuqq.messenger.adapter.mvstore;

import com.ryuqq.messenger.core.error.ErrorCode;
import com.ryuqq.messenger.core.error.StoreException;
import com.ryuqq.messenger.core.model.Group;
import com.ryuqq.messenger.core.model.Message;
import com.ryuqq.messenger.core.model.MessageEntry;
import com.ryuqq.messenger.core.model.Recipient;
import com.ryuqq.messenger.core.model.Tags;
import com.ryuqq.messenger.core.model.User;
import com.ryuqq.messenger.core.spi.MessengerStore;
import org.h2.mvstore.MVStore;
import org.h2.mvstore.MVStoreException;
import org.h2.mvstore.tx.Transaction;
import org.h2.mvstore.tx.TransactionMap;
import org.h2.mvstore.tx.TransactionStore;
import org.h2.mvstore.type.ObjectDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * {@link MessengerStore} on the H2 MVStore embedded transactional key-value engine.
 *
 * <p><strong>Tables (transactional maps):</strong></p>
 * <ul>
 *   <li><strong>users:</strong> Integer → String (id → username)</li>
 *   <li><strong>usernames:</strong> String → Integer (reverse index, enforces uniqueness)</li>
 *   <li><strong>groups:</strong> Integer → Group</li>
 *   <li><strong>messages:</strong> Integer → Message</li>
 *   <li><strong>delivery_index:</strong> DeliveryKey → Boolean (one entry per message)</li>
 *   <li><strong>sequences:</strong> String → Integer (per-table high-water mark for id allocation)</li>
 * </ul>
 *
 * <p><strong>Transaction Model:</strong></p>
 * <ul>
 *   <li>One MVStore {@link Transaction} per public operation</li>
 *   <li>Writers hold the write lock: one writer transaction at a time, no write-write conflicts</li>
 *   <li>Readers share the read lock: each read operation sees a single committed state</li>
 *   <li>Any failure inside a write rolls the transaction back before the exception propagates</li>
 * </ul>
 *
 * <p><strong>Id Allocation:</strong> next id = max(last key + 1, high-water mark). Without deletions
 * this is exactly "one past the current maximum"; after the highest row is deleted its id is still
 * not handed out again.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (MessengerStore store = new MvStoreMessengerStore(MvStoreConfig.file(Path.of("chat.db")))) {
 *     int alice = store.createUser("alice");
 *     int bob = store.createUser("bob");
 *     store.sendMessage("hi", alice, Recipient.user(bob));
 * }
 * </pre>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public class MvStoreMessengerStore implements MessengerStore {

    private static final Logger log = LoggerFactory.getLogger(MvStoreMessengerStore.class);

    static final String USERS = "users";
    static final String USERNAMES = "usernames";
    static final String GROUPS = "groups";
    static final String MESSAGES = "messages";
    static final String DELIVERY_INDEX = "delivery_index";
    static final String SEQUENCES = "sequences";

    private final MVStore mvStore;
    private final TransactionStore transactionStore;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    /**
     * 생성자 (시스템 UTC 시계 사용).
     *
     * @param config 저장소 설정
     */
    public MvStoreMessengerStore(MvStoreConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 생성자 (커스텀 Clock 주입).
     *
     * @param config 저장소 설정
     * @param clock 메시지 타임스탬프용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     * @throws StoreException 엔진을 열 수 없는 경우 (STORAGE)
     */
    public MvStoreMessengerStore(MvStoreConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;

        MVStore.Builder builder = new MVStore.Builder().cacheSize(config.cacheSizeMb());
        if (!config.isInMemory()) {
            builder.fileName(config.fileName());
        }
        if (config.compress()) {
            builder.compress();
        }

        try {
            this.mvStore = builder.open();
            this.transactionStore = new TransactionStore(mvStore);
            this.transactionStore.init();
        } catch (MVStoreException e) {
            throw StoreException.storage("open", e);
        }

        log.info("Opened store: {}", config.isInMemory() ? "in-memory" : config.fileName());
    }

    // ============================================================
    // Users
    // ============================================================

    @Override
    public int createUser(String username) {
        if (username == null) {
            throw new IllegalArgumentException("username cannot be null");
        }
        return inWriteTransaction("createUser", tx -> {
            TransactionMap<String, Integer> usernames = usernames(tx);
            if (usernames.containsKey(username)) {
                throw new StoreException(ErrorCode.USERNAME_IN_USE, "Username already exists: " + username);
            }
            TransactionMap<Integer, String> users = users(tx);
            int userId = allocateId(tx, USERS, users);
            users.put(userId, username);
            usernames.put(username, userId);
            log.debug("Created user {} ({})", userId, username);
            return userId;
        });
    }

    @Override
    public Optional<User> getUserById(int userId) {
        return inReadTransaction("getUserById", tx -> {
            String username = users(tx).get(userId);
            return username == null ? Optional.<User>empty() : Optional.of(new User(userId, username));
        });
    }

    @Override
    public Optional<User> getUserByUsername(String username) {
        if (username == null) {
            throw new IllegalArgumentException("username cannot be null");
        }
        return inReadTransaction("getUserByUsername", tx -> {
            Integer userId = usernames(tx).get(username);
            return userId == null ? Optional.<User>empty() : Optional.of(new User(userId, username));
        });
    }

    @Override
    public List<User> listUsers() {
        return inReadTransaction("listUsers", tx -> {
            List<User> result = new ArrayList<>();
            for (Map.Entry<Integer, String> entry : users(tx).entrySet()) {
                result.add(new User(entry.getKey(), entry.getValue()));
            }
            return result;
        });
    }

    // ============================================================
    // Groups
    // ============================================================

    @Override
    public int createOrUpdateGroup(String name, Set<Integer> members, Integer existingGroupId, int actingUserId) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (members == null) {
            throw new IllegalArgumentException("members cannot be null");
        }
        if (existingGroupId != null) {
            return replaceGroup(existingGroupId, name, members, actingUserId).id();
        }
        return inWriteTransaction("createOrUpdateGroup", tx -> {
            requireUsersExist(users(tx), members);

            TransactionMap<Integer, Group> groups = groups(tx);
            int groupId = allocateId(tx, GROUPS, groups);
            groups.put(groupId, new Group(groupId, name, members));
            log.debug("Created group {} ({} members) by user {}", groupId, members.size(), actingUserId);
            return groupId;
        });
    }

    @Override
    public Group replaceGroup(int groupId, String name, Set<Integer> members, int actingUserId) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (members == null) {
            throw new IllegalArgumentException("members cannot be null");
        }
        return inWriteTransaction("replaceGroup", tx -> {
            requireUsersExist(users(tx), members);

            TransactionMap<Integer, Group> groups = groups(tx);
            Group previous = requireMember(groups, groupId, actingUserId);
            groups.put(groupId, new Group(groupId, name, members));
            log.debug("Replaced group {} ({} -> {} members) by user {}",
                groupId, previous.members().size(), members.size(), actingUserId);
            return previous;
        });
    }

    @Override
    public Optional<Group> getGroup(int groupId) {
        return inReadTransaction("getGroup", tx -> Optional.ofNullable(groups(tx).get(groupId)));
    }

    @Override
    public Group deleteGroup(int groupId, int actingUserId) {
        return inWriteTransaction("deleteGroup", tx -> {
            TransactionMap<Integer, Group> groups = groups(tx);
            Group deleted = requireMember(groups, groupId, actingUserId);
            groups.remove(groupId);

            Recipient recipient = Recipient.group(groupId);
            TransactionMap<DeliveryKey, Object> index = deliveryIndex(tx);
            TransactionMap<Integer, Message> messages = messages(tx);
            List<DeliveryKey> keys = scanPrefix(index, recipient);
            for (DeliveryKey key : keys) {
                messages.remove(key.messageId());
                index.remove(key);
            }
            log.debug("Deleted group {} and {} messages by user {}", groupId, keys.size(), actingUserId);
            return deleted;
        });
    }

    @Override
    public Map<Integer, Group> getGroupsForUser(int userId) {
        return inReadTransaction("getGroupsForUser", tx -> {
            if (!users(tx).containsKey(userId)) {
                throw new StoreException(ErrorCode.INVALID_USER_IDS, "Unknown user id: " + userId);
            }
            Map<Integer, Group> result = new TreeMap<>();
            for (Group group : groups(tx).values()) {
                if (group.hasMember(userId)) {
                    result.put(group.id(), group);
                }
            }
            return result;
        });
    }

    // ============================================================
    // Messages
    // ============================================================

    @Override
    public MessageEntry sendMessage(String body, int sender, Recipient recipient) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        return inWriteTransaction("sendMessage", tx -> {
            long now = clock.instant().getEpochSecond();
            return insertMessage(tx, new Message(sender, recipient, body, now, List.of()));
        });
    }

    @Override
    public MessageEntry importMessage(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        return inWriteTransaction("importMessage", tx -> insertMessage(tx, message));
    }

    @Override
    public MessageEntry deleteMessage(int messageId, int actingUserId) {
        return inWriteTransaction("deleteMessage", tx -> {
            TransactionMap<Integer, Message> messages = messages(tx);
            Message message = requireMessage(messages, messageId);
            if (!canDelete(tx, message, actingUserId)) {
                throw new StoreException(ErrorCode.PERMISSION_DENIED,
                    "User " + actingUserId + " cannot delete message " + messageId);
            }
            messages.remove(messageId);
            deliveryIndex(tx).remove(new DeliveryKey(message.recipient(), message.sender(), messageId));
            return new MessageEntry(messageId, message);
        });
    }

    @Override
    public MessageEntry editMessageBody(int messageId, String newBody, int actingUserId) {
        if (newBody == null) {
            throw new IllegalArgumentException("newBody cannot be null");
        }
        return editAsSender("editMessageBody", messageId, actingUserId, message -> message.withBody(newBody));
    }

    @Override
    public MessageEntry editMessageTags(int messageId, List<String> newTags, int actingUserId) {
        List<String> normalized = Tags.normalize(newTags);
        return editAsSender("editMessageTags", messageId, actingUserId, message -> message.withTags(normalized));
    }

    @Override
    public List<MessageEntry> getMessages(int actingUserId, Recipient recipient) {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        return inReadTransaction("getMessages", tx -> {
            TransactionMap<DeliveryKey, Object> index = deliveryIndex(tx);
            List<DeliveryKey> keys;
            if (recipient.kind() == Recipient.Kind.USER) {
                TransactionMap<Integer, String> users = users(tx);
                if (!users.containsKey(actingUserId) || !users.containsKey(recipient.id())) {
                    throw new StoreException(ErrorCode.INVALID_USER_IDS,
                        "Unknown user in conversation " + actingUserId + " / " + recipient.id());
                }
                keys = new ArrayList<>(scanPrefix(index, recipient, actingUserId));
                keys.addAll(scanPrefix(index, Recipient.user(actingUserId), recipient.id()));
            } else {
                requireMember(groups(tx), recipient.id(), actingUserId);
                keys = scanPrefix(index, recipient);
            }
            return resolve(messages(tx), keys);
        });
    }

    /**
     * Row counts per table.
     *
     * <p>Diagnostics for operators and tests; {@code messages} and {@code delivery_index} are always equal.</p>
     *
     * @return table name → row count
     */
    public Map<String, Long> tableSizes() {
        return inReadTransaction("tableSizes", tx -> {
            Map<String, Long> sizes = new LinkedHashMap<>();
            sizes.put(USERS, users(tx).sizeAsLong());
            sizes.put(USERNAMES, usernames(tx).sizeAsLong());
            sizes.put(GROUPS, groups(tx).sizeAsLong());
            sizes.put(MESSAGES, messages(tx).sizeAsLong());
            sizes.put(DELIVERY_INDEX, deliveryIndex(tx).sizeAsLong());
            return sizes;
        });
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!mvStore.isClosed()) {
                transactionStore.close();
                mvStore.close();
                log.info("Closed store");
            }
        } catch (MVStoreException e) {
            throw StoreException.storage("close", e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ============================================================
    // Internals
    // ============================================================

    /**
     * Validates and writes a message row together with its delivery index entry.
     */
    private MessageEntry insertMessage(Transaction tx, Message message) {
        TransactionMap<Integer, String> users = users(tx);
        if (!users.containsKey(message.sender())) {
            throw new StoreException(ErrorCode.INVALID_USER_IDS, "Unknown sender: " + message.sender());
        }
        Recipient recipient = message.recipient();
        if (recipient.kind() == Recipient.Kind.GROUP) {
            requireMember(groups(tx), recipient.id(), message.sender());
        } else if (!users.containsKey(recipient.id())) {
            throw new StoreException(ErrorCode.INVALID_USER_IDS, "Unknown recipient: " + recipient.id());
        }

        TransactionMap<Integer, Message> messages = messages(tx);
        int messageId = allocateId(tx, MESSAGES, messages);
        messages.put(messageId, message);
        deliveryIndex(tx).put(new DeliveryKey(recipient, message.sender(), messageId), Boolean.TRUE);
        return new MessageEntry(messageId, message);
    }

    private MessageEntry editAsSender(String operation, int messageId, int actingUserId,
                                      Function<Message, Message> change) {
        return inWriteTransaction(operation, tx -> {
            TransactionMap<Integer, Message> messages = messages(tx);
            Message message = requireMessage(messages, messageId);
            if (message.sender() != actingUserId) {
                throw new StoreException(ErrorCode.PERMISSION_DENIED,
                    "User " + actingUserId + " cannot edit message " + messageId);
            }
            Message updated = change.apply(message);
            messages.put(messageId, updated);
            return new MessageEntry(messageId, updated);
        });
    }

    private boolean canDelete(Transaction tx, Message message, int actingUserId) {
        if (message.sender() == actingUserId || message.isDirectlyAddressedTo(actingUserId)) {
            return true;
        }
        if (message.recipient().kind() == Recipient.Kind.GROUP) {
            Group group = groups(tx).get(message.recipient().id());
            return group != null && group.hasMember(actingUserId);
        }
        return false;
    }

    private static Message requireMessage(TransactionMap<Integer, Message> messages, int messageId) {
        Message message = messages.get(messageId);
        if (message == null) {
            throw new StoreException(ErrorCode.INVALID_MESSAGE_ID, "Unknown message id: " + messageId);
        }
        return message;
    }

    private static void requireUsersExist(TransactionMap<Integer, String> users, Set<Integer> userIds) {
        List<Integer> missing = new ArrayList<>();
        for (Integer userId : userIds) {
            if (userId == null || !users.containsKey(userId)) {
                missing.add(userId);
            }
        }
        if (!missing.isEmpty()) {
            throw new StoreException(ErrorCode.INVALID_USER_IDS, "Unknown user ids: " + missing);
        }
    }

    private static Group requireMember(TransactionMap<Integer, Group> groups, int groupId, int userId) {
        Group group = groups.get(groupId);
        if (group == null) {
            throw new StoreException(ErrorCode.INVALID_GROUP_ID, "Unknown group id: " + groupId);
        }
        if (!group.hasMember(userId)) {
            throw new StoreException(ErrorCode.PERMISSION_DENIED,
                "User " + userId + " is not a member of group " + groupId);
        }
        return group;
    }

    private static List<DeliveryKey> scanPrefix(TransactionMap<DeliveryKey, Object> index, Recipient recipient) {
        List<DeliveryKey> keys = new ArrayList<>();
        Iterator<DeliveryKey> it = index.keyIterator(DeliveryKey.lowest(recipient));
        while (it.hasNext()) {
            DeliveryKey key = it.next();
            if (!key.hasPrefix(recipient)) {
                break;
            }
            keys.add(key);
        }
        return keys;
    }

    private static List<DeliveryKey> scanPrefix(TransactionMap<DeliveryKey, Object> index,
                                                Recipient recipient, int senderId) {
        List<DeliveryKey> keys = new ArrayList<>();
        Iterator<DeliveryKey> it = index.keyIterator(DeliveryKey.lowest(recipient, senderId));
        while (it.hasNext()) {
            DeliveryKey key = it.next();
            if (!key.hasPrefix(recipient, senderId)) {
                break;
            }
            keys.add(key);
        }
        return keys;
    }

    /**
     * Loads the messages behind index entries, ascending by id. Dangling entries are skipped.
     */
    private static List<MessageEntry> resolve(TransactionMap<Integer, Message> messages, List<DeliveryKey> keys) {
        TreeMap<Integer, Message> byId = new TreeMap<>();
        for (DeliveryKey key : keys) {
            Message message = messages.get(key.messageId());
            if (message == null) {
                log.warn("Skipping dangling delivery index entry {}", key);
                continue;
            }
            byId.put(key.messageId(), message);
        }
        List<MessageEntry> result = new ArrayList<>(byId.size());
        for (Map.Entry<Integer, Message> entry : byId.entrySet()) {
            result.add(new MessageEntry(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    private int allocateId(Transaction tx, String table, TransactionMap<Integer, ?> rows) {
        TransactionMap<String, Integer> sequences = sequences(tx);
        Integer lastKey = rows.lastKey();
        Integer highWater = sequences.get(table);

        long next = lastKey == null ? 0L : lastKey + 1L;
        if (highWater != null && highWater > next) {
            next = highWater;
        }
        if (next > Integer.MAX_VALUE) {
            throw new StoreException(ErrorCode.STORAGE, "Id space exhausted for table " + table);
        }
        int id = (int) next;
        sequences.put(table, id + 1);
        return id;
    }

    private <T> T inWriteTransaction(String operation, Function<Transaction, T> work) {
        lock.writeLock().lock();
        try {
            Transaction tx = begin(operation);
            try {
                T result = work.apply(tx);
                tx.commit();
                mvStore.commit();
                return result;
            } catch (RuntimeException e) {
                rollbackQuietly(tx, operation, e);
                throw translate(operation, e);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T inReadTransaction(String operation, Function<Transaction, T> work) {
        lock.readLock().lock();
        try {
            Transaction tx = begin(operation);
            try {
                return work.apply(tx);
            } catch (RuntimeException e) {
                throw translate(operation, e);
            } finally {
                rollbackQuietly(tx, operation, null);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    private Transaction begin(String operation) {
        try {
            return transactionStore.begin();
        } catch (MVStoreException e) {
            throw StoreException.storage(operation, e);
        }
    }

    private static void rollbackQuietly(Transaction tx, String operation, RuntimeException primary) {
        try {
            tx.rollback();
        } catch (MVStoreException e) {
            if (primary != null) {
                primary.addSuppressed(e);
            } else {
                log.error("Rollback of {} failed", operation, e);
            }
        }
    }

    private static RuntimeException translate(String operation, RuntimeException e) {
        if (e instanceof MVStoreException) {
            log.error("Storage engine failure in {}", operation, e);
            return StoreException.storage(operation, e);
        }
        return e;
    }

    private static TransactionMap<Integer, String> users(Transaction tx) {
        return tx.openMap(USERS);
    }

    private static TransactionMap<String, Integer> usernames(Transaction tx) {
        return tx.openMap(USERNAMES);
    }

    private static TransactionMap<Integer, Group> groups(Transaction tx) {
        return tx.openMap(GROUPS);
    }

    private static TransactionMap<Integer, Message> messages(Transaction tx) {
        return tx.openMap(MESSAGES);
    }

    private static TransactionMap<String, Integer> sequences(Transaction tx) {
        return tx.openMap(SEQUENCES);
    }

    private static TransactionMap<DeliveryKey, Object> deliveryIndex(Transaction tx) {
        return tx.openMap(DELIVERY_INDEX, DeliveryKeyType.INSTANCE, new ObjectDataType());
    }
}

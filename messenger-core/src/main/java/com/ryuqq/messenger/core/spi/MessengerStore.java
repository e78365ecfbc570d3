package com.ryuqq.messenger.core.spi;

import com.ryuqq.messenger.core.model.Group;
import com.ryuqq.messenger.core.model.Message;
import com.ryuqq.messenger.core.model.MessageEntry;
import com.ryuqq.messenger.core.model.Recipient;
import com.ryuqq.messenger.core.model.User;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent Storage SPI for users, groups, messages and the delivery index.
 *
 * <p>Every method runs as exactly one atomic transaction: either all of its writes commit or none
 * do. All consistency invariants are enforced here, not by callers.</p>
 *
 * <p><strong>Invariants (hold after every committed transaction):</strong></p>
 * <ul>
 *   <li>Every message has exactly one delivery index entry {@code (recipient, sender, id)} and vice versa</li>
 *   <li>Group members reference existing users only</li>
 *   <li>Usernames are unique</li>
 *   <li>Ids are allocated as "one past the current maximum" per table and never reused</li>
 *   <li>Group-scoped reads and writes require current membership</li>
 * </ul>
 *
 * <p><strong>Transaction Model:</strong></p>
 * <pre>
 * one writer transaction at a time
 * many concurrent readers, each observing one committed snapshot
 * failed validation → abort before any write
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: methods are called from a pool of store worker threads</li>
 *   <li>Blocking: callers must not invoke these methods from a connection I/O thread</li>
 *   <li>Read paths skip delivery index entries whose message row is missing</li>
 *   <li>Engine errors surface as {@link com.ryuqq.messenger.core.error.StoreException} with code STORAGE</li>
 * </ul>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public interface MessengerStore extends AutoCloseable {

    /**
     * Creates a user with the next free id.
     *
     * @param username unique username
     * @return the new user id
     * @throws com.ryuqq.messenger.core.error.StoreException USERNAME_IN_USE if the name is taken (nothing is written)
     */
    int createUser(String username);

    /**
     * @param userId user id
     * @return the user, or empty if absent
     */
    Optional<User> getUserById(int userId);

    /**
     * @param username username
     * @return the user, or empty if absent
     */
    Optional<User> getUserByUsername(String username);

    /**
     * @return all users in ascending id order (empty if none)
     */
    List<User> listUsers();

    /**
     * Creates a group, or replaces an existing group's name and full member set.
     *
     * <p><strong>Validation Order:</strong></p>
     * <ol>
     *   <li>every member id exists, else INVALID_USER_IDS</li>
     *   <li>updating: group exists, else INVALID_GROUP_ID</li>
     *   <li>updating: acting user is a member of the existing group, else PERMISSION_DENIED</li>
     * </ol>
     *
     * @param name group name
     * @param members complete member set
     * @param existingGroupId group to replace, or {@code null} to create
     * @param actingUserId user performing the change
     * @return the group id
     */
    int createOrUpdateGroup(String name, Set<Integer> members, Integer existingGroupId, int actingUserId);

    /**
     * Replaces an existing group's name and member set, returning the group as it was before the change.
     *
     * <p>Same validation as {@link #createOrUpdateGroup(String, Set, Integer, int)} for an update. The
     * previous state is read in the same transaction as the write, so callers can diff memberships
     * without racing concurrent edits.</p>
     *
     * @param groupId group to replace
     * @param name new group name
     * @param members new complete member set
     * @param actingUserId user performing the change
     * @return the group before the change
     * @throws com.ryuqq.messenger.core.error.StoreException INVALID_USER_IDS, INVALID_GROUP_ID or PERMISSION_DENIED
     */
    Group replaceGroup(int groupId, String name, Set<Integer> members, int actingUserId);

    /**
     * @param groupId group id
     * @return the group, or empty if absent
     */
    Optional<Group> getGroup(int groupId);

    /**
     * Deletes a group together with every message addressed to it, in one transaction.
     *
     * @param groupId group id
     * @param actingUserId user performing the delete (must be a member)
     * @return the deleted group
     * @throws com.ryuqq.messenger.core.error.StoreException INVALID_GROUP_ID or PERMISSION_DENIED
     */
    Group deleteGroup(int groupId, int actingUserId);

    /**
     * @param userId user id
     * @return groups the user belongs to, keyed and ordered by group id
     * @throws com.ryuqq.messenger.core.error.StoreException INVALID_USER_IDS for an unknown user
     */
    Map<Integer, Group> getGroupsForUser(int userId);

    /**
     * Stores a new message stamped with the commit time and no tags.
     *
     * @param body message text
     * @param sender sending user id
     * @param recipient user or group
     * @return the stored message and its id
     * @throws com.ryuqq.messenger.core.error.StoreException INVALID_USER_IDS, INVALID_GROUP_ID or PERMISSION_DENIED
     */
    MessageEntry sendMessage(String body, int sender, Recipient recipient);

    /**
     * Stores a fully formed message (own timestamp and tags) with the same validation as
     * {@link #sendMessage(String, int, Recipient)}. Used by bulk importers.
     *
     * @param message message to store
     * @return the stored message and its id
     */
    MessageEntry importMessage(Message message);

    /**
     * Deletes a message and its index entry.
     *
     * <p>Allowed for the sender, the direct recipient, or a current member of the recipient group.</p>
     *
     * @param messageId message id
     * @param actingUserId user performing the delete
     * @return the deleted message, so callers can notify its participants
     * @throws com.ryuqq.messenger.core.error.StoreException INVALID_MESSAGE_ID or PERMISSION_DENIED
     */
    MessageEntry deleteMessage(int messageId, int actingUserId);

    /**
     * Replaces a message body. Sender only.
     *
     * @param messageId message id
     * @param newBody new text
     * @param actingUserId user performing the edit
     * @return the updated message
     */
    MessageEntry editMessageBody(int messageId, String newBody, int actingUserId);

    /**
     * Replaces a message's tags after normalisation. Sender only.
     *
     * @param messageId message id
     * @param newTags raw tags
     * @param actingUserId user performing the edit
     * @return the updated message
     */
    MessageEntry editMessageTags(int messageId, List<String> newTags, int actingUserId);

    /**
     * Returns the conversation between the acting user and a recipient, ascending by message id.
     *
     * <ul>
     *   <li>User recipient: messages from acting user to recipient plus messages from recipient to acting user</li>
     *   <li>Group recipient: every message addressed to the group; acting user must be a member</li>
     * </ul>
     *
     * @param actingUserId reading user
     * @param recipient user or group
     * @return ordered message entries
     */
    List<MessageEntry> getMessages(int actingUserId, Recipient recipient);

    /**
     * Releases the underlying engine. Committed data is durable afterwards.
     */
    @Override
    void close();
}

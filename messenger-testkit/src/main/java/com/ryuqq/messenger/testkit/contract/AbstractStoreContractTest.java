package com.ryuqq.messenger.testkit.contract;

import com.ryuqq.messenger.core.error.ErrorCode;
import com.ryuqq.messenger.core.error.StoreException;
import com.ryuqq.messenger.core.model.Group;
import com.ryuqq.messenger.core.model.Message;
import com.ryuqq.messenger.core.model.MessageEntry;
import com.ryuqq.messenger.core.model.Recipient;
import com.ryuqq.messenger.core.model.User;
import com.ryuqq.messenger.core.spi.MessengerStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Abstract base class for {@link MessengerStore} Contract Tests.
 *
 * <p>Every store adapter extends this class and supplies a fresh store; the inherited tests then
 * verify the store contract against it.</p>
 *
 * <p><strong>Contract Coverage:</strong></p>
 * <ul>
 *   <li>Username uniqueness (failed create leaves the table unchanged)</li>
 *   <li>Dense, strictly increasing ids that are never reused</li>
 *   <li>Message / delivery index bijection</li>
 *   <li>Direct conversation symmetry</li>
 *   <li>Group cascade delete</li>
 *   <li>Permission enforcement (InvalidGroupId and PermissionDenied stay distinct)</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStoreContractTest extends AbstractStoreContractTest {
 *     {@literal @}Override
 *     protected MessengerStore createStore() {
 *         return new MyStore();
 *     }
 *     ...
 * }
 * </pre>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public abstract class AbstractStoreContractTest {

    protected MessengerStore store;

    /**
     * @return a fresh, empty store
     */
    protected abstract MessengerStore createStore();

    /**
     * @return number of message rows in {@link #store}
     */
    protected abstract long messageRowCount();

    /**
     * @return number of delivery index rows in {@link #store}
     */
    protected abstract long deliveryIndexRowCount();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    @AfterEach
    void tearDownStore() throws Exception {
        if (store != null) {
            store.close();
        }
    }

    // ============================================================
    // Users
    // ============================================================

    @Test
    @DisplayName("같은 사용자명으로 두 번 생성하면 USERNAME_IN_USE, 테이블은 그대로")
    void createUser_duplicateUsername_failsWithoutMutation() {
        // given
        store.createUser("alice");
        store.createUser("bob");
        List<User> before = store.listUsers();

        // when & then
        assertStoreError(() -> store.createUser("alice"), ErrorCode.USERNAME_IN_USE);
        assertThat(store.listUsers()).isEqualTo(before);
    }

    @Test
    void createUser_assignsDenseIdsFromZero() {
        // when
        int a = store.createUser("a");
        int b = store.createUser("b");
        int c = store.createUser("c");

        // then
        assertThat(List.of(a, b, c)).containsExactly(0, 1, 2);
        assertThat(store.listUsers()).extracting(User::username).containsExactly("a", "b", "c");
    }

    @Test
    void userLookups_returnEmptyWhenAbsent() {
        // given
        int alice = store.createUser("alice");

        // then
        assertThat(store.getUserById(alice)).contains(new User(alice, "alice"));
        assertThat(store.getUserByUsername("alice")).contains(new User(alice, "alice"));
        assertThat(store.getUserById(99)).isEmpty();
        assertThat(store.getUserByUsername("nobody")).isEmpty();
    }

    @Test
    void listUsers_onFreshStore_isEmpty() {
        assertThat(store.listUsers()).isEmpty();
    }

    @Test
    @DisplayName("동시에 같은 사용자명을 생성하면 정확히 하나만 성공")
    void createUser_concurrentSameUsername_exactlyOneSucceeds() throws Exception {
        // given
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        try {
            // when
            for (int i = 0; i < threads; i++) {
                Callable<Boolean> attempt = () -> {
                    start.await();
                    try {
                        store.createUser("racer");
                        return true;
                    } catch (StoreException e) {
                        return false;
                    }
                };
                results.add(pool.submit(attempt));
            }
            start.countDown();

            int successes = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    successes++;
                }
            }

            // then
            assertThat(successes).isEqualTo(1);
            assertThat(store.listUsers()).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    // ============================================================
    // Groups
    // ============================================================

    @Test
    void createGroup_withUnknownMember_failsWithInvalidUserIds() {
        // given
        int alice = store.createUser("alice");

        // when & then
        assertStoreError(() -> store.createOrUpdateGroup("g", Set.of(alice, 42), null, alice),
            ErrorCode.INVALID_USER_IDS);
        assertThat(store.getGroup(0)).isEmpty();
    }

    @Test
    void updateGroup_replacesMemberSetWholesale() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        int c = store.createUser("c");
        int groupId = store.createOrUpdateGroup("team", Set.of(a, b), null, a);

        // when
        int updatedId = store.createOrUpdateGroup("renamed", Set.of(a, c), groupId, b);

        // then
        assertThat(updatedId).isEqualTo(groupId);
        Group group = store.getGroup(groupId).orElseThrow();
        assertThat(group.name()).isEqualTo("renamed");
        assertThat(group.members()).containsExactly(a, c);
        assertThat(store.getGroupsForUser(b)).isEmpty();
        assertThat(store.getGroupsForUser(c)).containsOnlyKeys(groupId);
    }

    @Test
    @DisplayName("존재하지 않는 그룹은 INVALID_GROUP_ID, 비멤버는 PERMISSION_DENIED")
    void groupScopedOperations_distinguishMissingFromDenied() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        int outsider = store.createUser("outsider");
        int groupId = store.createOrUpdateGroup("team", Set.of(a, b), null, a);

        // then: unknown group
        assertStoreError(() -> store.deleteGroup(77, a), ErrorCode.INVALID_GROUP_ID);
        assertStoreError(() -> store.createOrUpdateGroup("x", Set.of(a), 77, a), ErrorCode.INVALID_GROUP_ID);
        assertStoreError(() -> store.getMessages(a, Recipient.group(77)), ErrorCode.INVALID_GROUP_ID);

        // then: existing group, not a member
        assertStoreError(() -> store.deleteGroup(groupId, outsider), ErrorCode.PERMISSION_DENIED);
        assertStoreError(() -> store.createOrUpdateGroup("x", Set.of(outsider), groupId, outsider),
            ErrorCode.PERMISSION_DENIED);
        assertStoreError(() -> store.getMessages(outsider, Recipient.group(groupId)), ErrorCode.PERMISSION_DENIED);
        assertStoreError(() -> store.sendMessage("hi", outsider, Recipient.group(groupId)),
            ErrorCode.PERMISSION_DENIED);

        assertThat(store.getGroup(groupId).orElseThrow().members()).containsExactly(a, b);
    }

    @Test
    void getGroupsForUser_unknownUser_failsWithInvalidUserIds() {
        assertStoreError(() -> store.getGroupsForUser(5), ErrorCode.INVALID_USER_IDS);
    }

    @Test
    void getGroupsForUser_returnsOnlyGroupsContainingUser() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        int first = store.createOrUpdateGroup("first", Set.of(a, b), null, a);
        store.createOrUpdateGroup("second", Set.of(b), null, b);
        int third = store.createOrUpdateGroup("third", Set.of(a), null, a);

        // when
        Map<Integer, Group> groups = store.getGroupsForUser(a);

        // then
        assertThat(groups).containsOnlyKeys(first, third);
        assertThat(groups.get(first).name()).isEqualTo("first");
    }

    @Test
    @DisplayName("그룹 삭제는 그룹 메시지만 연쇄 삭제")
    void deleteGroup_cascadesOnlyMessagesAddressedToIt() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        int doomed = store.createOrUpdateGroup("doomed", Set.of(a, b), null, a);
        int kept = store.createOrUpdateGroup("kept", Set.of(a, b), null, a);
        store.sendMessage("g1", a, Recipient.group(doomed));
        store.sendMessage("g2", b, Recipient.group(doomed));
        MessageEntry keptGroupMessage = store.sendMessage("k", a, Recipient.group(kept));
        MessageEntry direct = store.sendMessage("d", a, Recipient.user(b));

        // when
        Group deleted = store.deleteGroup(doomed, b);

        // then
        assertThat(deleted).isEqualTo(new Group(doomed, "doomed", Set.of(a, b)));
        assertThat(store.getGroup(doomed)).isEmpty();
        assertThat(store.getMessages(a, Recipient.group(kept))).containsExactly(keptGroupMessage);
        assertThat(store.getMessages(a, Recipient.user(b))).containsExactly(direct);
        assertThat(messageRowCount()).isEqualTo(2);
        assertThat(deliveryIndexRowCount()).isEqualTo(2);
        assertStoreError(() -> store.getMessages(a, Recipient.group(doomed)), ErrorCode.INVALID_GROUP_ID);
    }

    @Test
    @DisplayName("멤버 변경은 그룹 메시지 이력을 유지")
    void updateGroup_retainsHistory() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        int groupId = store.createOrUpdateGroup("team", Set.of(a, b), null, a);
        MessageEntry fromB = store.sendMessage("from b", b, Recipient.group(groupId));

        // when
        store.createOrUpdateGroup("team", Set.of(a), groupId, a);

        // then
        assertThat(store.getMessages(a, Recipient.group(groupId))).containsExactly(fromB);
        assertStoreError(() -> store.getMessages(b, Recipient.group(groupId)), ErrorCode.PERMISSION_DENIED);
    }

    @Test
    @DisplayName("replaceGroup은 변경 직전의 그룹을 반환")
    void replaceGroup_returnsPreviousState() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        int c = store.createUser("c");
        int groupId = store.createOrUpdateGroup("team", Set.of(a, b), null, a);

        // when
        Group first = store.replaceGroup(groupId, "crew", Set.of(a, c), a);
        Group second = store.replaceGroup(groupId, "crew", Set.of(c), c);

        // then
        assertThat(first).isEqualTo(new Group(groupId, "team", Set.of(a, b)));
        assertThat(second).isEqualTo(new Group(groupId, "crew", Set.of(a, c)));
        assertThat(store.getGroup(groupId)).contains(new Group(groupId, "crew", Set.of(c)));
    }

    @Test
    void replaceGroup_validatesLikeUpdate() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        int groupId = store.createOrUpdateGroup("team", Set.of(a), null, a);

        // then
        assertStoreError(() -> store.replaceGroup(groupId, "x", Set.of(a, 99), a), ErrorCode.INVALID_USER_IDS);
        assertStoreError(() -> store.replaceGroup(groupId + 1, "x", Set.of(a), a), ErrorCode.INVALID_GROUP_ID);
        assertStoreError(() -> store.replaceGroup(groupId, "x", Set.of(a, b), b), ErrorCode.PERMISSION_DENIED);
        assertThat(store.getGroup(groupId)).contains(new Group(groupId, "team", Set.of(a)));
    }

    // ============================================================
    // Messages
    // ============================================================

    @Test
    void sendMessage_validatesSenderAndRecipient() {
        // given
        int a = store.createUser("a");

        // then
        assertStoreError(() -> store.sendMessage("x", 9, Recipient.user(a)), ErrorCode.INVALID_USER_IDS);
        assertStoreError(() -> store.sendMessage("x", a, Recipient.user(9)), ErrorCode.INVALID_USER_IDS);
        assertStoreError(() -> store.sendMessage("x", a, Recipient.group(9)), ErrorCode.INVALID_GROUP_ID);
        assertThat(messageRowCount()).isZero();
    }

    @Test
    void sendMessage_storesBodyWithEmptyTags() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");

        // when
        MessageEntry entry = store.sendMessage("hello", a, Recipient.user(b));

        // then
        assertThat(entry.id()).isZero();
        assertThat(entry.message().sender()).isEqualTo(a);
        assertThat(entry.message().recipient()).isEqualTo(Recipient.user(b));
        assertThat(entry.message().body()).isEqualTo("hello");
        assertThat(entry.message().tags()).isEmpty();
    }

    @Test
    @DisplayName("A↔B 대화는 누가 조회하든 같은 메시지를 id 오름차순으로 반환")
    void getMessages_directConversation_isSymmetricAndOrderedById() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        int c = store.createUser("c");
        MessageEntry m0 = store.sendMessage("1", a, Recipient.user(b));
        MessageEntry m1 = store.sendMessage("2", b, Recipient.user(a));
        store.sendMessage("noise", c, Recipient.user(a));
        MessageEntry m3 = store.sendMessage("3", a, Recipient.user(b));
        MessageEntry m4 = store.sendMessage("4", b, Recipient.user(a));

        // when
        List<MessageEntry> fromA = store.getMessages(a, Recipient.user(b));
        List<MessageEntry> fromB = store.getMessages(b, Recipient.user(a));

        // then
        assertThat(fromA).containsExactly(m0, m1, m3, m4);
        assertThat(fromB).isEqualTo(fromA);
    }

    @Test
    void getMessages_unknownDirectRecipient_failsWithInvalidUserIds() {
        int a = store.createUser("a");
        assertStoreError(() -> store.getMessages(a, Recipient.user(12)), ErrorCode.INVALID_USER_IDS);
    }

    @Test
    void getMessages_group_returnsAllSendersInIdOrder() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        int groupId = store.createOrUpdateGroup("team", Set.of(a, b), null, a);
        MessageEntry m0 = store.sendMessage("b first", b, Recipient.group(groupId));
        MessageEntry m1 = store.sendMessage("a second", a, Recipient.group(groupId));
        MessageEntry m2 = store.sendMessage("b third", b, Recipient.group(groupId));

        // then
        assertThat(store.getMessages(a, Recipient.group(groupId))).containsExactly(m0, m1, m2);
    }

    @Test
    void deleteMessage_permittedForSenderAndDirectRecipientOnly() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        int c = store.createUser("c");
        MessageEntry first = store.sendMessage("1", a, Recipient.user(b));
        MessageEntry second = store.sendMessage("2", a, Recipient.user(b));

        // then
        assertStoreError(() -> store.deleteMessage(first.id(), c), ErrorCode.PERMISSION_DENIED);
        assertThat(store.deleteMessage(first.id(), a)).isEqualTo(first);
        assertThat(store.deleteMessage(second.id(), b)).isEqualTo(second);
        assertStoreError(() -> store.deleteMessage(first.id(), a), ErrorCode.INVALID_MESSAGE_ID);
        assertThat(store.getMessages(a, Recipient.user(b))).isEmpty();
    }

    @Test
    void deleteMessage_permittedForCurrentGroupMember() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        int groupId = store.createOrUpdateGroup("team", Set.of(a, b), null, a);
        MessageEntry entry = store.sendMessage("x", a, Recipient.group(groupId));
        MessageEntry other = store.sendMessage("y", a, Recipient.group(groupId));

        // when
        store.deleteMessage(entry.id(), b);
        store.createOrUpdateGroup("team", Set.of(a), groupId, a);

        // then
        assertStoreError(() -> store.deleteMessage(other.id(), b), ErrorCode.PERMISSION_DENIED);
        assertThat(store.getMessages(a, Recipient.group(groupId))).containsExactly(other);
    }

    @Test
    @DisplayName("본문/태그 수정은 보낸 사람만 가능")
    void editMessage_senderOnly() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        MessageEntry entry = store.sendMessage("draft", a, Recipient.user(b));

        // then
        assertStoreError(() -> store.editMessageBody(entry.id(), "hijack", b), ErrorCode.PERMISSION_DENIED);
        assertStoreError(() -> store.editMessageTags(entry.id(), List.of("x"), b), ErrorCode.PERMISSION_DENIED);
        assertStoreError(() -> store.editMessageBody(99, "x", a), ErrorCode.INVALID_MESSAGE_ID);

        MessageEntry edited = store.editMessageBody(entry.id(), "final", a);
        assertThat(edited.id()).isEqualTo(entry.id());
        assertThat(edited.message().body()).isEqualTo("final");
        assertThat(edited.message().createdAt()).isEqualTo(entry.message().createdAt());
    }

    @Test
    void editMessageTags_normalizesTags() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        MessageEntry entry = store.sendMessage("x", a, Recipient.user(b));

        // when
        MessageEntry edited = store.editMessageTags(entry.id(), List.of("Work, URGENT", "  later "), a);

        // then
        assertThat(edited.message().tags()).containsExactly("work", "urgent", "later");
        assertThat(store.getMessages(b, Recipient.user(a)).get(0).message().tags())
            .containsExactly("work", "urgent", "later");
    }

    @Test
    void importMessage_keepsTimestampAndTags() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        Message legacy = new Message(a, Recipient.user(b), "old", 1_500_000_000L, List.of("archive"));

        // when
        MessageEntry entry = store.importMessage(legacy);

        // then
        assertThat(entry.message()).isEqualTo(legacy);
        assertThat(store.getMessages(a, Recipient.user(b))).containsExactly(entry);
        assertThat(messageRowCount()).isEqualTo(deliveryIndexRowCount());
    }

    // ============================================================
    // Ids and bijection
    // ============================================================

    @Test
    @DisplayName("삭제 후에도 id는 재사용되지 않음")
    void messageIds_areNeverReused() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        MessageEntry m0 = store.sendMessage("0", a, Recipient.user(b));
        MessageEntry m1 = store.sendMessage("1", a, Recipient.user(b));

        // when
        store.deleteMessage(m1.id(), a);
        MessageEntry m2 = store.sendMessage("2", a, Recipient.user(b));

        // then
        assertThat(m0.id()).isZero();
        assertThat(m1.id()).isEqualTo(1);
        assertThat(m2.id()).isGreaterThan(m1.id());
    }

    @Test
    void groupIds_areDenseAndNeverReused() {
        // given
        int a = store.createUser("a");
        int g0 = store.createOrUpdateGroup("g0", Set.of(a), null, a);
        int g1 = store.createOrUpdateGroup("g1", Set.of(a), null, a);

        // when
        store.deleteGroup(g1, a);
        int g2 = store.createOrUpdateGroup("g2", Set.of(a), null, a);

        // then
        assertThat(List.of(g0, g1)).containsExactly(0, 1);
        assertThat(g2).isGreaterThan(g1);
    }

    @Test
    @DisplayName("메시지 행 수와 전달 인덱스 행 수는 항상 같음")
    void messagesAndDeliveryIndex_stayInBijection() {
        // given
        int a = store.createUser("a");
        int b = store.createUser("b");
        int c = store.createUser("c");
        int g = store.createOrUpdateGroup("g", Set.of(a, b, c), null, a);

        // when
        MessageEntry d1 = store.sendMessage("d1", a, Recipient.user(b));
        store.sendMessage("d2", b, Recipient.user(c));
        store.sendMessage("g1", c, Recipient.group(g));
        MessageEntry g2 = store.sendMessage("g2", a, Recipient.group(g));
        assertThat(messageRowCount()).isEqualTo(deliveryIndexRowCount()).isEqualTo(4);

        store.deleteMessage(d1.id(), b);
        store.deleteMessage(g2.id(), c);
        assertThat(messageRowCount()).isEqualTo(deliveryIndexRowCount()).isEqualTo(2);

        assertStoreError(() -> store.deleteMessage(d1.id(), a), ErrorCode.INVALID_MESSAGE_ID);
        store.deleteGroup(g, a);

        // then
        assertThat(messageRowCount()).isEqualTo(deliveryIndexRowCount()).isEqualTo(1);
    }

    // ============================================================
    // End-to-end scenario
    // ============================================================

    @Test
    @DisplayName("사용자 4명, 그룹 1개: 전송, 권한 거부, 그룹 삭제, 재삭제 실패")
    void fourUsersScenario() {
        // given
        assertThat(store.createUser("a")).isZero();
        assertThat(store.createUser("b")).isEqualTo(1);
        assertThat(store.createUser("c")).isEqualTo(2);
        assertThat(store.createUser("d")).isEqualTo(3);
        assertThat(store.createOrUpdateGroup("g", Set.of(1, 3), null, 1)).isZero();

        // when
        MessageEntry hi = store.sendMessage("hi", 0, Recipient.user(1));

        // then
        assertThat(store.getMessages(0, Recipient.user(1))).containsExactly(hi);
        assertThat(store.getMessages(1, Recipient.user(0))).containsExactly(hi);
        assertThat(hi.message().sender()).isZero();
        assertThat(hi.message().recipient()).isEqualTo(Recipient.user(1));
        assertThat(hi.message().body()).isEqualTo("hi");

        assertStoreError(() -> store.sendMessage("x", 2, Recipient.group(0)), ErrorCode.PERMISSION_DENIED);

        store.sendMessage("for group", 3, Recipient.group(0));
        store.deleteGroup(0, 1);
        assertThat(messageRowCount()).isEqualTo(1);
        assertStoreError(() -> store.deleteGroup(0, 1), ErrorCode.INVALID_GROUP_ID);
    }

    // ============================================================
    // Helpers
    // ============================================================

    /**
     * Asserts that the call fails with a {@link StoreException} carrying the expected code.
     *
     * @param call the store call
     * @param expected expected error code
     */
    protected void assertStoreError(Executable call, ErrorCode expected) {
        assertThatThrownBy(call::execute)
            .isInstanceOf(StoreException.class)
            .satisfies(e -> assertThat(((StoreException) e).code()).isEqualTo(expected));
    }
}

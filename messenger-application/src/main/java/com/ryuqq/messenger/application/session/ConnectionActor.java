package com.ryuqq.messenger.application.session;

import com.ryuqq.messenger.application.presence.DeliveryChannel;
import com.ryuqq.messenger.application.presence.PresenceRegistry;
import com.ryuqq.messenger.core.error.ErrorCode;
import com.ryuqq.messenger.core.error.MessengerException;
import com.ryuqq.messenger.core.error.ProtocolException;
import com.ryuqq.messenger.core.error.StoreException;
import com.ryuqq.messenger.core.model.Group;
import com.ryuqq.messenger.core.model.Message;
import com.ryuqq.messenger.core.model.MessageEntry;
import com.ryuqq.messenger.core.model.Recipient;
import com.ryuqq.messenger.core.model.User;
import com.ryuqq.messenger.core.protocol.ClientMessage;
import com.ryuqq.messenger.core.protocol.FrameDecodingException;
import com.ryuqq.messenger.core.protocol.GroupSummary;
import com.ryuqq.messenger.core.protocol.ServerMessage;
import com.ryuqq.messenger.core.protocol.UserSummary;
import com.ryuqq.messenger.core.spi.Connection;
import com.ryuqq.messenger.core.spi.FrameCodec;
import com.ryuqq.messenger.core.spi.MessengerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * 연결 하나를 담당하는 세션 루프.
 *
 * <p>소켓 수신 프레임과 다른 세션이 보낸 이벤트를 하나의 mailbox로 합쳐 도착 순서대로 처리합니다.
 * 소켓 쓰기는 이 루프 스레드만 수행하므로 수신자별 이벤트 순서가 유지됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * reader 스레드: connection.receive() → mailbox (Inbound / Closed)
 * 다른 세션:     DeliveryChannel.deliver() → mailbox (Outbound)
 *   ↓
 * run() 루프: mailbox.take()
 *   - Inbound  → decode → dispatch → 저장소 워커에서 실행 후 대기 → 응답 + 팬아웃
 *   - Outbound → connection.send()
 *   - Closed / Overflow → 루프 종료
 *   ↓
 * finally: 레지스트리 해제 + UserOffline 브로드캐스트 + 연결 종료
 * </pre>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>MessengerException: 요청한 세션에만 Error 이벤트, 연결 유지</li>
 *   <li>FrameDecodingException: 경고 로그 후 프레임 폐기, 연결 유지</li>
 *   <li>소켓 I/O 실패, 워커 실패, 인터럽트, 전달 큐 초과: 연결 종료</li>
 * </ul>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public class ConnectionActor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionActor.class);

    private static final Pattern USERNAME = Pattern.compile("[\\p{L}\\p{Nd}_]+");

    private final Connection connection;
    private final FrameCodec codec;
    private final MessengerStore store;
    private final PresenceRegistry registry;
    private final ExecutorService storeExecutor;
    private final ExecutorService readerExecutor;
    private final SessionConfig config;

    private final BlockingQueue<MailboxEvent> mailbox = new LinkedBlockingQueue<>();
    private final AtomicInteger pendingDeliveries = new AtomicInteger();
    private final AtomicBoolean overflowed = new AtomicBoolean();
    private final DeliveryChannel channel = new MailboxChannel();

    private volatile boolean finished;
    private volatile SessionState state = SessionState.UNAUTHENTICATED;
    private int userId = -1;

    /**
     * 생성자.
     *
     * @param connection 수락된 클라이언트 연결
     * @param codec 프레임 코덱
     * @param store 저장소
     * @param registry 접속 레지스트리
     * @param storeExecutor 저장소 호출용 워커 풀
     * @param readerExecutor 소켓 수신 스레드 풀
     * @param config 세션 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ConnectionActor(Connection connection, FrameCodec codec, MessengerStore store, PresenceRegistry registry,
                           ExecutorService storeExecutor, ExecutorService readerExecutor, SessionConfig config) {
        if (connection == null) {
            throw new IllegalArgumentException("connection cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (storeExecutor == null) {
            throw new IllegalArgumentException("storeExecutor cannot be null");
        }
        if (readerExecutor == null) {
            throw new IllegalArgumentException("readerExecutor cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.connection = connection;
        this.codec = codec;
        this.store = store;
        this.registry = registry;
        this.storeExecutor = storeExecutor;
        this.readerExecutor = readerExecutor;
        this.config = config;
    }

    @Override
    public void run() {
        log.debug("Connection opened: {}", connection.describe());
        Future<?> reader = null;
        try {
            reader = readerExecutor.submit(this::readLoop);
            eventLoop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Connection {} interrupted", connection.describe());
        } catch (IOException e) {
            log.warn("Socket write failed on {}: {}", connection.describe(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Connection {} terminated by unexpected failure", connection.describe(), e);
        } finally {
            finished = true;
            try {
                cleanup();
            } finally {
                connection.close();
                if (reader != null) {
                    reader.cancel(true);
                }
                log.debug("Connection closed: {}", connection.describe());
            }
        }
    }

    /**
     * @return 현재 세션 상태
     */
    public SessionState state() {
        return state;
    }

    // ============================================================
    // Event loop
    // ============================================================

    private void eventLoop() throws InterruptedException, IOException {
        while (true) {
            MailboxEvent event = mailbox.take();
            if (event instanceof Inbound inbound) {
                handleFrame(inbound.frame());
            } else if (event instanceof Outbound outbound) {
                pendingDeliveries.decrementAndGet();
                connection.send(outbound.frame());
            } else if (event instanceof Closed closed) {
                log.debug("Connection {} ended: {}", connection.describe(), closed.reason());
                return;
            } else if (event instanceof Overflow) {
                log.warn("Disconnecting slow consumer {} (user {}): more than {} undelivered events",
                    connection.describe(), userId, config.deliveryQueueCapacity());
                return;
            }
        }
    }

    private void readLoop() {
        try {
            while (true) {
                byte[] frame = connection.receive();
                if (frame == null) {
                    mailbox.add(new Closed("peer closed"));
                    return;
                }
                mailbox.add(new Inbound(frame));
            }
        } catch (IOException e) {
            mailbox.add(new Closed("read failed: " + e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Reader on {} failed", connection.describe(), e);
            mailbox.add(new Closed("reader failed: " + e));
        }
    }

    private void handleFrame(byte[] frame) throws InterruptedException, IOException {
        ClientMessage request;
        try {
            request = codec.decodeClientMessage(frame);
        } catch (FrameDecodingException e) {
            log.warn("Dropping undecodable frame from {}: {}", connection.describe(), e.getMessage());
            return;
        }

        try {
            dispatch(request);
        } catch (MessengerException e) {
            if (e.code() == ErrorCode.STORAGE) {
                log.error("Storage failure handling {} for user {}", request.getClass().getSimpleName(), userId, e);
            } else {
                log.debug("Rejected {} from {}: {}", request.getClass().getSimpleName(),
                    connection.describe(), e.getMessage());
            }
            reply(new ServerMessage.Error(e.code().description()));
        }
    }

    // ============================================================
    // Dispatch
    // ============================================================

    private void dispatch(ClientMessage request) throws InterruptedException, IOException {
        boolean login = request instanceof ClientMessage.RequestUsername;
        if (!state.accepts(login)) {
            if (login) {
                log.warn("Ignoring repeated RequestUsername from user {}", userId);
            } else {
                log.warn("Ignoring {} from unauthenticated connection {}",
                    request.getClass().getSimpleName(), connection.describe());
            }
            return;
        }

        if (request instanceof ClientMessage.RequestUsername r) {
            login(r.username());
        } else if (request instanceof ClientMessage.GetMessages r) {
            List<MessageEntry> entries = callStore(() -> store.getMessages(userId, r.recipient()));
            reply(new ServerMessage.MessagesForRecipient(r.recipient(), entries));
        } else if (request instanceof ClientMessage.SendMessage r) {
            if (r.recipient().kind() == Recipient.Kind.USER && r.recipient().id() == userId) {
                throw new ProtocolException(ErrorCode.SELF_MESSAGE, "User " + userId + " messaged itself");
            }
            MessageEntry entry = callStore(() -> store.sendMessage(r.body(), userId, r.recipient()));
            publish(entry.message(), new ServerMessage.MessageSent(entry.id(), entry.message()));
        } else if (request instanceof ClientMessage.EditMessage r) {
            MessageEntry entry = callStore(() -> store.editMessageBody(r.id(), r.newBody(), userId));
            publish(entry.message(), new ServerMessage.MessageEdited(entry.id(), entry.message().body()));
        } else if (request instanceof ClientMessage.EditTags r) {
            MessageEntry entry = callStore(() -> store.editMessageTags(r.id(), r.newTags(), userId));
            publish(entry.message(), new ServerMessage.MessageTagsEdited(entry.id(), entry.message().tags()));
        } else if (request instanceof ClientMessage.DeleteMessage r) {
            MessageEntry entry = callStore(() -> store.deleteMessage(r.id(), userId));
            publish(entry.message(), new ServerMessage.MessageDeleted(entry.id()));
        } else if (request instanceof ClientMessage.CreateGroup r) {
            createGroup(r);
        } else if (request instanceof ClientMessage.EditGroup r) {
            editGroup(r);
        } else if (request instanceof ClientMessage.DeleteGroup r) {
            deleteGroup(r.id());
        }
    }

    // ============================================================
    // Login
    // ============================================================

    private void login(String username) throws InterruptedException, IOException {
        if (!USERNAME.matcher(username).matches()) {
            throw new ProtocolException(ErrorCode.INVALID_USERNAME, "Invalid username: " + username);
        }

        Login resolved = callStore(() -> resolveOrCreate(username));
        User user = resolved.user();
        if (!registry.register(user.id(), channel)) {
            throw new ProtocolException(ErrorCode.USERNAME_IN_USE, "User " + user.id() + " is already connected");
        }
        state = SessionState.AUTHENTICATED;
        userId = user.id();
        log.info("User {} ({}) logged in from {}{}", userId, username, connection.describe(),
            resolved.created() ? " (new user)" : "");

        ServerMessage announcement = resolved.created()
            ? new ServerMessage.UserAdded(new UserSummary(userId, username, true))
            : new ServerMessage.UserOnline(userId);
        broadcast(announcement);

        reply(callStore(this::welcome));
    }

    private Login resolveOrCreate(String username) {
        Optional<User> existing = store.getUserByUsername(username);
        if (existing.isPresent()) {
            return new Login(existing.get(), false);
        }
        try {
            return new Login(new User(store.createUser(username), username), true);
        } catch (StoreException e) {
            if (e.code() != ErrorCode.USERNAME_IN_USE) {
                throw e;
            }
            // created concurrently by another session
            return new Login(store.getUserByUsername(username).orElseThrow(() -> e), false);
        }
    }

    private ServerMessage.Welcome welcome() {
        Set<Integer> online = registry.onlineUserIds();
        List<UserSummary> users = new ArrayList<>();
        for (User user : store.listUsers()) {
            users.add(new UserSummary(user.id(), user.username(), online.contains(user.id())));
        }
        List<GroupSummary> groups = new ArrayList<>();
        for (Group group : store.getGroupsForUser(userId).values()) {
            groups.add(summarize(group));
        }
        return new ServerMessage.Welcome(userId, users, groups);
    }

    // ============================================================
    // Groups
    // ============================================================

    private void createGroup(ClientMessage.CreateGroup request) throws InterruptedException, IOException {
        Set<Integer> members = new TreeSet<>(request.members());
        members.add(userId);

        GroupSummary summary = callStore(() -> {
            int groupId = store.createOrUpdateGroup(request.name(), members, null, userId);
            return summarize(new Group(groupId, request.name(), members));
        });
        log.debug("User {} created group {}", userId, summary.id());

        ServerMessage added = new ServerMessage.GroupAdded(summary);
        reply(added);
        deliverTo(others(members), added);
    }

    private void editGroup(ClientMessage.EditGroup request) throws InterruptedException, IOException {
        Set<Integer> newMembers = new TreeSet<>(request.newMembers());

        GroupChange change = callStore(() -> {
            Group before = store.replaceGroup(request.id(), request.newName(), newMembers, userId);
            Group after = new Group(request.id(), request.newName(), newMembers);
            return new GroupChange(before.members(), after.members(), summarize(after));
        });

        ServerMessage edited = new ServerMessage.GroupEdited(change.summary());
        ServerMessage deleted = new ServerMessage.GroupDeleted(request.id());
        reply(change.after().contains(userId) ? edited : deleted);

        Set<Integer> retained = new TreeSet<>(change.after());
        retained.retainAll(change.before());
        Set<Integer> added = new TreeSet<>(change.after());
        added.removeAll(change.before());
        Set<Integer> removed = new TreeSet<>(change.before());
        removed.removeAll(change.after());

        deliverTo(others(retained), edited);
        deliverTo(others(added), new ServerMessage.GroupAdded(change.summary()));
        deliverTo(others(removed), deleted);
    }

    private void deleteGroup(int groupId) throws InterruptedException, IOException {
        Set<Integer> formerMembers = callStore(() -> store.deleteGroup(groupId, userId).members());
        log.debug("User {} deleted group {}", userId, groupId);

        ServerMessage deleted = new ServerMessage.GroupDeleted(groupId);
        reply(deleted);
        deliverTo(others(formerMembers), deleted);
    }

    private GroupSummary summarize(Group group) {
        List<String> names = new ArrayList<>();
        for (Integer member : group.members()) {
            store.getUserById(member).ifPresent(user -> names.add(user.username()));
        }
        return new GroupSummary(group.id(), group.name(), names);
    }

    // ============================================================
    // Delivery
    // ============================================================

    /**
     * Replies to the caller and forwards the event to every other live participant of the message.
     */
    private void publish(Message message, ServerMessage event) throws InterruptedException, IOException {
        reply(event);
        deliverTo(others(participants(message)), event);
    }

    private Set<Integer> participants(Message message) throws InterruptedException {
        Set<Integer> participants = new LinkedHashSet<>();
        participants.add(message.sender());
        Recipient recipient = message.recipient();
        if (recipient.kind() == Recipient.Kind.USER) {
            participants.add(recipient.id());
        } else {
            Optional<Group> group = callStore(() -> store.getGroup(recipient.id()));
            group.ifPresent(g -> participants.addAll(g.members()));
        }
        return participants;
    }

    private Set<Integer> others(Set<Integer> userIds) {
        Set<Integer> result = new LinkedHashSet<>(userIds);
        result.remove(userId);
        return result;
    }

    private void reply(ServerMessage message) throws IOException {
        connection.send(codec.encodeServerMessage(message));
    }

    private void deliverTo(Set<Integer> targets, ServerMessage event) {
        if (targets.isEmpty()) {
            return;
        }
        byte[] frame = codec.encodeServerMessage(event);
        for (Integer target : targets) {
            registry.get(target).ifPresent(targetChannel -> deliver(target, targetChannel, frame));
        }
    }

    private void broadcast(ServerMessage event) {
        byte[] frame = codec.encodeServerMessage(event);
        for (Map.Entry<Integer, DeliveryChannel> entry : registry.snapshot().entrySet()) {
            if (entry.getKey() != userId) {
                deliver(entry.getKey(), entry.getValue(), frame);
            }
        }
    }

    private static void deliver(int target, DeliveryChannel targetChannel, byte[] frame) {
        if (!targetChannel.deliver(frame)) {
            log.debug("Event for user {} not queued", target);
        }
    }

    private void cleanup() {
        if (state != SessionState.AUTHENTICATED) {
            return;
        }
        if (registry.unregister(userId, channel)) {
            broadcast(new ServerMessage.UserOffline(userId));
        }
        log.info("User {} logged out ({})", userId, connection.describe());
    }

    // ============================================================
    // Store offload
    // ============================================================

    /**
     * Runs a store call on the worker pool and waits for it.
     *
     * <p>A {@link MessengerException} from the call is rethrown as is. Any other failure ends the
     * connection.</p>
     */
    private <T> T callStore(Callable<T> call) throws InterruptedException {
        Future<T> future;
        try {
            future = storeExecutor.submit(call);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Store worker pool rejected the request", e);
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MessengerException messengerException) {
                throw messengerException;
            }
            throw new IllegalStateException("Store worker failed", cause);
        }
    }

    // ============================================================
    // Mailbox
    // ============================================================

    private sealed interface MailboxEvent permits Inbound, Outbound, Closed, Overflow {
    }

    private record Inbound(byte[] frame) implements MailboxEvent {
    }

    private record Outbound(byte[] frame) implements MailboxEvent {
    }

    private record Closed(String reason) implements MailboxEvent {
    }

    private record Overflow() implements MailboxEvent {
    }

    private record Login(User user, boolean created) {
    }

    private record GroupChange(Set<Integer> before, Set<Integer> after, GroupSummary summary) {
    }

    /**
     * This session's handle in the presence registry.
     */
    private final class MailboxChannel implements DeliveryChannel {

        @Override
        public boolean deliver(byte[] frame) {
            if (finished) {
                return false;
            }
            if (pendingDeliveries.incrementAndGet() > config.deliveryQueueCapacity()) {
                pendingDeliveries.decrementAndGet();
                if (overflowed.compareAndSet(false, true)) {
                    mailbox.add(new Overflow());
                }
                return false;
            }
            mailbox.add(new Outbound(frame));
            return true;
        }
    }
}

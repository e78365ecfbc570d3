package com.ryuqq.messenger.application.session;

import com.ryuqq.messenger.application.presence.PresenceRegistry;
import com.ryuqq.messenger.core.spi.Connection;
import com.ryuqq.messenger.core.spi.FrameCodec;
import com.ryuqq.messenger.core.spi.MessengerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 메신저 서버 진입점.
 *
 * <p>외부 리스너(TCP, 로컬 소켓, WebSocket 업그레이드)가 수락한 연결을 {@link #accept(Connection)}로 넘기면
 * 연결마다 {@link ConnectionActor}가 시작됩니다.</p>
 *
 * <p><strong>스레드 풀:</strong></p>
 * <ul>
 *   <li>store 풀: 고정 크기 ({@link SessionConfig#storeWorkers()}), 모든 저장소 호출 실행</li>
 *   <li>connection 풀: 연결당 세션 루프 스레드 + 수신 스레드</li>
 * </ul>
 *
 * <p>저장소의 수명은 호출자가 관리합니다. {@link #close()}는 저장소를 닫지 않습니다.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * MessengerStore store = new MvStoreMessengerStore(MvStoreConfig.file(path));
 * MessengerServer server = new MessengerServer(store, new MessagePackFrameCodec(), new SessionConfig());
 * listener.onAccept(server::accept);
 * ...
 * server.close();
 * store.close();
 * </pre>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public class MessengerServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MessengerServer.class);

    private final MessengerStore store;
    private final FrameCodec codec;
    private final SessionConfig config;
    private final PresenceRegistry registry;
    private final ExecutorService storeExecutor;
    private final ExecutorService connectionExecutor;

    private volatile boolean closed;

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param codec 프레임 코덱
     * @param config 세션 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MessengerServer(MessengerStore store, FrameCodec codec, SessionConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.codec = codec;
        this.config = config;
        this.registry = new PresenceRegistry();
        this.storeExecutor = Executors.newFixedThreadPool(config.storeWorkers(), named("messenger-store-"));
        this.connectionExecutor = Executors.newCachedThreadPool(named("messenger-conn-"));
        log.info("Messenger server started (storeWorkers={}, deliveryQueueCapacity={})",
            config.storeWorkers(), config.isDeliveryBounded() ? config.deliveryQueueCapacity() : "unbounded");
    }

    /**
     * 수락된 연결의 세션 시작.
     *
     * @param connection 클라이언트 연결
     * @throws IllegalStateException 서버가 종료된 경우
     */
    public void accept(Connection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("connection cannot be null");
        }
        if (closed) {
            connection.close();
            throw new IllegalStateException("Server is closed");
        }
        connectionExecutor.execute(new ConnectionActor(
            connection, codec, store, registry, storeExecutor, connectionExecutor, config));
    }

    /**
     * @return 접속 레지스트리
     */
    public PresenceRegistry registry() {
        return registry;
    }

    /**
     * 서버 종료.
     *
     * <p>모든 세션을 인터럽트하여 정리 경로(레지스트리 해제)를 거쳐 종료시키고,
     * 진행 중인 저장소 트랜잭션은 완료될 때까지 기다립니다.</p>
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        connectionExecutor.shutdownNow();
        storeExecutor.shutdown();
        try {
            if (!connectionExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Connections did not terminate within {}ms", config.shutdownTimeoutMs());
            }
            if (!storeExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Store workers did not terminate within {}ms", config.shutdownTimeoutMs());
                storeExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            storeExecutor.shutdownNow();
        }
        log.info("Messenger server stopped");
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

package com.ryuqq.messenger.application.presence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 접속 중인 사용자 레지스트리 (userId → DeliveryChannel).
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>브로드캐스트/대상 전송 (get, snapshot, isOnline): read lock</li>
 *   <li>로그인/로그아웃 (register, unregister): write lock</li>
 *   <li>락을 잡은 채로 전달하지 않음: snapshot은 복사본을 반환</li>
 * </ul>
 *
 * <p>사용자당 최대 하나의 세션만 등록됩니다. {@link #register(int, DeliveryChannel)}는
 * 확인과 삽입을 하나의 write lock 안에서 수행하므로 같은 사용자의 동시 로그인 중 하나만 성공합니다.</p>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public class PresenceRegistry {

    private static final Logger log = LoggerFactory.getLogger(PresenceRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Integer, DeliveryChannel> channels = new HashMap<>();

    /**
     * 세션 등록 (이미 등록된 사용자면 아무것도 바꾸지 않음).
     *
     * @param userId 사용자 ID
     * @param channel 세션의 전달 채널
     * @return 등록되었으면 true, 이미 접속 중이면 false
     */
    public boolean register(int userId, DeliveryChannel channel) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        lock.writeLock().lock();
        try {
            if (channels.containsKey(userId)) {
                return false;
            }
            channels.put(userId, channel);
            log.debug("Registered user {} ({} online)", userId, channels.size());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 세션 등록 해제.
     *
     * <p>등록된 채널이 주어진 채널과 같을 때만 제거합니다.</p>
     *
     * @param userId 사용자 ID
     * @param channel 해제할 세션의 채널
     * @return 제거되었으면 true
     */
    public boolean unregister(int userId, DeliveryChannel channel) {
        lock.writeLock().lock();
        try {
            boolean removed = channels.remove(userId, channel);
            if (removed) {
                log.debug("Unregistered user {} ({} online)", userId, channels.size());
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isOnline(int userId) {
        lock.readLock().lock();
        try {
            return channels.containsKey(userId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<DeliveryChannel> get(int userId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(channels.get(userId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 브로드캐스트용 스냅샷.
     *
     * @return 현재 등록된 채널의 복사본
     */
    public Map<Integer, DeliveryChannel> snapshot() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new HashMap<>(channels));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return 접속 중인 사용자 ID (오름차순)
     */
    public Set<Integer> onlineUserIds() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(channels.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return channels.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}

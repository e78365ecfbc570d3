package com.ryuqq.messenger.application.session;

/**
 * 세션 계층 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>storeWorkers: 저장소 호출을 실행하는 워커 스레드 수 (기본 4)</li>
 *   <li>deliveryQueueCapacity: 세션별 미전송 이벤트 상한 (기본 Integer.MAX_VALUE = 무제한).
 *       상한을 넘으면 느린 소비자로 보고 연결을 끊습니다.</li>
 *   <li>shutdownTimeoutMs: 서버 종료 시 스레드 풀 대기 시간 (기본 5000ms)</li>
 * </ul>
 *
 * @author Messenger Team
 * @since 1.0.0
 * @param storeWorkers 저장소 워커 수 (1 이상)
 * @param deliveryQueueCapacity 세션별 전달 큐 상한 (1 이상)
 * @param shutdownTimeoutMs 종료 대기 시간 (0 이상)
 */
public record SessionConfig(int storeWorkers, int deliveryQueueCapacity, long shutdownTimeoutMs) {

    private static final int DEFAULT_STORE_WORKERS = 4;
    private static final int UNBOUNDED = Integer.MAX_VALUE;
    private static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 5000L;

    /**
     * 기본 설정 생성자.
     */
    public SessionConfig() {
        this(DEFAULT_STORE_WORKERS, UNBOUNDED, DEFAULT_SHUTDOWN_TIMEOUT_MS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SessionConfig {
        if (storeWorkers <= 0) {
            throw new IllegalArgumentException(
                "storeWorkers must be positive (current: " + storeWorkers + ")"
            );
        }
        if (deliveryQueueCapacity <= 0) {
            throw new IllegalArgumentException(
                "deliveryQueueCapacity must be positive (current: " + deliveryQueueCapacity + ")"
            );
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be non-negative (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * @return 전달 큐에 상한이 있으면 true
     */
    public boolean isDeliveryBounded() {
        return deliveryQueueCapacity != UNBOUNDED;
    }

    public SessionConfig withStoreWorkers(int storeWorkers) {
        return new SessionConfig(storeWorkers, deliveryQueueCapacity, shutdownTimeoutMs);
    }

    public SessionConfig withDeliveryQueueCapacity(int deliveryQueueCapacity) {
        return new SessionConfig(storeWorkers, deliveryQueueCapacity, shutdownTimeoutMs);
    }

    public SessionConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new SessionConfig(storeWorkers, deliveryQueueCapacity, shutdownTimeoutMs);
    }
}

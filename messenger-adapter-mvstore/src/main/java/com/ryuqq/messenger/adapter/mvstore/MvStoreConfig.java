package com.ryuqq.messenger.adapter.mvstore;

import java.nio.file.Path;

/**
 * MVStore 저장소 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>fileName: 데이터베이스 파일 경로 (null이면 메모리 전용, 프로세스 종료 시 소멸)</li>
 *   <li>compress: 청크 압축 여부 (기본 false)</li>
 *   <li>cacheSizeMb: 페이지 캐시 크기 (기본 16MB)</li>
 * </ul>
 *
 * @author Messenger Team
 * @since 1.0.0
 * @param fileName 데이터베이스 파일 경로 (null 허용)
 * @param compress 압축 여부
 * @param cacheSizeMb 캐시 크기 (MB, 1 이상이어야 함)
 */
public record MvStoreConfig(String fileName, boolean compress, int cacheSizeMb) {

    private static final int DEFAULT_CACHE_SIZE_MB = 16;

    /**
     * 기본 설정 생성자 (메모리 전용).
     */
    public MvStoreConfig() {
        this(null, false, DEFAULT_CACHE_SIZE_MB);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MvStoreConfig {
        if (fileName != null && fileName.isBlank()) {
            throw new IllegalArgumentException("fileName cannot be blank (use null for in-memory)");
        }
        if (cacheSizeMb <= 0) {
            throw new IllegalArgumentException(
                "cacheSizeMb must be positive (current: " + cacheSizeMb + ")"
            );
        }
    }

    /**
     * 메모리 전용 설정.
     *
     * @return 메모리 전용 MvStoreConfig
     */
    public static MvStoreConfig inMemory() {
        return new MvStoreConfig();
    }

    /**
     * 파일 기반 설정.
     *
     * @param path 데이터베이스 파일 경로
     * @return 파일 기반 MvStoreConfig
     */
    public static MvStoreConfig file(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        return new MvStoreConfig(path.toString(), false, DEFAULT_CACHE_SIZE_MB);
    }

    /**
     * @return 메모리 전용이면 true
     */
    public boolean isInMemory() {
        return fileName == null;
    }

    /**
     * compress만 변경한 새 인스턴스 생성.
     */
    public MvStoreConfig withCompress(boolean compress) {
        return new MvStoreConfig(fileName, compress, cacheSizeMb);
    }

    /**
     * cacheSizeMb만 변경한 새 인스턴스 생성.
     */
    public MvStoreConfig withCacheSizeMb(int cacheSizeMb) {
        return new MvStoreConfig(fileName, compress, cacheSizeMb);
    }
}

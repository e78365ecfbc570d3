package com.ryuqq.messenger.core.protocol;

/**
 * 클라이언트에 전달되는 사용자 요약.
 *
 * @param id 사용자 ID
 * @param name 사용자명
 * @param online 현재 접속 여부
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public record UserSummary(int id, String name, boolean online) {

    public UserSummary {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
    }
}

package com.ryuqq.messenger.core.model;

/**
 * 등록된 사용자.
 *
 * <p>사용자는 처음 보는 사용자명으로 로그인에 성공할 때 생성되며 삭제되지 않습니다.
 * 사용자명은 유일하며 한 번 할당되면 변경할 수 없습니다.</p>
 *
 * @param id 사용자 ID (Store가 할당, 0 이상)
 * @param username 사용자명
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public record User(int id, String username) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 음수이거나 username이 null/빈 문자열인 경우
     */
    public User {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative (current: " + id + ")");
        }
        if (username == null || username.isEmpty()) {
            throw new IllegalArgumentException("username cannot be null or empty");
        }
    }
}

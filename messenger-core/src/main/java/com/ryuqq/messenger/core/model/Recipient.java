package com.ryuqq.messenger.core.model;

import java.io.Serializable;

/**
 * 메시지 수신 대상 (단일 사용자 또는 그룹).
 *
 * <p>Recipient는 메시지 필드이자 전달 인덱스 키의 첫 구성요소로 사용되므로
 * 전순서(total order)를 가집니다: 먼저 {@link Kind} (USER &lt; GROUP), 그 다음 id.</p>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public sealed interface Recipient extends Comparable<Recipient>, Serializable
        permits Recipient.ToUser, Recipient.ToGroup {

    /**
     * 수신 대상 종류. 선언 순서가 정렬 순서입니다.
     */
    enum Kind {
        USER,
        GROUP
    }

    /**
     * @return 수신 대상 종류
     */
    Kind kind();

    /**
     * @return 대상 사용자 ID 또는 그룹 ID
     */
    int id();

    /**
     * 사용자 수신 대상 생성.
     *
     * @param userId 사용자 ID
     * @return ToUser 인스턴스
     */
    static Recipient user(int userId) {
        return new ToUser(userId);
    }

    /**
     * 그룹 수신 대상 생성.
     *
     * @param groupId 그룹 ID
     * @return ToGroup 인스턴스
     */
    static Recipient group(int groupId) {
        return new ToGroup(groupId);
    }

    /**
     * 종류와 id로 수신 대상 생성.
     *
     * @param kind 종류
     * @param id 대상 ID
     * @return Recipient 인스턴스
     */
    static Recipient of(Kind kind, int id) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return kind == Kind.USER ? new ToUser(id) : new ToGroup(id);
    }

    @Override
    default int compareTo(Recipient other) {
        int byKind = kind().compareTo(other.kind());
        return byKind != 0 ? byKind : Integer.compare(id(), other.id());
    }

    /**
     * 단일 사용자 수신 대상.
     *
     * @param userId 사용자 ID
     */
    record ToUser(int userId) implements Recipient {

        private static final long serialVersionUID = 1L;

        public ToUser {
            if (userId < 0) {
                throw new IllegalArgumentException("userId must be non-negative (current: " + userId + ")");
            }
        }

        @Override
        public Kind kind() {
            return Kind.USER;
        }

        @Override
        public int id() {
            return userId;
        }
    }

    /**
     * 그룹 수신 대상.
     *
     * @param groupId 그룹 ID
     */
    record ToGroup(int groupId) implements Recipient {

        private static final long serialVersionUID = 1L;

        public ToGroup {
            if (groupId < 0) {
                throw new IllegalArgumentException("groupId must be non-negative (current: " + groupId + ")");
            }
        }

        @Override
        public Kind kind() {
            return Kind.GROUP;
        }

        @Override
        public int id() {
            return groupId;
        }
    }
}

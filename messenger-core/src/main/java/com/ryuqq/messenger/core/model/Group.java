package com.ryuqq.messenger.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 그룹 (이름 + 멤버 집합).
 *
 * <p>그룹은 create-or-update 연산으로 통째로 생성되거나 교체됩니다.
 * 멤버 집합은 병합되지 않고 항상 전체가 교체됩니다.</p>
 *
 * <p><strong>불변성:</strong> members는 정렬된 읽기 전용 집합으로 복사됩니다.</p>
 *
 * @param id 그룹 ID
 * @param name 그룹 이름
 * @param members 멤버 사용자 ID 집합
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public record Group(int id, String name, Set<Integer> members) implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 음수이거나 name/members가 null인 경우
     */
    public Group {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative (current: " + id + ")");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (members == null) {
            throw new IllegalArgumentException("members cannot be null");
        }
        members = Collections.unmodifiableSortedSet(new TreeSet<>(members));
    }

    /**
     * 주어진 사용자가 현재 멤버인지 확인.
     *
     * @param userId 사용자 ID
     * @return 멤버이면 true
     */
    public boolean hasMember(int userId) {
        return members.contains(userId);
    }
}

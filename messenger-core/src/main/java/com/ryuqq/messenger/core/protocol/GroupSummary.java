package com.ryuqq.messenger.core.protocol;

import java.util.List;

/**
 * 클라이언트에 전달되는 그룹 요약 (멤버는 사용자명으로 해석됨).
 *
 * @param id 그룹 ID
 * @param name 그룹 이름
 * @param members 멤버 사용자명 목록
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public record GroupSummary(int id, String name, List<String> members) {

    public GroupSummary {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        members = members == null ? List.of() : List.copyOf(members);
    }
}

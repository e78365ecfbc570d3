package com.ryuqq.messenger.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 메시지 태그 정규화 유틸리티.
 *
 * <p>각 입력 태그를 공백과 쉼표로 분리하고, 앞뒤 공백을 제거하고, 소문자로 바꾼 뒤
 * 빈 토큰을 버립니다. 입력 순서는 유지됩니다.</p>
 *
 * <pre>
 * Tags.normalize(List.of("Work, URGENT", " later ")) → ["work", "urgent", "later"]
 * </pre>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public final class Tags {

    private Tags() {
    }

    /**
     * 태그 목록 정규화.
     *
     * @param rawTags 원본 태그 목록 (null이면 빈 목록)
     * @return 정규화된 태그 목록 (불변)
     */
    public static List<String> normalize(List<String> rawTags) {
        if (rawTags == null || rawTags.isEmpty()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String raw : rawTags) {
            if (raw == null) {
                continue;
            }
            for (String token : raw.split("[ ,]")) {
                String tag = token.trim().toLowerCase(Locale.ROOT);
                if (!tag.isEmpty()) {
                    result.add(tag);
                }
            }
        }
        return List.copyOf(result);
    }
}

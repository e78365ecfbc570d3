package com.ryuqq.messenger.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * 저장된 메시지 본문과 메타데이터.
 *
 * <p>메시지 ID는 레코드에 포함되지 않으며 {@link MessageEntry}로 짝지어 전달됩니다.</p>
 *
 * @param sender 보낸 사용자 ID
 * @param recipient 수신 대상
 * @param body 본문
 * @param createdAt 생성 시각 (epoch seconds)
 * @param tags 정규화된 태그 목록 (순서 유지)
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public record Message(
    int sender,
    Recipient recipient,
    String body,
    long createdAt,
    List<String> tags
) implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public Message {
        if (sender < 0) {
            throw new IllegalArgumentException("sender must be non-negative (current: " + sender + ")");
        }
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * 본문만 변경한 새 인스턴스 생성.
     *
     * @param newBody 새 본문
     * @return 새 Message 인스턴스
     */
    public Message withBody(String newBody) {
        return new Message(sender, recipient, newBody, createdAt, tags);
    }

    /**
     * 태그만 변경한 새 인스턴스 생성.
     *
     * @param newTags 새 태그 목록
     * @return 새 Message 인스턴스
     */
    public Message withTags(List<String> newTags) {
        return new Message(sender, recipient, body, createdAt, newTags);
    }

    /**
     * 주어진 사용자가 이 메시지의 직접 수신자인지 확인.
     *
     * @param userId 사용자 ID
     * @return 사용자 수신 대상이고 id가 일치하면 true
     */
    public boolean isDirectlyAddressedTo(int userId) {
        return recipient.kind() == Recipient.Kind.USER && recipient.id() == userId;
    }
}

package com.ryuqq.messenger.core.protocol;

import com.ryuqq.messenger.core.model.Recipient;

import java.util.List;

/**
 * 클라이언트 → 서버 요청.
 *
 * <p>요청 종류마다 하나의 record가 대응하는 sealed interface입니다.
 * 인증 전에는 {@link RequestUsername}만 처리되며, 나머지 요청은 경고 로그 후 무시됩니다.</p>
 *
 * <ul>
 *   <li>인증: {@link RequestUsername}</li>
 *   <li>메시지: {@link GetMessages}, {@link SendMessage}, {@link EditMessage}, {@link EditTags}, {@link DeleteMessage}</li>
 *   <li>그룹: {@link CreateGroup}, {@link EditGroup}, {@link DeleteGroup}</li>
 * </ul>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public sealed interface ClientMessage permits
        ClientMessage.RequestUsername,
        ClientMessage.GetMessages,
        ClientMessage.SendMessage,
        ClientMessage.EditMessage,
        ClientMessage.EditTags,
        ClientMessage.DeleteMessage,
        ClientMessage.CreateGroup,
        ClientMessage.EditGroup,
        ClientMessage.DeleteGroup {

    /**
     * 사용자명으로 로그인 (없으면 사용자 생성).
     *
     * @param username 요청 사용자명
     */
    record RequestUsername(String username) implements ClientMessage {
        public RequestUsername {
            if (username == null) {
                throw new IllegalArgumentException("username cannot be null");
            }
        }
    }

    /**
     * 수신 대상과의 대화 조회.
     *
     * @param recipient 사용자 또는 그룹
     */
    record GetMessages(Recipient recipient) implements ClientMessage {
        public GetMessages {
            if (recipient == null) {
                throw new IllegalArgumentException("recipient cannot be null");
            }
        }
    }

    /**
     * 메시지 전송.
     *
     * @param body 본문
     * @param recipient 수신 대상
     */
    record SendMessage(String body, Recipient recipient) implements ClientMessage {
        public SendMessage {
            if (body == null) {
                throw new IllegalArgumentException("body cannot be null");
            }
            if (recipient == null) {
                throw new IllegalArgumentException("recipient cannot be null");
            }
        }
    }

    /**
     * 메시지 본문 수정.
     *
     * @param id 메시지 ID
     * @param newBody 새 본문
     */
    record EditMessage(int id, String newBody) implements ClientMessage {
        public EditMessage {
            if (newBody == null) {
                throw new IllegalArgumentException("newBody cannot be null");
            }
        }
    }

    /**
     * 메시지 태그 교체.
     *
     * @param id 메시지 ID
     * @param newTags 새 태그 (서버에서 정규화)
     */
    record EditTags(int id, List<String> newTags) implements ClientMessage {
        public EditTags {
            newTags = newTags == null ? List.of() : List.copyOf(newTags);
        }
    }

    /**
     * 메시지 삭제.
     *
     * @param id 메시지 ID
     */
    record DeleteMessage(int id) implements ClientMessage {
    }

    /**
     * 그룹 생성.
     *
     * @param name 그룹 이름
     * @param members 멤버 사용자 ID 목록
     */
    record CreateGroup(String name, List<Integer> members) implements ClientMessage {
        public CreateGroup {
            if (name == null) {
                throw new IllegalArgumentException("name cannot be null");
            }
            members = members == null ? List.of() : List.copyOf(members);
        }
    }

    /**
     * 그룹 이름과 멤버 전체 교체.
     *
     * @param id 그룹 ID
     * @param newName 새 이름
     * @param newMembers 새 멤버 목록
     */
    record EditGroup(int id, String newName, List<Integer> newMembers) implements ClientMessage {
        public EditGroup {
            if (newName == null) {
                throw new IllegalArgumentException("newName cannot be null");
            }
            newMembers = newMembers == null ? List.of() : List.copyOf(newMembers);
        }
    }

    /**
     * 그룹 삭제 (그룹 메시지 연쇄 삭제).
     *
     * @param id 그룹 ID
     */
    record DeleteGroup(int id) implements ClientMessage {
    }
}

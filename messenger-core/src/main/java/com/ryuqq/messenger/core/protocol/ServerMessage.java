package com.ryuqq.messenger.core.protocol;

import com.ryuqq.messenger.core.model.Message;
import com.ryuqq.messenger.core.model.MessageEntry;
import com.ryuqq.messenger.core.model.Recipient;

import java.util.List;

/**
 * 서버 → 클라이언트 이벤트.
 *
 * <p>요청에 대한 응답과, 다른 세션에서 발생한 변경의 실시간 전달 모두 이 타입으로 표현됩니다.</p>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public sealed interface ServerMessage permits
        ServerMessage.Error,
        ServerMessage.Welcome,
        ServerMessage.UserAdded,
        ServerMessage.UserOnline,
        ServerMessage.UserOffline,
        ServerMessage.MessagesForRecipient,
        ServerMessage.MessageSent,
        ServerMessage.MessageEdited,
        ServerMessage.MessageTagsEdited,
        ServerMessage.MessageDeleted,
        ServerMessage.GroupAdded,
        ServerMessage.GroupEdited,
        ServerMessage.GroupDeleted {

    /**
     * 요청 실패 (요청한 세션에만 전달).
     *
     * @param message 오류 설명
     */
    record Error(String message) implements ServerMessage {
        public Error {
            if (message == null) {
                throw new IllegalArgumentException("message cannot be null");
            }
        }
    }

    /**
     * 로그인 성공 응답.
     *
     * @param userId 로그인한 사용자 ID
     * @param users 전체 사용자 (접속 여부 포함)
     * @param groups 사용자가 속한 그룹
     */
    record Welcome(int userId, List<UserSummary> users, List<GroupSummary> groups) implements ServerMessage {
        public Welcome {
            users = users == null ? List.of() : List.copyOf(users);
            groups = groups == null ? List.of() : List.copyOf(groups);
        }
    }

    /**
     * 새 사용자가 처음 로그인함.
     *
     * @param user 새 사용자
     */
    record UserAdded(UserSummary user) implements ServerMessage {
        public UserAdded {
            if (user == null) {
                throw new IllegalArgumentException("user cannot be null");
            }
        }
    }

    /**
     * 기존 사용자가 접속함.
     *
     * @param id 사용자 ID
     */
    record UserOnline(int id) implements ServerMessage {
    }

    /**
     * 사용자가 접속을 끊음.
     *
     * @param id 사용자 ID
     */
    record UserOffline(int id) implements ServerMessage {
    }

    /**
     * 대화 조회 결과 (메시지 ID 오름차순).
     *
     * @param recipient 조회한 수신 대상
     * @param messages 메시지 목록
     */
    record MessagesForRecipient(Recipient recipient, List<MessageEntry> messages) implements ServerMessage {
        public MessagesForRecipient {
            if (recipient == null) {
                throw new IllegalArgumentException("recipient cannot be null");
            }
            messages = messages == null ? List.of() : List.copyOf(messages);
        }
    }

    /**
     * 메시지 전송됨.
     *
     * @param id 메시지 ID
     * @param message 메시지
     */
    record MessageSent(int id, Message message) implements ServerMessage {
        public MessageSent {
            if (message == null) {
                throw new IllegalArgumentException("message cannot be null");
            }
        }
    }

    /**
     * 메시지 본문 수정됨.
     *
     * @param id 메시지 ID
     * @param newBody 새 본문
     */
    record MessageEdited(int id, String newBody) implements ServerMessage {
        public MessageEdited {
            if (newBody == null) {
                throw new IllegalArgumentException("newBody cannot be null");
            }
        }
    }

    /**
     * 메시지 태그 수정됨.
     *
     * @param id 메시지 ID
     * @param tags 정규화된 새 태그
     */
    record MessageTagsEdited(int id, List<String> tags) implements ServerMessage {
        public MessageTagsEdited {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }
    }

    /**
     * 메시지 삭제됨.
     *
     * @param id 메시지 ID
     */
    record MessageDeleted(int id) implements ServerMessage {
    }

    /**
     * 그룹이 생겼거나 그룹에 추가됨.
     *
     * @param group 그룹
     */
    record GroupAdded(GroupSummary group) implements ServerMessage {
        public GroupAdded {
            if (group == null) {
                throw new IllegalArgumentException("group cannot be null");
            }
        }
    }

    /**
     * 그룹 이름/멤버가 변경됨.
     *
     * @param group 변경된 그룹
     */
    record GroupEdited(GroupSummary group) implements ServerMessage {
        public GroupEdited {
            if (group == null) {
                throw new IllegalArgumentException("group cannot be null");
            }
        }
    }

    /**
     * 그룹이 삭제되었거나 그룹에서 제외됨.
     *
     * @param id 그룹 ID
     */
    record GroupDeleted(int id) implements ServerMessage {
    }
}

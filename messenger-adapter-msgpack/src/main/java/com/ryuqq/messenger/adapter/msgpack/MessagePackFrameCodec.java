package com.ryuqq.messenger.adapter.msgpack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.messenger.core.model.Message;
import com.ryuqq.messenger.core.model.MessageEntry;
import com.ryuqq.messenger.core.model.Recipient;
import com.ryuqq.messenger.core.protocol.ClientMessage;
import com.ryuqq.messenger.core.protocol.FrameDecodingException;
import com.ryuqq.messenger.core.protocol.GroupSummary;
import com.ryuqq.messenger.core.protocol.ServerMessage;
import com.ryuqq.messenger.core.protocol.UserSummary;
import com.ryuqq.messenger.core.spi.FrameCodec;
import org.msgpack.core.MessagePackException;
import org.msgpack.jackson.dataformat.MessagePackFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * MessagePack 기반 {@link FrameCodec} 구현체.
 *
 * <p>각 프레임은 하나의 MessagePack map이며 {@code "type"} 키에 variant 이름을 담습니다
 * (internally tagged). 필드 이름은 웹 클라이언트와 동일합니다.</p>
 *
 * <p><strong>인코딩 규칙:</strong></p>
 * <ul>
 *   <li>Recipient: {@code {"User": id}} 또는 {@code {"Group": id}}</li>
 *   <li>Message: {@code {sender, recipient, message, time, tags}}</li>
 *   <li>메시지 목록: {@code [[id, message], ...]}</li>
 * </ul>
 *
 * <p><strong>예시 (SendMessage):</strong></p>
 * <pre>
 * {"type": "SendMessage", "message": "hi", "recipient": {"User": 1}}
 * </pre>
 *
 * <p>Jackson 트리 모델로 직접 매핑하므로 core 타입에 어노테이션이 필요 없습니다.
 * ObjectMapper는 설정 후 불변이므로 이 클래스는 thread-safe 합니다.</p>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public final class MessagePackFrameCodec implements FrameCodec {

    static final String TYPE = "type";

    private final ObjectMapper mapper;

    public MessagePackFrameCodec() {
        this(new ObjectMapper(new MessagePackFactory()));
    }

    /**
     * 생성자 (ObjectMapper 주입).
     *
     * @param mapper MessagePackFactory 기반 ObjectMapper
     * @throws IllegalArgumentException mapper가 null인 경우
     */
    public MessagePackFrameCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    // ============================================================
    // Server → Client
    // ============================================================

    @Override
    public byte[] encodeServerMessage(ServerMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        ObjectNode node = mapper.createObjectNode();

        if (message instanceof ServerMessage.Error error) {
            node.put(TYPE, "Error");
            node.put("err", error.message());
        } else if (message instanceof ServerMessage.Welcome welcome) {
            node.put(TYPE, "Welcome");
            node.put("user_id", welcome.userId());
            ArrayNode users = node.putArray("users");
            for (UserSummary user : welcome.users()) {
                users.add(userNode(user));
            }
            ArrayNode groups = node.putArray("groups");
            for (GroupSummary group : welcome.groups()) {
                groups.add(groupNode(group));
            }
        } else if (message instanceof ServerMessage.UserAdded added) {
            node.put(TYPE, "UserAdded");
            node.set("user", userNode(added.user()));
        } else if (message instanceof ServerMessage.UserOnline online) {
            node.put(TYPE, "UserOnline");
            node.put("id", online.id());
        } else if (message instanceof ServerMessage.UserOffline offline) {
            node.put(TYPE, "UserOffline");
            node.put("id", offline.id());
        } else if (message instanceof ServerMessage.MessagesForRecipient result) {
            node.put(TYPE, "MessageForRecipient");
            node.set("recipient", recipientNode(result.recipient()));
            ArrayNode messages = node.putArray("messages");
            for (MessageEntry entry : result.messages()) {
                ArrayNode pair = messages.addArray();
                pair.add(entry.id());
                pair.add(messageNode(entry.message()));
            }
        } else if (message instanceof ServerMessage.MessageSent sent) {
            node.put(TYPE, "MessageSent");
            node.put("id", sent.id());
            node.set("message", messageNode(sent.message()));
        } else if (message instanceof ServerMessage.MessageEdited edited) {
            node.put(TYPE, "MessageEdited");
            node.put("id", edited.id());
            node.put("new_message", edited.newBody());
        } else if (message instanceof ServerMessage.MessageTagsEdited edited) {
            node.put(TYPE, "MessageTagsEdited");
            node.put("id", edited.id());
            node.set("tags", stringArray(edited.tags()));
        } else if (message instanceof ServerMessage.MessageDeleted deleted) {
            node.put(TYPE, "MessageDeleted");
            node.put("id", deleted.id());
        } else if (message instanceof ServerMessage.GroupAdded added) {
            node.put(TYPE, "GroupAdded");
            node.set("group", groupNode(added.group()));
        } else if (message instanceof ServerMessage.GroupEdited edited) {
            node.put(TYPE, "GroupEdited");
            node.set("group", groupNode(edited.group()));
        } else if (message instanceof ServerMessage.GroupDeleted deleted) {
            node.put(TYPE, "GroupDeleted");
            node.put("id", deleted.id());
        } else {
            throw new IllegalArgumentException("Unsupported server message: " + message.getClass().getName());
        }
        return write(node);
    }

    @Override
    public ServerMessage decodeServerMessage(byte[] frame) {
        JsonNode node = read(frame);
        String type = requireText(node, TYPE);

        switch (type) {
            case "Error":
                return new ServerMessage.Error(requireText(node, "err"));
            case "Welcome": {
                List<UserSummary> users = new ArrayList<>();
                for (JsonNode user : requireArray(node, "users")) {
                    users.add(readUser(user));
                }
                List<GroupSummary> groups = new ArrayList<>();
                for (JsonNode group : requireArray(node, "groups")) {
                    groups.add(readGroup(group));
                }
                return new ServerMessage.Welcome(requireInt(node, "user_id"), users, groups);
            }
            case "UserAdded":
                return new ServerMessage.UserAdded(readUser(requireField(node, "user")));
            case "UserOnline":
                return new ServerMessage.UserOnline(requireInt(node, "id"));
            case "UserOffline":
                return new ServerMessage.UserOffline(requireInt(node, "id"));
            case "MessageForRecipient": {
                List<MessageEntry> messages = new ArrayList<>();
                for (JsonNode pair : requireArray(node, "messages")) {
                    if (!pair.isArray() || pair.size() != 2) {
                        throw new FrameDecodingException("Message entry must be an [id, message] pair");
                    }
                    messages.add(new MessageEntry(asInt(pair.get(0), "id"), readMessage(pair.get(1))));
                }
                return new ServerMessage.MessagesForRecipient(readRecipient(requireField(node, "recipient")), messages);
            }
            case "MessageSent":
                return new ServerMessage.MessageSent(requireInt(node, "id"), readMessage(requireField(node, "message")));
            case "MessageEdited":
                return new ServerMessage.MessageEdited(requireInt(node, "id"), requireText(node, "new_message"));
            case "MessageTagsEdited":
                return new ServerMessage.MessageTagsEdited(requireInt(node, "id"), readStrings(node, "tags"));
            case "MessageDeleted":
                return new ServerMessage.MessageDeleted(requireInt(node, "id"));
            case "GroupAdded":
                return new ServerMessage.GroupAdded(readGroup(requireField(node, "group")));
            case "GroupEdited":
                return new ServerMessage.GroupEdited(readGroup(requireField(node, "group")));
            case "GroupDeleted":
                return new ServerMessage.GroupDeleted(requireInt(node, "id"));
            default:
                throw new FrameDecodingException("Unknown server message type: " + type);
        }
    }

    // ============================================================
    // Client → Server
    // ============================================================

    @Override
    public byte[] encodeClientMessage(ClientMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        ObjectNode node = mapper.createObjectNode();

        if (message instanceof ClientMessage.RequestUsername request) {
            node.put(TYPE, "RequestUsername");
            node.put("username", request.username());
        } else if (message instanceof ClientMessage.GetMessages request) {
            node.put(TYPE, "GetMessages");
            node.set("recipient", recipientNode(request.recipient()));
        } else if (message instanceof ClientMessage.SendMessage request) {
            node.put(TYPE, "SendMessage");
            node.put("message", request.body());
            node.set("recipient", recipientNode(request.recipient()));
        } else if (message instanceof ClientMessage.EditMessage request) {
            node.put(TYPE, "EditMessage");
            node.put("id", request.id());
            node.put("new_message", request.newBody());
        } else if (message instanceof ClientMessage.EditTags request) {
            node.put(TYPE, "EditTags");
            node.put("id", request.id());
            node.set("new_tags", stringArray(request.newTags()));
        } else if (message instanceof ClientMessage.DeleteMessage request) {
            node.put(TYPE, "DeleteMessage");
            node.put("id", request.id());
        } else if (message instanceof ClientMessage.CreateGroup request) {
            node.put(TYPE, "CreateGroup");
            node.put("name", request.name());
            node.set("members", intArray(request.members()));
        } else if (message instanceof ClientMessage.EditGroup request) {
            node.put(TYPE, "EditGroup");
            node.put("id", request.id());
            node.put("new_name", request.newName());
            node.set("new_members", intArray(request.newMembers()));
        } else if (message instanceof ClientMessage.DeleteGroup request) {
            node.put(TYPE, "DeleteGroup");
            node.put("id", request.id());
        } else {
            throw new IllegalArgumentException("Unsupported client message: " + message.getClass().getName());
        }
        return write(node);
    }

    @Override
    public ClientMessage decodeClientMessage(byte[] frame) {
        JsonNode node = read(frame);
        String type = requireText(node, TYPE);

        switch (type) {
            case "RequestUsername":
                return new ClientMessage.RequestUsername(requireText(node, "username"));
            case "GetMessages":
                return new ClientMessage.GetMessages(readRecipient(requireField(node, "recipient")));
            case "SendMessage":
                return new ClientMessage.SendMessage(
                    requireText(node, "message"), readRecipient(requireField(node, "recipient")));
            case "EditMessage":
                return new ClientMessage.EditMessage(requireInt(node, "id"), requireText(node, "new_message"));
            case "EditTags":
                return new ClientMessage.EditTags(requireInt(node, "id"), readStrings(node, "new_tags"));
            case "DeleteMessage":
                return new ClientMessage.DeleteMessage(requireInt(node, "id"));
            case "CreateGroup":
                return new ClientMessage.CreateGroup(requireText(node, "name"), readInts(node, "members"));
            case "EditGroup":
                return new ClientMessage.EditGroup(
                    requireInt(node, "id"), requireText(node, "new_name"), readInts(node, "new_members"));
            case "DeleteGroup":
                return new ClientMessage.DeleteGroup(requireInt(node, "id"));
            default:
                throw new FrameDecodingException("Unknown client message type: " + type);
        }
    }

    // ============================================================
    // Shared value shapes
    // ============================================================

    private ObjectNode recipientNode(Recipient recipient) {
        ObjectNode node = mapper.createObjectNode();
        node.put(recipient.kind() == Recipient.Kind.USER ? "User" : "Group", recipient.id());
        return node;
    }

    private Recipient readRecipient(JsonNode node) {
        if (!node.isObject() || node.size() != 1) {
            throw new FrameDecodingException("Recipient must be a single-entry map");
        }
        Map.Entry<String, JsonNode> entry = node.fields().next();
        int id = asInt(entry.getValue(), entry.getKey());
        try {
            if ("User".equals(entry.getKey())) {
                return Recipient.user(id);
            }
            if ("Group".equals(entry.getKey())) {
                return Recipient.group(id);
            }
        } catch (IllegalArgumentException e) {
            throw new FrameDecodingException("Invalid recipient id: " + id, e);
        }
        throw new FrameDecodingException("Unknown recipient kind: " + entry.getKey());
    }

    private ObjectNode messageNode(Message message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("sender", message.sender());
        node.set("recipient", recipientNode(message.recipient()));
        node.put("message", message.body());
        node.put("time", message.createdAt());
        node.set("tags", stringArray(message.tags()));
        return node;
    }

    private Message readMessage(JsonNode node) {
        JsonNode time = requireField(node, "time");
        if (!time.isIntegralNumber() || !time.canConvertToLong()) {
            throw new FrameDecodingException("Field 'time' must be an integer");
        }
        try {
            return new Message(
                requireInt(node, "sender"),
                readRecipient(requireField(node, "recipient")),
                requireText(node, "message"),
                time.longValue(),
                readStrings(node, "tags"));
        } catch (IllegalArgumentException e) {
            throw new FrameDecodingException("Invalid message: " + e.getMessage(), e);
        }
    }

    private ObjectNode userNode(UserSummary user) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", user.id());
        node.put("name", user.name());
        node.put("online", user.online());
        return node;
    }

    private UserSummary readUser(JsonNode node) {
        JsonNode online = requireField(node, "online");
        if (!online.isBoolean()) {
            throw new FrameDecodingException("Field 'online' must be a boolean");
        }
        return new UserSummary(requireInt(node, "id"), requireText(node, "name"), online.booleanValue());
    }

    private ObjectNode groupNode(GroupSummary group) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", group.id());
        node.put("name", group.name());
        node.set("members", stringArray(group.members()));
        return node;
    }

    private GroupSummary readGroup(JsonNode node) {
        return new GroupSummary(requireInt(node, "id"), requireText(node, "name"), readStrings(node, "members"));
    }

    private ArrayNode stringArray(List<String> values) {
        ArrayNode array = mapper.createArrayNode();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }

    private ArrayNode intArray(List<Integer> values) {
        ArrayNode array = mapper.createArrayNode();
        for (Integer value : values) {
            array.add(value);
        }
        return array;
    }

    // ============================================================
    // Low-level helpers
    // ============================================================

    private byte[] write(ObjectNode node) {
        try {
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode frame", e);
        }
    }

    private JsonNode read(byte[] frame) {
        if (frame == null || frame.length == 0) {
            throw new FrameDecodingException("Empty frame");
        }
        JsonNode node;
        try {
            node = mapper.readTree(frame);
        } catch (IOException | MessagePackException e) {
            throw new FrameDecodingException("Malformed MessagePack frame", e);
        }
        if (node == null || !node.isObject()) {
            throw new FrameDecodingException("Frame must be a map");
        }
        return node;
    }

    private static JsonNode requireField(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            throw new FrameDecodingException("Expected a map containing '" + field + "'");
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new FrameDecodingException("Missing field '" + field + "'");
        }
        return value;
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = requireField(node, field);
        if (!value.isTextual()) {
            throw new FrameDecodingException("Field '" + field + "' must be a string");
        }
        return value.textValue();
    }

    private static int requireInt(JsonNode node, String field) {
        return asInt(requireField(node, field), field);
    }

    private static int asInt(JsonNode value, String field) {
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt() || value.intValue() < 0) {
            throw new FrameDecodingException("Field '" + field + "' must be a non-negative integer");
        }
        return value.intValue();
    }

    private static JsonNode requireArray(JsonNode node, String field) {
        JsonNode value = requireField(node, field);
        if (!value.isArray()) {
            throw new FrameDecodingException("Field '" + field + "' must be an array");
        }
        return value;
    }

    private static List<String> readStrings(JsonNode node, String field) {
        List<String> result = new ArrayList<>();
        Iterator<JsonNode> it = requireArray(node, field).elements();
        while (it.hasNext()) {
            JsonNode element = it.next();
            if (!element.isTextual()) {
                throw new FrameDecodingException("Field '" + field + "' must contain only strings");
            }
            result.add(element.textValue());
        }
        return result;
    }

    private static List<Integer> readInts(JsonNode node, String field) {
        List<Integer> result = new ArrayList<>();
        for (JsonNode element : requireArray(node, field)) {
            result.add(asInt(element, field));
        }
        return result;
    }
}

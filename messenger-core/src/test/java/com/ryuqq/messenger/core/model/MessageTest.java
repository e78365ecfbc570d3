package com.ryuqq.messenger.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Message / Group 모델 테스트.
 */
class MessageTest {

    @Test
    void withBodyAndWithTags_keepOtherFields() {
        // given
        Message original = new Message(1, Recipient.user(2), "a", 100L, List.of("x"));

        // when
        Message edited = original.withBody("b").withTags(List.of("y"));

        // then
        assertThat(edited).isEqualTo(new Message(1, Recipient.user(2), "b", 100L, List.of("y")));
    }

    @Test
    void tags_areDefensivelyCopied() {
        // given
        List<String> tags = new ArrayList<>(List.of("x"));
        Message message = new Message(1, Recipient.user(2), "a", 0L, tags);

        // when
        tags.add("y");

        // then
        assertThat(message.tags()).containsExactly("x");
    }

    @Test
    void isDirectlyAddressedTo_onlyForUserRecipient() {
        assertThat(new Message(0, Recipient.user(5), "", 0L, null).isDirectlyAddressedTo(5)).isTrue();
        assertThat(new Message(0, Recipient.group(5), "", 0L, null).isDirectlyAddressedTo(5)).isFalse();
    }

    @Test
    void group_membersAreSortedAndReadOnly() {
        Group group = new Group(0, "g", Set.of(3, 1, 2));

        assertThat(group.members()).containsExactly(1, 2, 3);
        assertThat(group.hasMember(2)).isTrue();
        assertThatThrownBy(() -> group.members().add(4)).isInstanceOf(UnsupportedOperationException.class);
    }
}

package com.ryuqq.messenger.testkit.connection;

import com.ryuqq.messenger.core.protocol.ClientMessage;
import com.ryuqq.messenger.core.protocol.ServerMessage;
import com.ryuqq.messenger.core.spi.FrameCodec;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryConnection 테스트.
 */
class InMemoryConnectionTest {

    /**
     * Text codec: usernames and error messages only.
     */
    private static final FrameCodec TEXT_CODEC = new FrameCodec() {
        @Override
        public byte[] encodeServerMessage(ServerMessage message) {
            return ((ServerMessage.Error) message).message().getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public ClientMessage decodeClientMessage(byte[] frame) {
            return new ClientMessage.RequestUsername(new String(frame, StandardCharsets.UTF_8));
        }

        @Override
        public byte[] encodeClientMessage(ClientMessage message) {
            return ((ClientMessage.RequestUsername) message).username().getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public ServerMessage decodeServerMessage(byte[] frame) {
            return new ServerMessage.Error(new String(frame, StandardCharsets.UTF_8));
        }
    };

    private final InMemoryConnection connection = new InMemoryConnection("alice", TEXT_CODEC);

    @Test
    void clientRequests_areReceivedInOrder() throws IOException {
        // given
        connection.send(new ClientMessage.RequestUsername("first"));
        connection.send(new ClientMessage.RequestUsername("second"));

        // then
        assertThat(TEXT_CODEC.decodeClientMessage(connection.receive()))
            .isEqualTo(new ClientMessage.RequestUsername("first"));
        assertThat(TEXT_CODEC.decodeClientMessage(connection.receive()))
            .isEqualTo(new ClientMessage.RequestUsername("second"));
    }

    @Test
    void serverWrites_areVisibleToClient() throws IOException {
        // when
        connection.send(TEXT_CODEC.encodeServerMessage(new ServerMessage.Error("one")));
        connection.send(TEXT_CODEC.encodeServerMessage(new ServerMessage.Error("two")));

        // then
        assertThat(connection.await(Duration.ofSeconds(1))).isEqualTo(new ServerMessage.Error("one"));
        assertThat(connection.drain()).containsExactly(new ServerMessage.Error("two"));
        assertThat(connection.await(Duration.ofMillis(10))).isNull();
    }

    @Test
    void closeFromPeer_endsStream() throws IOException {
        connection.closeFromPeer();

        assertThat(connection.receive()).isNull();
    }

    @Test
    void close_unblocksPendingReceive() throws Exception {
        // given
        CompletableFuture<byte[]> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return connection.receive();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });

        // when
        connection.close();

        // then
        assertThat(pending.get(1, TimeUnit.SECONDS)).isNull();
        assertThat(connection.isClosed()).isTrue();
        assertThatThrownBy(() -> connection.send(new byte[]{1})).isInstanceOf(IOException.class);
    }

    @Test
    void failWrites_makesSendThrow() {
        connection.failWrites();

        assertThatThrownBy(() -> connection.send(new byte[]{1}))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Broken pipe");
    }
}

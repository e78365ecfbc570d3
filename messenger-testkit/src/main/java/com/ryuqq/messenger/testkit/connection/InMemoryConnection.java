package com.ryuqq.messenger.testkit.connection;

import com.ryuqq.messenger.core.protocol.ClientMessage;
import com.ryuqq.messenger.core.protocol.ServerMessage;
import com.ryuqq.messenger.core.spi.Connection;
import com.ryuqq.messenger.core.spi.FrameCodec;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory duplex {@link Connection} for tests.
 *
 * <p>The test plays the client: it pushes inbound frames with {@link #send(ClientMessage)} or
 * {@link #pushFrame(byte[])} and reads what the server wrote with {@link #await(Duration)}.
 * {@link #closeFromPeer()} simulates the client hanging up, {@link #failWrites()} simulates a dead socket.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * InMemoryConnection alice = new InMemoryConnection("alice", codec);
 * server.accept(alice);
 * alice.send(new ClientMessage.RequestUsername("alice"));
 * ServerMessage welcome = alice.await(Duration.ofSeconds(1));
 * </pre>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public class InMemoryConnection implements Connection {

    private static final byte[] END_OF_STREAM = new byte[0];

    private final String name;
    private final FrameCodec codec;
    private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();
    private final BlockingQueue<byte[]> outbound = new LinkedBlockingQueue<>();

    private volatile boolean closed;
    private volatile boolean failWrites;

    /**
     * @param name peer name used in {@link #describe()}
     * @param codec codec used by the client-side helpers
     */
    public InMemoryConnection(String name, FrameCodec codec) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.name = name;
        this.codec = codec;
    }

    // ============================================================
    // Connection (server side)
    // ============================================================

    @Override
    public byte[] receive() throws IOException {
        if (closed) {
            return null;
        }
        try {
            byte[] frame = inbound.take();
            if (frame == END_OF_STREAM || closed) {
                return null;
            }
            return frame;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while receiving on " + name, e);
        }
    }

    @Override
    public void send(byte[] frame) throws IOException {
        if (closed) {
            throw new IOException("Connection closed: " + name);
        }
        if (failWrites) {
            throw new IOException("Broken pipe: " + name);
        }
        outbound.add(frame);
    }

    @Override
    public void close() {
        closed = true;
        inbound.offer(END_OF_STREAM);
    }

    @Override
    public String describe() {
        return "in-memory:" + name;
    }

    // ============================================================
    // Client side helpers
    // ============================================================

    /**
     * Encodes and pushes one request as if the client sent it.
     */
    public void send(ClientMessage message) {
        pushFrame(codec.encodeClientMessage(message));
    }

    /**
     * Pushes a raw inbound frame (may be malformed on purpose).
     */
    public void pushFrame(byte[] frame) {
        if (frame == null) {
            throw new IllegalArgumentException("frame cannot be null");
        }
        inbound.add(frame);
    }

    /**
     * The client hangs up: the next {@link #receive()} reports end of stream.
     */
    public void closeFromPeer() {
        inbound.offer(END_OF_STREAM);
    }

    /**
     * Every later {@link #send(byte[])} fails with an IOException.
     */
    public void failWrites() {
        this.failWrites = true;
    }

    /**
     * Waits for the next frame written by the server and decodes it.
     *
     * @param timeout max wait
     * @return decoded event, or {@code null} on timeout
     */
    public ServerMessage await(Duration timeout) {
        try {
            byte[] frame = outbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return frame == null ? null : codec.decodeServerMessage(frame);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting on " + name, e);
        }
    }

    /**
     * Waits for the next event of the given type, discarding any other events before it.
     *
     * @param type expected event type
     * @param timeout max wait for the whole search
     * @return the event, or {@code null} on timeout
     */
    public <T extends ServerMessage> T awaitType(Class<T> type, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            ServerMessage message = await(Duration.ofNanos(remaining));
            if (message == null) {
                return null;
            }
            if (type.isInstance(message)) {
                return type.cast(message);
            }
        }
    }

    /**
     * Decodes and removes every frame written so far without waiting.
     */
    public List<ServerMessage> drain() {
        List<byte[]> frames = new ArrayList<>();
        outbound.drainTo(frames);
        List<ServerMessage> messages = new ArrayList<>(frames.size());
        for (byte[] frame : frames) {
            messages.add(codec.decodeServerMessage(frame));
        }
        return messages;
    }

    /**
     * @return true once the server closed this connection
     */
    public boolean isClosed() {
        return closed;
    }
}

package com.linechat.chat.server;

import com.linechat.chat.codec.FrameReader;
import com.linechat.chat.codec.FrameWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Server-side state of one live connection. The session owns its connection: everything written
 * to the client goes through {@link #send(String)}.
 *
 * <p>Sessions opened on a socket write through a {@link SessionOutbox}, so {@code send} only
 * queues. Sessions built on plain streams write on the calling thread.
 */
public class ChatSession {
    private static final Logger log = LoggerFactory.getLogger(ChatSession.class);

    static final long DRAIN_MILLIS = 1000;

    public enum State {
        /** Socket open, username not yet received. */
        CONNECTED,
        /** Username bound; takes part in chat. */
        IDENTIFIED,
        /** Terminal. */
        CLOSED
    }

    private final String id;
    private final String remoteAddress;
    private final Instant joinedAt;
    private final FrameReader reader;
    private final FrameWriter writer;
    private final Closeable connection;
    private final SessionOutbox outbox;

    private volatile String username;
    private volatile State state = State.CONNECTED;

    /**
     * @param outboxCapacity messages that may wait for a slow peer; {@code 0} writes synchronously
     */
    ChatSession(String id, String remoteAddress, InputStream in, OutputStream out, Closeable connection,
                int outboxCapacity) {
        this.id = Objects.requireNonNull(id, "id");
        this.remoteAddress = remoteAddress;
        this.joinedAt = Instant.now();
        this.reader = new FrameReader(in);
        this.writer = new FrameWriter(out);
        this.connection = connection;
        if (outboxCapacity > 0) {
            this.outbox = new SessionOutbox(id, writer, connection, outboxCapacity);
            this.outbox.start();
        } else {
            this.outbox = null;
        }
    }

    public static ChatSession open(Socket socket) throws IOException {
        return new ChatSession(UUID.randomUUID().toString(), String.valueOf(socket.getRemoteSocketAddress()),
                socket.getInputStream(), socket.getOutputStream(), socket, SessionOutbox.DEFAULT_CAPACITY);
    }

    /**
     * Blocks for the next message from the client.
     *
     * @return the message, or {@code null} once the client has closed the connection
     */
    public String readFrame() throws IOException {
        if (state == State.CLOSED) {
            return null;
        }
        return reader.read();
    }

    public void send(String text) throws IOException {
        if (state == State.CLOSED) {
            throw new IOException("Session " + id + " is closed");
        }
        if (outbox != null) {
            outbox.offer(text);
        } else {
            writer.write(text);
        }
    }

    /** Called by the registry once the username is bound. */
    synchronized void identify(String username) {
        if (state == State.CLOSED) {
            throw new IllegalStateException("Session " + id + " is closed");
        }
        this.username = username;
        this.state = State.IDENTIFIED;
    }

    /**
     * Moves the session to {@link State#CLOSED} and closes the connection, which unblocks a
     * pending {@link #readFrame()}. Queued output gets up to {@link #DRAIN_MILLIS} to go out first.
     *
     * @return {@code false} if the session was already closed
     */
    public synchronized boolean close() {
        if (state == State.CLOSED) {
            return false;
        }
        state = State.CLOSED;
        if (outbox != null) {
            outbox.finish(DRAIN_MILLIS);
        } else {
            closeQuietly(connection);
        }
        closeQuietly(reader);
        closeQuietly(writer);
        return true;
    }

    private void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.warn("Error closing connection of session {} ({}): {}", id, remoteAddress, e.getMessage());
        }
    }

    public String getId() {
        return id;
    }

    /** {@code null} until the handshake completes. */
    public String getUsername() {
        return username;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public State getState() {
        return state;
    }

    public boolean isIdentified() {
        return state == State.IDENTIFIED;
    }

    @Override
    public String toString() {
        return "ChatSession[" + id + ", " + (username != null ? username : "-") + ", " + remoteAddress + "]";
    }
}

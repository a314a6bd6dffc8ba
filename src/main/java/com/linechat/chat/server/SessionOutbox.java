package com.linechat.chat.server;

import com.linechat.chat.codec.FrameCodec;
import com.linechat.chat.codec.FrameWriter;
import com.linechat.chat.codec.FramingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded outbound queue drained by one writer thread per session. Callers never block on the
 * peer's socket: when a peer stops reading, its queue fills and further messages to it are
 * refused while every other session keeps going.
 */
class SessionOutbox {
    private static final Logger log = LoggerFactory.getLogger(SessionOutbox.class);

    static final int DEFAULT_CAPACITY = 256;
    private static final long POLL_MILLIS = 100;

    private final String name;
    private final FrameWriter writer;
    private final Closeable connection;
    private final BlockingQueue<String> queue;
    private final Thread thread;
    private volatile boolean finishing;

    SessionOutbox(String name, FrameWriter writer, Closeable connection, int capacity) {
        this.name = name;
        this.writer = writer;
        this.connection = connection;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.thread = new Thread(this::drain, "chat-writer-" + name);
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
    }

    /**
     * Queues {@code text} for the writer thread.
     *
     * @throws FramingException if the text does not fit in one frame
     * @throws IOException      if the outbox is finishing or the peer is too far behind
     */
    void offer(String text) throws IOException {
        if (!FrameCodec.fits(text)) {
            throw new FramingException("Message too large for one frame");
        }
        if (finishing) {
            throw new IOException("Outbox of " + name + " is closed");
        }
        if (!queue.offer(text)) {
            throw new IOException("Outbound queue of " + name + " is full");
        }
    }

    /**
     * Lets the writer flush what is already queued, waiting at most {@code waitMillis}, then
     * closes the connection whether or not the queue was drained.
     */
    void finish(long waitMillis) {
        finishing = true;
        if (thread.isAlive() && Thread.currentThread() != thread) {
            try {
                thread.join(waitMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        closeConnection();
    }

    private void drain() {
        try {
            while (true) {
                String next = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (next == null) {
                    if (finishing) {
                        break;
                    }
                    continue;
                }
                writer.write(next);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            log.debug("Writer for {} stopped: {}", name, e.getMessage());
        } finally {
            finishing = true;
            queue.clear();
            closeConnection();
        }
    }

    private void closeConnection() {
        try {
            connection.close();
        } catch (IOException e) {
            log.warn("Error closing connection of {}: {}", name, e.getMessage());
        }
    }
}

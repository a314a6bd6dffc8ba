package com.linechat.chat.codec;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads frames from a byte stream, one message per call, however the transport happens to chunk
 * the bytes. One reader belongs to one connection.
 */
public class FrameReader implements Closeable {
    private final DataInputStream in;
    private final int maxFrameBytes;

    public FrameReader(InputStream in) {
        this(in, FrameCodec.MAX_FRAME_BYTES);
    }

    public FrameReader(InputStream in, int maxFrameBytes) {
        this.in = new DataInputStream(new BufferedInputStream(in));
        this.maxFrameBytes = Math.min(maxFrameBytes, FrameCodec.MAX_FRAME_BYTES);
    }

    /**
     * Blocks until the next complete message has arrived.
     *
     * @return the decoded message, or {@code null} if the stream ended cleanly between frames
     * @throws FramingException if the frame is malformed, too large, or the stream ends inside it
     * @throws IOException      if the underlying transport fails
     */
    public String read() throws IOException {
        int first = in.read();
        if (first == -1) {
            return null;
        }
        int length;
        try {
            length = (first << 24) | (in.readUnsignedByte() << 16) | (in.readUnsignedShort());
        } catch (EOFException e) {
            throw new FramingException("Stream ended inside a frame header", e);
        }
        FrameCodec.checkLength(length);
        if (length > maxFrameBytes) {
            throw new FramingException("Frame too large: " + length + " bytes (max " + maxFrameBytes + ")");
        }
        byte[] payload = new byte[length];
        try {
            in.readFully(payload);
        } catch (EOFException e) {
            throw new FramingException("Stream ended inside a " + length + " byte frame", e);
        }
        return FrameCodec.decodePayload(payload);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}

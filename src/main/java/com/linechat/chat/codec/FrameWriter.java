package com.linechat.chat.codec;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes whole frames to a byte stream. Safe for concurrent writers: each frame goes out
 * contiguously.
 */
public class FrameWriter implements Closeable {
    private final OutputStream out;

    public FrameWriter(OutputStream out) {
        this.out = new BufferedOutputStream(out);
    }

    public synchronized void write(String text) throws IOException {
        // encode first so an oversized message never leaves a partial frame behind
        byte[] frame = FrameCodec.encode(text);
        out.write(frame);
        out.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        out.close();
    }
}

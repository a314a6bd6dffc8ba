package com.linechat.chat.codec;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Length-prefixed framing for UTF-8 text messages.
 *
 * <pre>
 * +----------------+----------------------+
 * | LENGTH (int32) | PAYLOAD (LENGTH B)   |
 * +----------------+----------------------+
 * </pre>
 *
 * The length is big-endian and counts payload bytes only. Because the receiver always knows how
 * many bytes to expect, payloads may contain any character, newlines and NUL included.
 */
public final class FrameCodec {
    public static final int HEADER_BYTES = Integer.BYTES;
    public static final int MAX_FRAME_BYTES = 64 * 1024;

    private FrameCodec() {}

    /**
     * Encodes one message as a complete frame (header and payload).
     *
     * @throws FramingException if the UTF-8 payload is larger than {@link #MAX_FRAME_BYTES}
     */
    public static byte[] encode(String text) throws FramingException {
        Objects.requireNonNull(text, "text");
        byte[] payload = text.getBytes(StandardCharsets.UTF_8);
        checkLength(payload.length);
        return ByteBuffer.allocate(HEADER_BYTES + payload.length)
                .putInt(payload.length)
                .put(payload)
                .array();
    }

    /** Whether {@code text} fits in one frame. */
    public static boolean fits(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length <= MAX_FRAME_BYTES;
    }

    static void checkLength(int length) throws FramingException {
        if (length < 0) {
            throw new FramingException("Negative frame length: " + length);
        }
        if (length > MAX_FRAME_BYTES) {
            throw new FramingException("Frame too large: " + length + " bytes (max " + MAX_FRAME_BYTES + ")");
        }
    }

    static String decodePayload(byte[] payload) throws FramingException {
        // String(byte[], UTF_8) would silently replace bad input, so use a reporting decoder
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(payload)).toString();
        } catch (CharacterCodingException e) {
            throw new FramingException("Frame payload is not valid UTF-8", e);
        }
    }
}

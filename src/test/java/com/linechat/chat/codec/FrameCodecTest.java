package com.linechat.chat.codec;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class FrameCodecTest {

    private static String decode(byte[] frame) throws IOException {
        return new FrameReader(new ByteArrayInputStream(frame)).read();
    }

    @Test
    void encodePrefixesPayloadWithBigEndianLength() throws Exception {
        byte[] frame = FrameCodec.encode("héllo");
        byte[] payload = "héllo".getBytes(StandardCharsets.UTF_8);

        assertEquals(FrameCodec.HEADER_BYTES + payload.length, frame.length);
        assertEquals(payload.length, ByteBuffer.wrap(frame).getInt());
    }

    @Test
    void payloadMayContainBytesThatLookLikeHeaders() throws Exception {
        String tricky = "\u0000\u0000\u0000\u0005line one\nline two\r\n\u0000ÿ emoji 😀";
        assertEquals(tricky, decode(FrameCodec.encode(tricky)));
    }

    @Test
    void emptyPayloadIsAValidFrame() throws Exception {
        byte[] frame = FrameCodec.encode("");
        assertEquals(FrameCodec.HEADER_BYTES, frame.length);
        assertEquals("", decode(frame));
    }

    @Test
    void encodeRejectsOversizedPayload() {
        String big = "x".repeat(FrameCodec.MAX_FRAME_BYTES + 1);
        assertThrows(FramingException.class, () -> FrameCodec.encode(big));
    }

    @Test
    void fitsMeasuresUtf8Bytes() {
        assertTrue(FrameCodec.fits("x".repeat(FrameCodec.MAX_FRAME_BYTES)));
        assertFalse(FrameCodec.fits("x".repeat(FrameCodec.MAX_FRAME_BYTES + 1)));
        assertFalse(FrameCodec.fits("é".repeat(FrameCodec.MAX_FRAME_BYTES / 2 + 1)));
    }

    @Test
    void largestAllowedPayloadIsAccepted() throws Exception {
        String max = "x".repeat(FrameCodec.MAX_FRAME_BYTES);
        assertEquals(max, decode(FrameCodec.encode(max)));
    }

    @Test
    void decodeRejectsLengthMismatch() throws Exception {
        byte[] frame = FrameCodec.encode("abc");
        byte[] truncated = new byte[frame.length - 1];
        System.arraycopy(frame, 0, truncated, 0, truncated.length);

        assertThrows(FramingException.class, () -> decode(truncated));
        assertThrows(FramingException.class, () -> decode(new byte[] {0, 0}));
    }

    @Test
    void decodeRejectsInvalidUtf8() {
        byte[] frame = {0, 0, 0, 2, (byte) 0xC3, (byte) 0x28};
        assertThrows(FramingException.class, () -> decode(frame));
    }
}

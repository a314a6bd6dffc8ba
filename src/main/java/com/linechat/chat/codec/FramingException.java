package com.linechat.chat.codec;

import java.io.IOException;

/**
 * A frame on the wire is malformed, truncated or larger than {@link FrameCodec#MAX_FRAME_BYTES}.
 * The connection it came from can no longer be trusted and must be closed.
 */
public class FramingException extends IOException {
    public FramingException(String message) {
        super(message);
    }

    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.linechat.chat.server;

/**
 * A session id was registered twice. Ids are unique per accepted connection, so this is an
 * internal invariant violation; only the offending connection is dropped.
 */
public class DuplicateConnectionException extends IllegalStateException {
    private final String sessionId;

    public DuplicateConnectionException(String sessionId) {
        super("Session already registered: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}

package com.linechat.chat.server;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The live sessions of a server, in join order, plus a username index for private delivery.
 *
 * <p>All operations hold the registry monitor only for a constant amount of work. Callers that
 * need to iterate take a {@link #snapshot()} and send outside the lock.
 */
public class SessionRegistry {
    private final Map<String, ChatSession> sessions = new LinkedHashMap<>();
    private final Map<String, ChatSession> byUsername = new HashMap<>();

    /**
     * @throws DuplicateConnectionException if a session with the same id is already registered
     */
    public synchronized void register(ChatSession session) {
        if (sessions.containsKey(session.getId())) {
            throw new DuplicateConnectionException(session.getId());
        }
        sessions.put(session.getId(), session);
    }

    /**
     * Binds a username to a registered session and moves it to {@link ChatSession.State#IDENTIFIED}.
     *
     * @throws DuplicateUsernameException if another live session already uses the name
     * @throws IllegalStateException      if the session is not registered
     */
    public synchronized void bindUsername(String sessionId, String username) {
        ChatSession session = sessions.get(sessionId);
        if (session == null) {
            throw new IllegalStateException("Session not registered: " + sessionId);
        }
        ChatSession holder = byUsername.get(username);
        if (holder != null && holder != session) {
            throw new DuplicateUsernameException(username);
        }
        String previous = session.getUsername();
        if (previous != null) {
            byUsername.remove(previous, session);
        }
        session.identify(username);
        byUsername.put(username, session);
    }

    /**
     * Removes the session from both indexes. Removing an unknown id does nothing.
     *
     * @return the removed session, empty if it was not registered
     */
    public synchronized Optional<ChatSession> remove(String sessionId) {
        ChatSession removed = sessions.remove(sessionId);
        if (removed != null && removed.getUsername() != null) {
            byUsername.remove(removed.getUsername(), removed);
        }
        return Optional.ofNullable(removed);
    }

    /** Immutable copy of the live sessions in join order. */
    public synchronized List<ChatSession> snapshot() {
        return List.copyOf(sessions.values());
    }

    public synchronized Optional<ChatSession> findByUsername(String username) {
        return Optional.ofNullable(byUsername.get(username));
    }

    public synchronized Optional<ChatSession> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public synchronized int size() {
        return sessions.size();
    }
}

package com.linechat.chat.server;

import com.linechat.chat.codec.FramingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Worker for one accepted connection: reads the username handshake, then feeds every following
 * frame to the router until the connection ends. Whatever goes wrong stays inside this worker.
 */
class ClientHandler implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ClientHandler.class);

    static final String USERNAME_TAKEN = "[SERVER] Username already taken.";

    private final ChatSession session;
    private final SessionRegistry registry;
    private final MessageRouter router;
    private final BooleanSupplier serverRunning;

    ClientHandler(ChatSession session, SessionRegistry registry, MessageRouter router, BooleanSupplier serverRunning) {
        this.session = session;
        this.registry = registry;
        this.router = router;
        this.serverRunning = serverRunning;
    }

    @Override
    public void run() {
        try {
            registry.register(session);
        } catch (DuplicateConnectionException e) {
            log.error("[ERROR] Refusing {}: {}", session, e.getMessage(), e);
            session.close();
            return;
        }
        // a stop() that ran before register() could not see this session in its snapshot
        if (!serverRunning.getAsBoolean()) {
            log.info("[SHUTDOWN] Closing {}: server is stopping.", session.getRemoteAddress());
            session.close();
            registry.remove(session.getId());
            return;
        }
        log.info("[ACTIVE CONNECTIONS] {}", registry.size());

        try {
            if (handshake()) {
                String msg;
                while ((msg = session.readFrame()) != null && !msg.isEmpty()) {
                    router.route(session, msg);
                }
            }
        } catch (FramingException e) {
            log.warn("[ERROR] {}: bad frame, closing connection: {}", session.getRemoteAddress(), e.getMessage());
        } catch (SocketTimeoutException e) {
            log.info("[TIMEOUT] {} idle too long, closing connection.", session.getRemoteAddress());
        } catch (SocketException e) {
            if (session.getState() != ChatSession.State.CLOSED) {
                log.info("[DISCONNECTED] {} forcibly closed the connection.", session.getRemoteAddress());
            }
        } catch (IOException e) {
            log.warn("[ERROR] {}: {}", session.getRemoteAddress(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[ERROR] {}: unexpected failure in session {}", session.getRemoteAddress(), session, e);
        } finally {
            disconnect();
        }
    }

    /**
     * The first frame is the username. Returns {@code false} if the session must end instead.
     */
    private boolean handshake() throws IOException {
        String first = session.readFrame();
        if (first == null || first.trim().isEmpty()) {
            log.info("[DISCONNECTED] {} left before sending a username.", session.getRemoteAddress());
            return false;
        }
        String username = first.trim();
        try {
            registry.bindUsername(session.getId(), username);
        } catch (DuplicateUsernameException e) {
            log.warn("[REJECTED] {} tried to join as {}: name in use.", session.getRemoteAddress(), username);
            session.send(USERNAME_TAKEN);
            return false;
        }
        log.info("[NEW CONNECTION] {} ({}) connected.", username, session.getRemoteAddress());
        router.announceJoin(session);
        return true;
    }

    private void disconnect() {
        boolean wasIdentified = session.isIdentified();
        session.close();
        registry.remove(session.getId()).ifPresent(removed -> {
            if (wasIdentified) {
                router.announceLeave(removed);
                Duration online = Duration.between(removed.getJoinedAt(), Instant.now());
                log.info("[DISCONNECTED] {} ({}) disconnected after {}.", removed.getUsername(),
                        removed.getRemoteAddress(), ServerStats.formatUptime(online));
            }
        });
    }
}

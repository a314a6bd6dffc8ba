package com.linechat.chat.server;

import com.linechat.config.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Enumeration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TCP chat server. One acceptor thread hands every connection to its own worker; all workers
 * share one {@link SessionRegistry}.
 */
public class ChatServer {
    private static final Logger log = LoggerFactory.getLogger(ChatServer.class);

    private final String host;
    private final int port;
    private final int idleTimeoutMillis;
    private final SessionRegistry registry = new SessionRegistry();
    private final ServerStats stats;
    private final MessageRouter router;

    private ServerSocket serverSocket;
    private ExecutorService workers;
    private Thread acceptor;
    private volatile boolean isRunning = false;

    public ChatServer(String host, int port) {
        this(host, port, 0, new ServerStats());
    }

    public ChatServer(ServerConfig config) {
        this(config.getHost(), config.getPort(), config.getIdleTimeoutSeconds(), new ServerStats());
    }

    public ChatServer(String host, int port, int idleTimeoutSeconds, ServerStats stats) {
        this.host = host;
        this.port = port;
        this.idleTimeoutMillis = (int) TimeUnit.SECONDS.toMillis(Math.max(0, idleTimeoutSeconds));
        this.stats = stats;
        this.router = new MessageRouter(registry, stats);
    }

    public boolean isRunning() {
        return isRunning && serverSocket != null;
    }

    /**
     * Binds the listening socket and starts accepting in the background.
     *
     * @throws IOException if the address cannot be bound, e.g. the port is in use
     */
    public synchronized void start() throws IOException {
        if (isRunning()) {
            log.info("Chat server is already running on port {}.", getPort());
            return;
        }
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        try {
            socket.bind(new InetSocketAddress(host, port));
        } catch (IOException e) {
            socket.close();
            log.error("Failed to start chat server on {}:{}: {}", host, port, e.getMessage());
            throw e;
        }
        serverSocket = socket;
        workers = Executors.newCachedThreadPool(new SessionThreadFactory());
        isRunning = true;

        acceptor = new Thread(this::acceptLoop, "chat-acceptor");
        acceptor.start();
        log.info("[SERVER STARTED] Listening on {}:{}", host, getPort());
        if (socket.getInetAddress().isAnyLocalAddress()) {
            logLocalAddresses();
        }
    }

    private void acceptLoop() {
        while (isRunning) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketException e) {
                if (isRunning) {
                    log.error("Listening socket failed: {}", e.getMessage());
                    isRunning = false;
                }
                break;
            } catch (IOException e) {
                log.warn("Accept failed: {}", e.getMessage());
                continue;
            }
            log.info("[CONNECTION] Client connected from {}", socket.getRemoteSocketAddress());
            try {
                socket.setTcpNoDelay(true);
                socket.setSoTimeout(idleTimeoutMillis);
                workers.execute(new ClientHandler(ChatSession.open(socket), registry, router, () -> isRunning));
            } catch (IOException | RejectedExecutionException e) {
                log.warn("Dropping connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
                closeQuietly(socket);
            }
        }
    }

    /**
     * Stops accepting, closes every live session and waits briefly for the workers to finish.
     */
    public synchronized void stop() {
        if (!isRunning && serverSocket == null) {
            return;
        }
        isRunning = false;
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.warn("Error closing listening socket: {}", e.getMessage());
        }
        for (ChatSession session : registry.snapshot()) {
            session.close();
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Session workers did not finish within 5 seconds.");
                workers.shutdownNow();
            }
            acceptor.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        serverSocket = null;
        log.info("Chat server stopped.");
    }

    /** The bound port; differs from the configured one when that was 0. */
    public int getPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : port;
    }

    public String getHost() {
        return host;
    }

    public SessionRegistry getRegistry() {
        return registry;
    }

    public ServerStats getStats() {
        return stats;
    }

    private void logLocalAddresses() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            while (interfaces.hasMoreElements()) {
                NetworkInterface networkInterface = interfaces.nextElement();
                if (networkInterface.isLoopback() || !networkInterface.isUp()) {
                    continue;
                }
                Enumeration<InetAddress> addresses = networkInterface.getInetAddresses();
                while (addresses.hasMoreElements()) {
                    InetAddress address = addresses.nextElement();
                    if (!address.isLoopbackAddress() && address.getHostAddress().indexOf(':') == -1) {
                        log.info("  reachable at {}:{}", address.getHostAddress(), getPort());
                    }
                }
            }
        } catch (SocketException e) {
            log.warn("Could not list network interfaces: {}", e.getMessage());
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing rejected socket: {}", e.getMessage());
        }
    }

    private static final class SessionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "chat-session-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}

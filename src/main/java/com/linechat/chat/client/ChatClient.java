package com.linechat.chat.client;

import com.linechat.chat.codec.FrameReader;
import com.linechat.chat.codec.FrameWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.function.Consumer;

/**
 * One connection to the chat server with two independent paths: a receiver thread that decodes
 * server frames, and a send loop that forwards user input. {@code /quit} ends the session locally.
 */
public class ChatClient implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(ChatClient.class);

    public static final String QUIT_COMMAND = "/quit";
    private static final int CONNECT_TIMEOUT_MILLIS = 5000;

    private final Socket socket;
    private final FrameReader reader;
    private final FrameWriter writer;
    private final PrintStream console;
    private Consumer<String> onMessage;
    private String username;
    private volatile boolean closed = false;

    public ChatClient(Socket socket, PrintStream console) throws IOException {
        this.socket = socket;
        this.reader = new FrameReader(socket.getInputStream());
        this.writer = new FrameWriter(socket.getOutputStream());
        this.console = console;
        this.onMessage = this::render;
    }

    public static ChatClient connect(String host, int port, PrintStream console) throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), CONNECT_TIMEOUT_MILLIS);
            socket.setTcpNoDelay(true);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        log.debug("Connected to {}:{}", host, port);
        return new ChatClient(socket, console);
    }

    /** Replaces console rendering of incoming messages. Call before {@link #startReceiving()}. */
    public void setMessageHandler(Consumer<String> onMessage) {
        this.onMessage = onMessage;
    }

    /** Sends the username handshake; must be the first frame on the connection. */
    public void join(String username) throws IOException {
        this.username = username;
        writer.write(username);
    }

    public void send(String text) throws IOException {
        writer.write(text);
    }

    /**
     * Starts the receive path on a daemon thread. It ends when the connection closes or a frame
     * cannot be decoded.
     */
    public Thread startReceiving() {
        Thread receiver = new Thread(this::receiveLoop, "chat-receiver");
        receiver.setDaemon(true);
        receiver.start();
        return receiver;
    }

    private void receiveLoop() {
        try {
            String msg;
            while ((msg = reader.read()) != null) {
                onMessage.accept(msg);
            }
            if (!closed) {
                console.println("\r[DISCONNECTED] Server closed the connection.");
            }
        } catch (IOException e) {
            if (!closed) {
                console.println("\r[ERROR] Receiving message: " + e.getMessage());
            }
        } finally {
            close();
        }
    }

    /**
     * Forwards input lines until {@code /quit}, end of input, or a send failure, then closes the
     * connection. Blank lines are not sent.
     */
    public void sendLoop(BufferedReader input) {
        try {
            String line;
            while (!closed && (line = input.readLine()) != null) {
                if (line.trim().equalsIgnoreCase(QUIT_COMMAND)) {
                    console.println("You have left the chat.");
                    break;
                }
                if (line.isEmpty()) {
                    prompt();
                    continue;
                }
                try {
                    writer.write(line);
                } catch (IOException e) {
                    console.println("[ERROR] Could not send message: " + e.getMessage());
                    break;
                }
                prompt();
            }
        } catch (IOException e) {
            console.println("[ERROR] Reading input: " + e.getMessage());
        } finally {
            close();
        }
    }

    /** Runs both paths until the user quits. */
    public void chat(BufferedReader input) {
        console.println("Welcome to the chat, " + username + "! Type your messages below:");
        startReceiving();
        prompt();
        sendLoop(input);
    }

    private void render(String msg) {
        String text = msg.endsWith("\n") ? msg.substring(0, msg.length() - 1) : msg;
        console.print("\r" + text + "\n");
        prompt();
    }

    private void prompt() {
        if (username != null) {
            console.print(username + ": ");
            console.flush();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing client socket: {}", e.getMessage());
        }
    }
}

package com.linechat;

import com.linechat.chat.client.ChatClient;
import com.linechat.chat.server.ChatServer;
import com.linechat.config.ConfigException;
import com.linechat.config.ServerConfig;
import com.linechat.service.AuthService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

/**
 * Console entry point: asks for server or client mode, and on the client side walks the user
 * through register/login before joining the chat.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private final ServerConfig config;
    private final AuthService auth;
    private final BufferedReader console;
    private final PrintStream out;

    public Main(ServerConfig config, AuthService auth, BufferedReader console, PrintStream out) {
        this.config = config;
        this.auth = auth;
        this.console = console;
        this.out = out;
    }

    public static void main(String[] args) {
        ServerConfig config;
        try {
            config = ServerConfig.load();
        } catch (ConfigException e) {
            System.err.println("[ERROR] " + e.getMessage());
            System.exit(1);
            return;
        }
        BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        Main app = new Main(config, new AuthService(Paths.get(config.getUsersFile())), console, System.out);
        int status = app.run();
        if (status != 0) {
            System.exit(status);
        }
    }

    public int run() {
        try {
            String choice = ask("Start as server (s) or client (c)? ");
            if (choice == null) {
                return 0;
            }
            switch (choice.trim().toLowerCase()) {
                case "s":
                    return runServer();
                case "c":
                    return runClient();
                default:
                    out.println("Unknown option: " + choice);
                    return 1;
            }
        } catch (IOException e) {
            out.println("[ERROR] " + e.getMessage());
            return 1;
        }
    }

    private int runServer() {
        ChatServer server = new ChatServer(config);
        try {
            server.start();
        } catch (IOException e) {
            out.println("[ERROR] Could not start server: " + e.getMessage());
            return 1;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down chat server...");
            server.stop();
        }));
        out.println("Chat server running on " + config.getHost() + ":" + server.getPort() + ". Press Ctrl+C to stop.");
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return 0;
    }

    private int runClient() throws IOException {
        String username = null;
        while (username == null) {
            String choice = ask("Do you want to (R)egister or (L)ogin? ");
            if (choice == null) {
                return 0;
            }
            choice = choice.trim().toLowerCase();
            if (choice.equals("r")) {
                register();
            } else if (choice.equals("l")) {
                username = login();
                if (username == null) {
                    return 0;
                }
            }
        }

        ChatClient client;
        try {
            client = ChatClient.connect(config.getHost(), config.getPort(), out);
        } catch (IOException e) {
            out.println("[ERROR] Could not connect to server: " + e.getMessage());
            return 1;
        }
        out.println("[CONNECTED] to " + config.getHost() + ":" + config.getPort());
        try {
            client.join(username);
        } catch (IOException e) {
            out.println("[ERROR] Could not join: " + e.getMessage());
            client.close();
            return 1;
        }
        client.chat(console);
        return 0;
    }

    private void register() throws IOException {
        String username = ask("Choose a username: ");
        String password = ask("Choose a password: ");
        if (username == null || password == null) {
            return;
        }
        if (auth.registerUser(username, password)) {
            out.println("Registration successful! You can now log in.");
        } else {
            out.println("Username already exists! Try again.");
        }
    }

    /** Loops until the credentials check out; {@code null} if input ends first. */
    private String login() throws IOException {
        while (true) {
            String username = ask("Enter your username: ");
            String password = ask("Enter your password: ");
            if (username == null || password == null) {
                return null;
            }
            if (auth.authenticate(username, password)) {
                out.println("Login successful!");
                return username.trim();
            }
            out.println("Invalid username or password! Try again.");
        }
    }

    private String ask(String prompt) throws IOException {
        out.print(prompt);
        out.flush();
        return console.readLine();
    }
}

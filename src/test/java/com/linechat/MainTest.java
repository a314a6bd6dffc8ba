package com.linechat;

import com.linechat.chat.server.ChatServer;
import com.linechat.config.ServerConfig;
import com.linechat.service.AuthService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {
    @TempDir
    Path dir;

    private ChatServer server;
    private AuthService auth;
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws Exception {
        server = new ChatServer("127.0.0.1", 0);
        server.start();
        auth = new AuthService(dir.resolve("users.json"), 4);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private int run(String input) {
        return run(input, server.getPort());
    }

    private int run(String input, int port) {
        ServerConfig config = new ServerConfig("127.0.0.1", port, 0, dir.resolve("users.json").toString());
        PrintStream out = new PrintStream(output, true, StandardCharsets.UTF_8);
        return new Main(config, auth, new BufferedReader(new StringReader(input)), out).run();
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void registerLoginChatAndQuit() {
        int status = run("c\nr\nalice\nsecret\nl\nalice\nwrong\nalice\nsecret\n/quit\n");

        assertEquals(0, status);
        String text = printed();
        assertTrue(text.contains("Registration successful! You can now log in."));
        assertTrue(text.contains("Invalid username or password! Try again."));
        assertTrue(text.contains("Login successful!"));
        assertTrue(text.contains("[CONNECTED] to 127.0.0.1:" + server.getPort()));
        assertTrue(text.contains("Welcome to the chat, alice!"));
        assertTrue(text.contains("You have left the chat."));
    }

    @Test
    void registeringAnExistingNameIsReported() {
        auth.registerUser("alice", "secret");

        run("c\nr\nalice\nother\n");

        assertTrue(printed().contains("Username already exists! Try again."));
    }

    @Test
    void unreachableServerIsReported() {
        auth.registerUser("alice", "secret");
        int port = server.getPort();
        server.stop();

        int status = run("c\nl\nalice\nsecret\n", port);

        assertEquals(1, status);
        assertTrue(printed().contains("[ERROR] Could not connect to server"));
    }

    @Test
    void unknownModeIsRejected() {
        assertEquals(1, run("x\n"));
        assertTrue(printed().contains("Unknown option: x"));
    }
}

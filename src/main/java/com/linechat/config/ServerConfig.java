package com.linechat.config;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Host and port of the chat server, read from {@code config.json}.
 *
 * <p>Precedence: system property ({@code chat.server.host}, {@code chat.server.port}) over
 * environment variable ({@code CHAT_SERVER_HOST}, {@code CHAT_SERVER_PORT}) over the file over
 * the defaults. A missing file is created with the defaults on first run.
 */
public class ServerConfig {
    private static final Logger log = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "config.json";
    public static final String DEFAULT_SERVER_HOST = "127.0.0.1";
    public static final int DEFAULT_SERVER_PORT = 12345;
    public static final String DEFAULT_USERS_FILE = "users.json";

    static final String KEY_HOST = "HOST";
    static final String KEY_PORT = "PORT";
    static final String KEY_IDLE_TIMEOUT = "IDLE_TIMEOUT_SECONDS";
    static final String KEY_USERS_FILE = "USERS_FILE";

    private final String host;
    private final int port;
    private final int idleTimeoutSeconds;
    private final String usersFile;

    public ServerConfig(String host, int port, int idleTimeoutSeconds, String usersFile) {
        this.host = host;
        this.port = port;
        this.idleTimeoutSeconds = idleTimeoutSeconds;
        this.usersFile = usersFile;
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_SERVER_HOST, DEFAULT_SERVER_PORT, 0, DEFAULT_USERS_FILE);
    }

    public static ServerConfig load() {
        return load(Paths.get(DEFAULT_CONFIG_FILE));
    }

    /**
     * Reads the file, filling absent keys with defaults, then applies overrides.
     *
     * @throws ConfigException if the file cannot be read or is not a JSON object
     */
    public static ServerConfig load(Path file) {
        ServerConfig fromFile;
        if (Files.notExists(file)) {
            fromFile = defaults();
            writeDefaults(file, fromFile);
        } else {
            fromFile = parse(file);
        }
        return fromFile.withOverrides();
    }

    private static ServerConfig parse(Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("Cannot read " + file, e);
        }
        try {
            JSONObject json = new JSONObject(text);
            return new ServerConfig(
                    json.optString(KEY_HOST, DEFAULT_SERVER_HOST),
                    json.optInt(KEY_PORT, DEFAULT_SERVER_PORT),
                    json.optInt(KEY_IDLE_TIMEOUT, 0),
                    json.optString(KEY_USERS_FILE, DEFAULT_USERS_FILE));
        } catch (JSONException e) {
            throw new ConfigException("Malformed config file " + file + ": " + e.getMessage(), e);
        }
    }

    private static void writeDefaults(Path file, ServerConfig config) {
        JSONObject json = new JSONObject()
                .put(KEY_HOST, config.host)
                .put(KEY_PORT, config.port);
        try {
            Files.writeString(file, json.toString(4), StandardCharsets.UTF_8);
            log.info("Created default configuration {}", file.toAbsolutePath());
        } catch (IOException e) {
            // the defaults are still usable for this run
            log.warn("Could not write default configuration {}: {}", file, e.getMessage());
        }
    }

    private ServerConfig withOverrides() {
        String resolvedHost = host;
        String propHost = System.getProperty("chat.server.host");
        String envHost = System.getenv("CHAT_SERVER_HOST");
        if (propHost != null && !propHost.isEmpty()) {
            resolvedHost = propHost;
        } else if (envHost != null && !envHost.isEmpty()) {
            resolvedHost = envHost;
        }

        int resolvedPort = port;
        String propPort = System.getProperty("chat.server.port");
        String envPort = System.getenv("CHAT_SERVER_PORT");
        if (propPort != null && !propPort.isEmpty()) {
            resolvedPort = parsePort(propPort, resolvedPort);
        } else if (envPort != null && !envPort.isEmpty()) {
            resolvedPort = parsePort(envPort, resolvedPort);
        }
        return new ServerConfig(resolvedHost, resolvedPort, idleTimeoutSeconds, usersFile);
    }

    private static int parsePort(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid port override '{}'", value);
            return fallback;
        }
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /** 0 disables the idle timeout. */
    public int getIdleTimeoutSeconds() {
        return idleTimeoutSeconds;
    }

    public String getUsersFile() {
        return usersFile;
    }

    @Override
    public String toString() {
        return "ServerConfig[" + host + ":" + port + "]";
    }
}

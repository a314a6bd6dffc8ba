package com.linechat.chat.server;

import java.util.Optional;

/** Commands the server understands. */
public enum CommandName {
    HELP("help", "Show this help message"),
    LIST("list", "List all connected users"),
    PRIVATE("private", "Send a private message", "<username> <message>"),
    STATS("stats", "Show server statistics");

    private final String keyword;
    private final String description;
    private final String usage;

    CommandName(String keyword, String description) {
        this(keyword, description, "");
    }

    CommandName(String keyword, String description, String usage) {
        this.keyword = keyword;
        this.description = description;
        this.usage = usage;
    }

    public String getKeyword() {
        return keyword;
    }

    /** One catalog line, e.g. {@code /private <username> <message> - Send a private message}. */
    public String helpLine() {
        String syntax = usage.isEmpty() ? "/" + keyword : "/" + keyword + " " + usage;
        return syntax + " - " + description;
    }

    /** The command whose {@code /keyword} starts {@code payload}, case-sensitive. */
    public static Optional<CommandName> matchPrefix(String payload) {
        for (CommandName name : values()) {
            if (payload.startsWith("/" + name.keyword)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }
}

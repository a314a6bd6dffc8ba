package com.linechat.chat.server;

/**
 * The requested username is already bound to another live session.
 */
public class DuplicateUsernameException extends IllegalStateException {
    private final String username;

    public DuplicateUsernameException(String username) {
        super("Username already taken: " + username);
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}

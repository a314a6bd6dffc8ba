package com.linechat.chat.server;

import java.util.Objects;

/**
 * A decoded client payload or a server notice. Instances are immutable.
 */
public abstract class ChatMessage {

    private ChatMessage() {}

    /**
     * Classifies a client payload. A payload is a {@link Command} when it starts with {@code /}
     * and a known keyword, matched case-sensitively as a prefix: {@code /helpme} is {@code /help}.
     * The arguments are whatever follows the first space of the payload, or nothing. Anything
     * else, unknown {@code /xxx} included, is {@link PlainText}.
     */
    public static ChatMessage parse(String payload) {
        Objects.requireNonNull(payload, "payload");
        int space = payload.indexOf(' ');
        String args = space < 0 ? "" : payload.substring(space + 1);
        return CommandName.matchPrefix(payload)
                .<ChatMessage>map(name -> new Command(name, args))
                .orElseGet(() -> new PlainText(payload));
    }

    public static final class Command extends ChatMessage {
        private final CommandName name;
        private final String args;

        public Command(CommandName name, String args) {
            this.name = Objects.requireNonNull(name, "name");
            this.args = Objects.requireNonNull(args, "args");
        }

        public CommandName getName() {
            return name;
        }

        /** Everything after the first space of the payload, verbatim. */
        public String getArgs() {
            return args;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Command)) return false;
            Command other = (Command) o;
            return name == other.name && args.equals(other.args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, args);
        }

        @Override
        public String toString() {
            return "Command[" + name.getKeyword() + ", " + args + "]";
        }
    }

    public static final class PlainText extends ChatMessage {
        private final String body;

        public PlainText(String body) {
            this.body = Objects.requireNonNull(body, "body");
        }

        public String getBody() {
            return body;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof PlainText && body.equals(((PlainText) o).body);
        }

        @Override
        public int hashCode() {
            return body.hashCode();
        }

        @Override
        public String toString() {
            return "PlainText[" + body + "]";
        }
    }

    /** Server-generated text such as join and leave announcements. */
    public static final class SystemNotice extends ChatMessage {
        public static final String PREFIX = "[SERVER] ";

        private final String body;

        public SystemNotice(String body) {
            this.body = Objects.requireNonNull(body, "body");
        }

        public static SystemNotice joined(String username) {
            return new SystemNotice(username + " has joined the chat.");
        }

        public static SystemNotice left(String username) {
            return new SystemNotice(username + " has left the chat.");
        }

        public String getBody() {
            return body;
        }

        /** The text as sent on the wire. */
        public String render() {
            return PREFIX + body;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SystemNotice && body.equals(((SystemNotice) o).body);
        }

        @Override
        public int hashCode() {
            return body.hashCode();
        }

        @Override
        public String toString() {
            return "SystemNotice[" + body + "]";
        }
    }
}

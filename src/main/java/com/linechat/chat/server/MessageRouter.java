package com.linechat.chat.server;

import com.linechat.chat.codec.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns one decoded payload from a session into outbound frames: command replies to the sender,
 * private deliveries, and broadcasts to everyone else.
 *
 * <p>Only failures writing to the <em>sender</em> are thrown; they mean the sender's own
 * connection is broken. Failures delivering to other sessions are logged and skipped.
 */
public class MessageRouter {
    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    static final String INVALID_PRIVATE_FORMAT = "[SERVER] Invalid format. Use /private <username> <message>\n";
    static final String USER_NOT_FOUND = "[SERVER] User not found.\n";
    static final String MESSAGE_TOO_LONG = "[SERVER] Message too long.\n";

    private final SessionRegistry registry;
    private final ServerStats stats;

    public MessageRouter(SessionRegistry registry, ServerStats stats) {
        this.registry = registry;
        this.stats = stats;
    }

    public void route(ChatSession sender, String payload) throws IOException {
        ChatMessage message = ChatMessage.parse(payload);
        if (message instanceof ChatMessage.Command) {
            handleCommand(sender, (ChatMessage.Command) message);
        } else {
            String body = ((ChatMessage.PlainText) message).getBody();
            String line = sender.getUsername() + ": " + body;
            if (!FrameCodec.fits(line)) {
                rejectTooLong(sender, payload);
                return;
            }
            log.info("[MESSAGE] {}: {}", sender.getUsername(), body);
            stats.recordMessage();
            broadcast(line, sender);
        }
    }

    private void handleCommand(ChatSession sender, ChatMessage.Command command) throws IOException {
        switch (command.getName()) {
            case HELP:
                sender.send(helpText());
                log.info("[HELP] Command issued by {}", sender.getUsername());
                break;
            case LIST:
                sender.send(userList());
                log.info("[LIST] Command issued by {}", sender.getUsername());
                break;
            case PRIVATE:
                sendPrivate(sender, command.getArgs());
                break;
            case STATS:
                String report = statsReport();
                sender.send(report);
                log.info("[STATS] Command issued by {}:\n{}", sender.getUsername(), report);
                break;
            default:
                throw new IllegalStateException("Unhandled command " + command.getName());
        }
    }

    private void sendPrivate(ChatSession sender, String args) throws IOException {
        // "<user> <text>": the text keeps any further spaces
        String[] parts = args.split(" ", 2);
        if (parts.length < 2) {
            sender.send(INVALID_PRIVATE_FORMAT);
            return;
        }
        String targetName = parts[0];
        String text = parts[1];
        Optional<ChatSession> target = registry.findByUsername(targetName);
        if (target.isEmpty()) {
            sender.send(USER_NOT_FOUND);
            return;
        }
        String delivery = "[PRIVATE] " + sender.getUsername() + ": " + text + "\n";
        String echo = "[PRIVATE] To " + targetName + ": " + text + "\n";
        if (!FrameCodec.fits(delivery) || !FrameCodec.fits(echo)) {
            rejectTooLong(sender, args);
            return;
        }
        deliver(target.get(), delivery);
        sender.send(echo);
        log.info("[PRIVATE] {} to {}: {}", sender.getUsername(), targetName, text);
    }

    // the server adds a prefix, so a payload near the frame limit can no longer be relayed
    private void rejectTooLong(ChatSession sender, String payload) throws IOException {
        log.warn("[REJECTED] {}: message of {} characters is too long to relay.", sender.getUsername(), payload.length());
        sender.send(MESSAGE_TOO_LONG);
    }

    public void announceJoin(ChatSession session) {
        broadcast(ChatMessage.SystemNotice.joined(session.getUsername()).render(), session);
    }

    public void announceLeave(ChatSession session) {
        broadcast(ChatMessage.SystemNotice.left(session.getUsername()).render(), session);
    }

    /**
     * Sends {@code text} to every identified session in the current snapshot except {@code sender}.
     * A failed delivery does not stop delivery to the rest.
     *
     * @return the number of sessions the text was written to
     */
    public int broadcast(String text, ChatSession sender) {
        int delivered = 0;
        for (ChatSession recipient : registry.snapshot()) {
            if (sender != null && recipient.getId().equals(sender.getId())) {
                continue;
            }
            if (!recipient.isIdentified()) {
                continue;
            }
            if (deliver(recipient, text)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliver(ChatSession recipient, String text) {
        try {
            recipient.send(text);
            return true;
        } catch (IOException e) {
            log.warn("[ERROR] Sending message to {}: {}", recipient, e.getMessage());
            return false;
        }
    }

    String helpText() {
        StringBuilder sb = new StringBuilder("[SERVER] Commands:\n");
        for (CommandName name : CommandName.values()) {
            sb.append(name.helpLine()).append('\n');
        }
        return sb.toString();
    }

    String userList() {
        List<String> names = registry.snapshot().stream()
                .filter(ChatSession::isIdentified)
                .map(ChatSession::getUsername)
                .collect(Collectors.toList());
        return "[SERVER] Connected users:\n" + String.join("\n", names) + "\n";
    }

    String statsReport() {
        return "[SERVER STATS]\n"
                + "Active users: " + registry.size() + "\n"
                + "Total messages: " + stats.getMessageCount() + "\n"
                + "Uptime: " + ServerStats.formatUptime(stats.uptime());
    }
}

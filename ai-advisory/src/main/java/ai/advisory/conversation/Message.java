package ai.advisory.conversation;

import java.time.Instant;
import java.util.Objects;

public record Message(
        Role role,
        String text,
        Instant timestamp
) {
    public Message {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static Message user(String text) {
        return new Message(Role.USER, text, Instant.now());
    }

    public static Message advisor(String text) {
        return new Message(Role.ADVISOR, text, Instant.now());
    }
}

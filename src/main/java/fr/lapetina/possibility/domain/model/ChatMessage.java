package fr.lapetina.possibility.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One message of the conversation sent along with every possibility request.
 */
public record ChatMessage(
        String id,
        String role,
        String content,
        Instant timestamp
) {
    public ChatMessage {
        Objects.requireNonNull(role, "Role is required");
        Objects.requireNonNull(content, "Content is required");
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(null, "user", content, null);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(null, "assistant", content, null);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(null, "system", content, null);
    }
}

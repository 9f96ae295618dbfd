package bbt.tao.conversation.entity;

import java.time.Instant;
import java.util.Objects;

/**
 * One turn of a conversation. Instances are immutable once stored.
 */
public record ChatMessage(
        ChatRole role,
        String content,
        Instant timestamp
) {
    public ChatMessage {
        role = Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
        timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public static ChatMessage system(String content, Instant timestamp) {
        return new ChatMessage(ChatRole.SYSTEM, content, timestamp);
    }

    public static ChatMessage user(String content, Instant timestamp) {
        return new ChatMessage(ChatRole.USER, content, timestamp);
    }

    public static ChatMessage assistant(String content, Instant timestamp) {
        return new ChatMessage(ChatRole.ASSISTANT, content, timestamp);
    }

    public boolean isSystem() {
        return role == ChatRole.SYSTEM;
    }
}

package bbt.tao.conversation.entity;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

public record ConversationEntry(
        UUID conversationId,
        List<ChatMessage> messages,
        Instant lastActivity
) {
    public ConversationEntry {
        conversationId = Objects.requireNonNull(conversationId, "conversationId");
        messages = messages == null ? List.of() : List.copyOf(messages);
        lastActivity = Objects.requireNonNull(lastActivity, "lastActivity");
    }
}

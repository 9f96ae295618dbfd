package bbt.tao.conversation.dto;

import bbt.tao.conversation.entity.ChatMessage;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

public record ChatRequest(
        UUID conversationId,
        String model,
        List<ChatMessage> messages,
        ChatParameters parameters,
        boolean stream
) {
    public ChatRequest {
        conversationId = Objects.requireNonNull(conversationId, "conversationId");
        model = Objects.requireNonNull(model, "model");
        messages = messages == null ? List.of() : List.copyOf(messages);
        parameters = parameters == null ? ChatParameters.empty() : parameters;
    }
}

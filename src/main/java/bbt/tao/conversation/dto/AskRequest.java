package bbt.tao.conversation.dto;

import java.util.UUID;

public record AskRequest(
        UUID conversationId,
        String message,
        ChatParameters parameters,
        String model
) {
}

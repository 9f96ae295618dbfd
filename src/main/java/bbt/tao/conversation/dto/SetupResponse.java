package bbt.tao.conversation.dto;

import java.util.UUID;

public record SetupResponse(UUID conversationId) {
}

package bbt.tao.conversation.dto;

import java.util.UUID;

public record SetupRequest(UUID conversationId, String message) {
}

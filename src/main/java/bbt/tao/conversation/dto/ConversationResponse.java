package bbt.tao.conversation.dto;

import bbt.tao.conversation.entity.ChatRole;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.UUID;

/**
 * What callers get back from a chat interaction. For streaming calls every response carries a
 * single delta in {@link #content()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationResponse(
        UUID conversationId,
        String id,
        String model,
        Instant created,
        ChatRole role,
        String content,
        String finishReason,
        ChatUsage usage,
        ChatError error
) {

    public static ConversationResponse failed(UUID conversationId, ChatError error) {
        return new ConversationResponse(conversationId, null, null, null, ChatRole.ASSISTANT, "", null, null, error);
    }

    public boolean isSuccessful() {
        return error == null;
    }
}

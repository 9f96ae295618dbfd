package bbt.tao.conversation.dto;

import java.time.Instant;

/**
 * A complete assistant reply returned by the completion service.
 */
public record Completion(
        String id,
        String model,
        Instant created,
        String content,
        String finishReason,
        ChatUsage usage
) {
    public Completion {
        content = content == null ? "" : content;
    }
}

package bbt.tao.conversation.dto;

/**
 * Token usage as reported by the upstream service.
 */
public record ChatUsage(
        Integer promptTokens,
        Integer completionTokens,
        Integer totalTokens
) {
}

package bbt.tao.conversation.dto;

/**
 * One incremental fragment of a streamed assistant reply.
 */
public record CompletionChunk(
        String id,
        String model,
        String delta,
        String finishReason
) {
    public CompletionChunk {
        delta = delta == null ? "" : delta;
    }
}

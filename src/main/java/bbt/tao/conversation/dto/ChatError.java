package bbt.tao.conversation.dto;

import bbt.tao.conversation.exception.UpstreamException;

public record ChatError(
        UpstreamException.Kind kind,
        String message
) {
    public static ChatError from(UpstreamException ex) {
        return new ChatError(ex.getKind(), ex.getMessage());
    }
}

package bbt.tao.conversation.exception;

import java.util.Objects;

/**
 * The completion service rejected a request or could not be reached.
 */
public class UpstreamException extends RuntimeException {

    public enum Kind {
        NETWORK,
        AUTHENTICATION,
        RATE_LIMIT,
        SERVER,
        UNKNOWN
    }

    private final Kind kind;

    public UpstreamException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind getKind() {
        return kind;
    }
}

package bbt.tao.conversation.exception;

/**
 * A conversation entry broke one of the history invariants. Treated as a defect.
 */
public class CacheStateException extends IllegalStateException {

    public CacheStateException(String message) {
        super(message);
    }
}

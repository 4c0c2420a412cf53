package alertdedup.dedup;

/**
 * 去重异常
 */
public class DedupException extends RuntimeException {
    public DedupException(String message) {
        super(message);
    }

    public DedupException(String message, Throwable cause) {
        super(message, cause);
    }
}

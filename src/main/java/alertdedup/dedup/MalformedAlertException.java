package alertdedup.dedup;

/**
 * 告警内容无法解析，无法做出判定
 */
public class MalformedAlertException extends DedupException {
    public MalformedAlertException(String message) {
        super(message);
    }

    public MalformedAlertException(String message, Throwable cause) {
        super(message, cause);
    }
}

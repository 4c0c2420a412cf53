package alertdedup.dedup;

/**
 * 缓存读写失败（磁盘不可读/不可写等）
 */
public class CacheStoreException extends DedupException {
    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

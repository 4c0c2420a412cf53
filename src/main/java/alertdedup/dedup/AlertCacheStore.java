package alertdedup.dedup;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 告警缓存接口 - 用于告警去重
 * <p>
 * 同一指纹上的所有操作必须互斥：多个进程同时首次看到同一告警时，只能有一个插入成功。
 * I/O 失败以 {@link CacheStoreException} 抛出。
 */
public interface AlertCacheStore {
    /**
     * 读取并更新告警记录：不存在、过期或损坏时返回空（过期和损坏的记录顺带删除），
     * 否则出现次数加一、更新 lastSeen 并返回更新后的记录
     */
    Optional<CacheRecord> lookupAndTouch(String fingerprint, Instant now);

    /**
     * 记录首次出现
     *
     * @throws FingerprintConflictException 已存在未过期的记录
     */
    CacheRecord insert(String fingerprint, AlertFields fields, Instant now);

    /**
     * 删除告警记录，不存在时不报错
     */
    void delete(String fingerprint);

    /**
     * 当前存储的全部指纹（包含损坏的记录）
     */
    List<String> fingerprints();

    /**
     * 过期或损坏时删除记录
     *
     * @return 是否删除了记录
     */
    boolean expireIfStale(String fingerprint, Instant now);

    /**
     * 清理存储里的残留文件（写入中断留下的临时文件等）
     *
     * @return 清理的数量
     */
    default int purgeOrphans(Instant now) {
        return 0;
    }
}

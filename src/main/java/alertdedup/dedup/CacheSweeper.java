package alertdedup.dedup;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

/**
 * 过期记录清理，每次调用处理告警之前执行一次
 */
@Slf4j
public class CacheSweeper {
    private final AlertCacheStore store;

    public CacheSweeper(AlertCacheStore store) {
        this.store = store;
    }

    /**
     * 删除过期和损坏的记录，单条失败只记录日志，不中断扫描
     *
     * @return 删除的记录数
     */
    public int sweep(Instant now) {
        List<String> fingerprints;
        try {
            fingerprints = store.fingerprints();
        } catch (CacheStoreException e) {
            log.error("Error during cache cleanup", e);
            return 0;
        }

        int evicted = 0;
        for (String fingerprint : fingerprints) {
            try {
                if (store.expireIfStale(fingerprint, now)) {
                    evicted++;
                }
            } catch (RuntimeException e) {
                log.warn("清理缓存记录失败，跳过: {}", AlertFingerprinter.shortId(fingerprint), e);
            }
        }

        purgeOrphans(now);

        if (evicted > 0) {
            log.info("Cleaned up {} expired cache entries", evicted);
        }
        return evicted;
    }

    private void purgeOrphans(Instant now) {
        try {
            int purged = store.purgeOrphans(now);
            if (purged > 0) {
                log.info("清理残留临时文件 {} 个", purged);
            }
        } catch (CacheStoreException e) {
            log.warn("清理残留临时文件失败", e);
        }
    }
}

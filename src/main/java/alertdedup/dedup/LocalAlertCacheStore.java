package alertdedup.dedup;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 进程内告警缓存，基于 Guava Cache，单个指纹上的读改写通过 ConcurrentMap.compute 保证原子
 */
@Slf4j
public class LocalAlertCacheStore implements AlertCacheStore {
    private final Cache<String, CacheRecord> cache;
    private final Duration ttl;

    public LocalAlertCacheStore(Duration ttl, long maximumSize) {
        this.ttl = ttl;
        this.cache = CacheBuilder.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .build();
    }

    @Override
    public Optional<CacheRecord> lookupAndTouch(String fingerprint, Instant now) {
        AtomicReference<CacheRecord> hit = new AtomicReference<>();
        records().computeIfPresent(fingerprint, (key, record) -> {
            if (record.isExpired(now, ttl)) {
                log.debug("Cache record expired: {}", AlertFingerprinter.shortId(key));
                return null;
            }
            record.touch(now);
            hit.set(record.copy());
            return record;
        });
        return Optional.ofNullable(hit.get());
    }

    @Override
    public CacheRecord insert(String fingerprint, AlertFields fields, Instant now) {
        CacheRecord created = CacheRecord.firstOccurrence(fingerprint, fields, now);
        AtomicBoolean conflict = new AtomicBoolean(false);
        records().compute(fingerprint, (key, existing) -> {
            if (existing != null && !existing.isExpired(now, ttl)) {
                conflict.set(true);
                return existing;
            }
            return created;
        });
        if (conflict.get()) {
            throw new FingerprintConflictException(fingerprint);
        }
        return created.copy();
    }

    @Override
    public void delete(String fingerprint) {
        cache.invalidate(fingerprint);
    }

    @Override
    public List<String> fingerprints() {
        cache.cleanUp();
        return new ArrayList<>(records().keySet());
    }

    @Override
    public boolean expireIfStale(String fingerprint, Instant now) {
        AtomicBoolean evicted = new AtomicBoolean(false);
        records().computeIfPresent(fingerprint, (key, record) -> {
            if (record.isExpired(now, ttl)) {
                evicted.set(true);
                return null;
            }
            return record;
        });
        return evicted.get();
    }

    public void shutdown() {
        cache.invalidateAll();
    }

    private ConcurrentMap<String, CacheRecord> records() {
        return cache.asMap();
    }
}

package alertdedup.dedup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 告警抑制引擎 - 先去重，再按静默时段、测试告警规则过滤
 */
public class SuppressionEngine {
    private static final Logger logger = LoggerFactory.getLogger(SuppressionEngine.class);

    static final String QUIET_HOURS_REASON = "Low severity alert during quiet hours";
    static final String SYNTHETIC_REASON = "Synthetic/test alert detected";

    private final AlertCacheStore store;
    private final AlertFingerprinter fingerprinter;
    private final QuietHoursPolicy quietHours;
    private final List<String> syntheticMarkers;

    public SuppressionEngine(AlertCacheStore store,
                             AlertFingerprinter fingerprinter,
                             QuietHoursPolicy quietHours,
                             List<String> syntheticMarkers) {
        this.store = store;
        this.fingerprinter = fingerprinter;
        this.quietHours = quietHours;
        this.syntheticMarkers = syntheticMarkers.stream()
                .map(marker -> marker.trim().toLowerCase(Locale.ROOT))
                .filter(marker -> !marker.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 判定告警是否需要抑制
     */
    public SuppressionDecision decide(AlertFields fields, Instant now) {
        String fingerprint = fingerprinter.fingerprint(fields);
        String shortId = AlertFingerprinter.shortId(fingerprint);

        // 1. 检查去重
        Optional<CacheRecord> existing = lookup(fingerprint, now);
        if (existing.isPresent()) {
            int count = existing.get().getOccurrenceCount();
            logger.info("Duplicate alert detected (seen {} times): {}", count, shortId);
            return duplicate(fingerprint, count);
        }

        // 2. 记录首次出现
        int occurrenceCount = 0;
        try {
            occurrenceCount = store.insert(fingerprint, fields, now).getOccurrenceCount();
        } catch (FingerprintConflictException e) {
            logger.info("并发插入冲突，按重复告警处理: {}", shortId);
            return duplicate(fingerprint, 0);
        } catch (CacheStoreException e) {
            logger.warn("写入告警缓存失败，继续处理: {}", shortId, e);
        }

        // 3. 静默时段内的低级别告警
        if (quietHours.applies(fields.getSeverity(), now)) {
            return SuppressionDecision.suppress(SuppressionRule.QUIET_HOURS, QUIET_HOURS_REASON,
                    fingerprint, occurrenceCount);
        }

        // 4. 测试告警
        if (isSynthetic(fields.getNormalizedMessage())) {
            return SuppressionDecision.suppress(SuppressionRule.SYNTHETIC, SYNTHETIC_REASON,
                    fingerprint, occurrenceCount);
        }

        return SuppressionDecision.allow(fingerprint, occurrenceCount);
    }

    private Optional<CacheRecord> lookup(String fingerprint, Instant now) {
        try {
            return store.lookupAndTouch(fingerprint, now);
        } catch (CacheStoreException e) {
            logger.warn("读取告警缓存失败，按未命中处理: {}", AlertFingerprinter.shortId(fingerprint), e);
            return Optional.empty();
        }
    }

    private boolean isSynthetic(String normalizedMessage) {
        String message = normalizedMessage.toLowerCase(Locale.ROOT);
        return syntheticMarkers.stream().anyMatch(message::contains);
    }

    private static SuppressionDecision duplicate(String fingerprint, int count) {
        String reason = count > 0
                ? String.format("Duplicate alert (hash: %s, seen %d times)", AlertFingerprinter.shortId(fingerprint), count)
                : String.format("Duplicate alert (hash: %s)", AlertFingerprinter.shortId(fingerprint));
        return SuppressionDecision.suppress(SuppressionRule.DUPLICATE, reason, fingerprint, count);
    }
}

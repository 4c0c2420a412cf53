package alertdedup.dedup;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * 告警去重缓存记录
 */
@Data
@NoArgsConstructor
public class CacheRecord {
    private String fingerprint;
    private Instant firstSeen;
    private Instant lastSeen;
    private int occurrenceCount;
    private AlertFields alert;

    public static CacheRecord firstOccurrence(String fingerprint, AlertFields alert, Instant now) {
        CacheRecord record = new CacheRecord();
        record.setFingerprint(fingerprint);
        record.setFirstSeen(now);
        record.setLastSeen(now);
        record.setOccurrenceCount(1);
        record.setAlert(alert);
        return record;
    }

    public CacheRecord copy() {
        CacheRecord copy = new CacheRecord();
        copy.setFingerprint(fingerprint);
        copy.setFirstSeen(firstSeen);
        copy.setLastSeen(lastSeen);
        copy.setOccurrenceCount(occurrenceCount);
        copy.setAlert(alert);
        return copy;
    }

    /**
     * 记录一次重复出现
     */
    public void touch(Instant now) {
        this.occurrenceCount++;
        if (now.isAfter(lastSeen)) {
            this.lastSeen = now;
        }
    }

    /**
     * now - firstSeen > ttl 即视为过期
     */
    public boolean isExpired(Instant now, Duration ttl) {
        return Duration.between(firstSeen, now).compareTo(ttl) > 0;
    }

    @JsonIgnore
    public boolean isWellFormed() {
        return fingerprint != null
                && firstSeen != null
                && lastSeen != null
                && !lastSeen.isBefore(firstSeen)
                && occurrenceCount >= 1;
    }
}

package alertdedup.dedup;

import lombok.Builder;
import lombok.Value;

/**
 * 抑制判定结果
 */
@Value
@Builder
public class SuppressionDecision {
    boolean suppressed;
    SuppressionRule rule;
    String reason;
    String fingerprint;
    int occurrenceCount;   // 0 表示没有可用的缓存记录

    public static SuppressionDecision allow(String fingerprint, int occurrenceCount) {
        return SuppressionDecision.builder()
                .suppressed(false)
                .rule(SuppressionRule.NONE)
                .reason("")
                .fingerprint(fingerprint)
                .occurrenceCount(occurrenceCount)
                .build();
    }

    public static SuppressionDecision suppress(SuppressionRule rule, String reason,
                                               String fingerprint, int occurrenceCount) {
        return SuppressionDecision.builder()
                .suppressed(true)
                .rule(rule)
                .reason(reason)
                .fingerprint(fingerprint)
                .occurrenceCount(occurrenceCount)
                .build();
    }
}

package alertdedup.dedup;

/**
 * 命中的抑制规则
 */
public enum SuppressionRule {
    NONE,
    DUPLICATE,
    QUIET_HOURS,
    SYNTHETIC
}

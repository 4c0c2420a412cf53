package alertdedup.dedup;

import lombok.Getter;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 静默时段：低级别告警在 [startHour, endHour] 内（含两端）被抑制，startHour > endHour 时跨越午夜
 */
@Getter
public class QuietHoursPolicy {
    private final boolean enabled;
    private final int startHour;
    private final int endHour;
    private final ZoneId zone;
    private final Set<String> severities;

    public QuietHoursPolicy(boolean enabled, int startHour, int endHour, ZoneId zone, Collection<String> severities) {
        this.enabled = enabled;
        this.startHour = startHour;
        this.endHour = endHour;
        this.zone = zone;
        this.severities = severities.stream()
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static QuietHoursPolicy disabled() {
        return new QuietHoursPolicy(false, 0, 0, ZoneId.systemDefault(), Set.of());
    }

    public boolean applies(String severity, Instant now) {
        if (!enabled || severity == null) {
            return false;
        }
        if (!severities.contains(severity.trim().toLowerCase(Locale.ROOT))) {
            return false;
        }
        return inWindow(now.atZone(zone).getHour());
    }

    boolean inWindow(int hour) {
        if (startHour <= endHour) {
            return hour >= startHour && hour <= endHour;
        }
        return hour >= startHour || hour <= endHour;
    }
}

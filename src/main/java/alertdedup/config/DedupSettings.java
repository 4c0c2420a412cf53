package alertdedup.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 去重配置，启动时读取一次
 */
@Getter
@Component
public class DedupSettings {

    @Value("${alertdedup.cache.type:file}")
    private String cacheType;

    @Value("${alertdedup.cache.dir:/tmp/alert-dedup}")
    private String cacheDir;

    @Value("${alertdedup.cache.ttl-seconds:3600}")
    private long ttlSeconds;

    @Value("${alertdedup.cache.lock-stripes:64}")
    private int lockStripes;

    @Value("${alertdedup.cache.max-entries:10000}")
    private long maxEntries;

    @Value("${alertdedup.quiet-hours.enabled:true}")
    private boolean quietHoursEnabled;

    @Value("${alertdedup.quiet-hours.start:9}")
    private int quietHoursStart;

    @Value("${alertdedup.quiet-hours.end:17}")
    private int quietHoursEnd;

    @Value("${alertdedup.quiet-hours.zone:}")
    private String quietHoursZone;

    @Value("${alertdedup.quiet-hours.severities:low,info}")
    private String[] quietHoursSeverities;

    @Value("${alertdedup.synthetic.markers:test,testing,demo}")
    private String[] syntheticMarkers;

    public Path getCachePath() {
        return Paths.get(cacheDir);
    }

    public Duration getTtl() {
        return Duration.ofSeconds(ttlSeconds);
    }

    public ZoneId getZone() {
        return StringUtils.isBlank(quietHoursZone) ? ZoneId.systemDefault() : ZoneId.of(quietHoursZone.trim());
    }

    public List<String> getQuietHoursSeverityList() {
        return toList(quietHoursSeverities);
    }

    public List<String> getSyntheticMarkerList() {
        return toList(syntheticMarkers);
    }

    public boolean isMemoryCache() {
        return "memory".equalsIgnoreCase(cacheType);
    }

    /**
     * 验证配置
     */
    @PostConstruct
    public void validate() {
        if (!"file".equalsIgnoreCase(cacheType) && !isMemoryCache()) {
            throw new IllegalArgumentException("不支持的缓存类型: " + cacheType);
        }
        if (!isMemoryCache() && StringUtils.isBlank(cacheDir)) {
            throw new IllegalArgumentException("缓存目录未配置");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("缓存有效期必须大于0: " + ttlSeconds);
        }
        if (lockStripes <= 0) {
            throw new IllegalArgumentException("锁分段数必须大于0: " + lockStripes);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("缓存最大条数必须大于0: " + maxEntries);
        }
        validateHour(quietHoursStart, "alertdedup.quiet-hours.start");
        validateHour(quietHoursEnd, "alertdedup.quiet-hours.end");
        getZone();
    }

    private static void validateHour(int hour, String key) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException(key + " 必须在0-23之间: " + hour);
        }
    }

    private static List<String> toList(String[] values) {
        if (values == null) {
            return List.of();
        }
        return Arrays.stream(values)
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toList());
    }
}

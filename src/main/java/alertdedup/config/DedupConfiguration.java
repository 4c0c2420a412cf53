package alertdedup.config;

import alertdedup.cli.AlertParser;
import alertdedup.dedup.AlertCacheStore;
import alertdedup.dedup.AlertFingerprinter;
import alertdedup.dedup.AlertNormalizer;
import alertdedup.dedup.CacheSweeper;
import alertdedup.dedup.FileAlertCacheStore;
import alertdedup.dedup.LocalAlertCacheStore;
import alertdedup.dedup.QuietHoursPolicy;
import alertdedup.dedup.SuppressionEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class DedupConfiguration {

    @Autowired
    private DedupSettings settings;

    @Bean
    public AlertNormalizer alertNormalizer() {
        return new AlertNormalizer();
    }

    @Bean
    public AlertFingerprinter alertFingerprinter() {
        return new AlertFingerprinter();
    }

    @Bean
    public AlertParser alertParser() {
        return new AlertParser();
    }

    @Bean
    public AlertCacheStore alertCacheStore() {
        if (settings.isMemoryCache()) {
            log.info("使用进程内告警缓存, ttl: {}", settings.getTtl());
            return new LocalAlertCacheStore(settings.getTtl(), settings.getMaxEntries());
        }
        log.info("使用本地目录告警缓存: {}, ttl: {}", settings.getCachePath(), settings.getTtl());
        return new FileAlertCacheStore(settings.getCachePath(), settings.getTtl(), settings.getLockStripes());
    }

    @Bean
    public CacheSweeper cacheSweeper(AlertCacheStore alertCacheStore) {
        return new CacheSweeper(alertCacheStore);
    }

    @Bean
    public QuietHoursPolicy quietHoursPolicy() {
        return new QuietHoursPolicy(
                settings.isQuietHoursEnabled(),
                settings.getQuietHoursStart(),
                settings.getQuietHoursEnd(),
                settings.getZone(),
                settings.getQuietHoursSeverityList()
        );
    }

    @Bean
    public SuppressionEngine suppressionEngine(AlertCacheStore alertCacheStore,
                                               AlertFingerprinter alertFingerprinter,
                                               QuietHoursPolicy quietHoursPolicy) {
        return new SuppressionEngine(alertCacheStore, alertFingerprinter, quietHoursPolicy,
                settings.getSyntheticMarkerList());
    }
}

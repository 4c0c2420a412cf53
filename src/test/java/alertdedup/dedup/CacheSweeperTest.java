package alertdedup.dedup;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CacheSweeperTest {

    private static final Duration TTL = Duration.ofHours(1);
    private static final Instant T0 = Instant.parse("2026-10-18T03:00:00Z");

    private final AlertFingerprinter fingerprinter = new AlertFingerprinter();

    @TempDir
    Path cacheDir;

    @Test
    void evictsStaleAndKeepsLiveRecords() {
        FileAlertCacheStore store = new FileAlertCacheStore(cacheDir, TTL, 64);
        AlertFields old = AlertFields.builder().service("db1").alertType("cpu").build();
        AlertFields recent = AlertFields.builder().service("db2").alertType("cpu").build();
        store.insert(fingerprinter.fingerprint(old), old, T0);
        store.insert(fingerprinter.fingerprint(recent), recent, T0.plus(Duration.ofMinutes(50)));

        int evicted = new CacheSweeper(store).sweep(T0.plus(Duration.ofMinutes(61)));

        assertThat(evicted).isEqualTo(1);
        assertThat(store.fingerprints()).containsExactly(fingerprinter.fingerprint(recent));
    }

    @Test
    void evictsCorruptRecords() throws Exception {
        FileAlertCacheStore store = new FileAlertCacheStore(cacheDir, TTL, 64);
        String fingerprint = fingerprinter.fingerprint("svc", "high", "disk", "disk full");
        Files.writeString(cacheDir.resolve(fingerprint + ".json"), "[1, 2");

        assertThat(new CacheSweeper(store).sweep(T0)).isEqualTo(1);
        assertThat(store.fingerprints()).isEmpty();
    }

    @Test
    void sweepsInMemoryStoreToo() {
        LocalAlertCacheStore store = new LocalAlertCacheStore(TTL, 100);
        AlertFields fields = AlertFields.builder().service("db1").build();
        store.insert(fingerprinter.fingerprint(fields), fields, T0);

        assertThat(new CacheSweeper(store).sweep(T0.plus(TTL))).isZero();
        assertThat(new CacheSweeper(store).sweep(T0.plus(TTL).plusSeconds(1))).isEqualTo(1);
    }

    @Test
    void failureOnOneEntryDoesNotAbortTheScan() {
        AlertCacheStore store = mock(AlertCacheStore.class);
        when(store.fingerprints()).thenReturn(List.of("a", "b", "c"));
        when(store.expireIfStale("a", T0)).thenReturn(true);
        when(store.expireIfStale("b", T0)).thenThrow(new CacheStoreException("disk error", new java.io.IOException("EIO")));
        when(store.expireIfStale("c", T0)).thenReturn(true);

        assertThat(new CacheSweeper(store).sweep(T0)).isEqualTo(2);
        verify(store).expireIfStale("c", T0);
        verify(store).purgeOrphans(T0);
    }

    @Test
    void unreadableStoreYieldsZero() {
        AlertCacheStore store = mock(AlertCacheStore.class);
        when(store.fingerprints()).thenThrow(new CacheStoreException("unreadable", new java.io.IOException("EACCES")));

        assertThat(new CacheSweeper(store).sweep(T0)).isZero();
    }

    @Test
    void orphanPurgeFailureIsTolerated() {
        AlertCacheStore store = mock(AlertCacheStore.class);
        when(store.fingerprints()).thenReturn(List.of());
        when(store.purgeOrphans(any())).thenThrow(new CacheStoreException("unreadable", new java.io.IOException("EACCES")));

        assertThat(new CacheSweeper(store).sweep(T0)).isZero();
    }
}

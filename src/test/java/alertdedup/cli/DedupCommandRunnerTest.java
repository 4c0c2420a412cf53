package alertdedup.cli;

import alertdedup.dedup.AlertFingerprinter;
import alertdedup.dedup.AlertNormalizer;
import alertdedup.dedup.CacheSweeper;
import alertdedup.dedup.LocalAlertCacheStore;
import alertdedup.dedup.QuietHoursPolicy;
import alertdedup.dedup.SuppressionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class DedupCommandRunnerTest {

    private static final Instant NOW = Instant.parse("2026-10-18T03:00:00Z");
    private static final String ALERT = "{\"service\":\"db1\",\"severity\":\"low\",\"type\":\"cpu\","
            + "\"message\":\"CPU at 95.2% at 12:03:01\"}";

    private LocalAlertCacheStore store;
    private DedupCommandRunner runner;

    @TempDir
    Path workDir;

    @BeforeEach
    void setUp() {
        store = new LocalAlertCacheStore(Duration.ofHours(1), 100);
        runner = newRunner(new CacheSweeper(store));
    }

    private DedupCommandRunner newRunner(CacheSweeper sweeper) {
        SuppressionEngine engine = new SuppressionEngine(store, new AlertFingerprinter(),
                QuietHoursPolicy.disabled(), List.of("test", "demo"));
        return new DedupCommandRunner(new AlertParser(), new AlertNormalizer(), sweeper, engine,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private DedupExitCode processStdin(String content) {
        runner.setInput(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));
        return runner.process();
    }

    @Test
    void firstAlertIsAllowedAndRepeatIsSuppressed() {
        assertThat(processStdin(ALERT)).isEqualTo(DedupExitCode.ALLOW);
        assertThat(processStdin(ALERT)).isEqualTo(DedupExitCode.SUPPRESS);
    }

    @Test
    void malformedInputCannotBeDecided() {
        assertThat(processStdin("")).isEqualTo(DedupExitCode.CANNOT_DECIDE);
        assertThat(processStdin("[\"not\", \"an\", \"alert\"]")).isEqualTo(DedupExitCode.CANNOT_DECIDE);
        assertThat(store.fingerprints()).isEmpty();
    }

    @Test
    void readsAlertFromFileArgument() throws Exception {
        Path file = workDir.resolve("alert.json");
        Files.writeString(file, ALERT);

        assertThat(runner.process(file.toString())).isEqualTo(DedupExitCode.ALLOW);
        assertThat(runner.process(file.toString())).isEqualTo(DedupExitCode.SUPPRESS);
    }

    @Test
    void missingFileCannotBeDecided() {
        assertThat(runner.process(workDir.resolve("missing.json").toString()))
                .isEqualTo(DedupExitCode.CANNOT_DECIDE);
    }

    @Test
    void sweepsBeforeDeciding() {
        CacheSweeper sweeper = mock(CacheSweeper.class);
        DedupCommandRunner withMockSweeper = newRunner(sweeper);
        withMockSweeper.setInput(new ByteArrayInputStream(ALERT.getBytes(StandardCharsets.UTF_8)));

        withMockSweeper.process();

        verify(sweeper).sweep(NOW);
    }

    @Test
    void malformedInputSkipsSweep() {
        CacheSweeper sweeper = mock(CacheSweeper.class);
        DedupCommandRunner withMockSweeper = newRunner(sweeper);
        withMockSweeper.setInput(new ByteArrayInputStream(new byte[0]));

        withMockSweeper.process();

        verify(sweeper, never()).sweep(NOW);
    }

    @Test
    void runExposesExitCode() throws Exception {
        Path file = workDir.resolve("alert.txt");
        Files.writeString(file, "Service: web\nSeverity: low\nTest alert, please ignore");

        runner.run(new DefaultApplicationArguments(file.toString()));

        assertThat(runner.getExitCode()).isEqualTo(1);
    }
}

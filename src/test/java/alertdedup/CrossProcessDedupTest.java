package alertdedup;

import alertdedup.cli.DedupExitCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 多个独立 JVM 同时处理同一条告警，只能放行一次
 */
class CrossProcessDedupTest {

    private static final int PROCESSES = 6;
    private static final String ALERT = "{\"service\":\"db1\",\"severity\":\"high\",\"type\":\"cpu\","
            + "\"message\":\"CPU at 95.2% at 12:03:01\"}";

    @TempDir
    Path cacheDir;

    @Test
    void exactlyOneProcessIsAllowed() throws Exception {
        List<Process> processes = new ArrayList<>();
        try {
            for (int i = 0; i < PROCESSES; i++) {
                processes.add(startDedupProcess());
            }
            for (Process process : processes) {
                try (OutputStream stdin = process.getOutputStream()) {
                    stdin.write(ALERT.getBytes(StandardCharsets.UTF_8));
                }
            }

            List<Integer> exitCodes = new ArrayList<>();
            for (Process process : processes) {
                assertThat(process.waitFor(2, TimeUnit.MINUTES)).isTrue();
                exitCodes.add(process.exitValue());
            }

            assertThat(exitCodes).filteredOn(code -> code == DedupExitCode.ALLOW.getCode()).hasSize(1);
            assertThat(exitCodes).filteredOn(code -> code == DedupExitCode.SUPPRESS.getCode())
                    .hasSize(PROCESSES - 1);
        } finally {
            processes.forEach(Process::destroyForcibly);
        }
    }

    private Process startDedupProcess() throws Exception {
        String java = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
        ProcessBuilder builder = new ProcessBuilder(java,
                "-cp", System.getProperty("java.class.path"),
                AlertDedupApplication.class.getName(),
                "--alertdedup.cache.dir=" + cacheDir)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        return builder.start();
    }
}

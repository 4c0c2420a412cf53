package alertdedup.cli;

import alertdedup.dedup.Alert;
import alertdedup.dedup.AlertFields;
import alertdedup.dedup.AlertNormalizer;
import alertdedup.dedup.CacheSweeper;
import alertdedup.dedup.MalformedAlertException;
import alertdedup.dedup.SuppressionDecision;
import alertdedup.dedup.SuppressionEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;

/**
 * 命令行入口：读取一条告警（标准输入或文件参数），清理过期缓存，输出判定并设置退出码
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "alertdedup.cli.enabled", havingValue = "true", matchIfMissing = true)
public class DedupCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private final AlertParser alertParser;
    private final AlertNormalizer alertNormalizer;
    private final CacheSweeper cacheSweeper;
    private final SuppressionEngine suppressionEngine;
    private final Clock clock;
    private InputStream input = System.in;

    private volatile DedupExitCode exitCode = DedupExitCode.CANNOT_DECIDE;

    @Autowired
    public DedupCommandRunner(AlertParser alertParser,
                              AlertNormalizer alertNormalizer,
                              CacheSweeper cacheSweeper,
                              SuppressionEngine suppressionEngine) {
        this(alertParser, alertNormalizer, cacheSweeper, suppressionEngine, Clock.systemDefaultZone());
    }

    DedupCommandRunner(AlertParser alertParser,
                       AlertNormalizer alertNormalizer,
                       CacheSweeper cacheSweeper,
                       SuppressionEngine suppressionEngine,
                       Clock clock) {
        this.alertParser = alertParser;
        this.alertNormalizer = alertNormalizer;
        this.cacheSweeper = cacheSweeper;
        this.suppressionEngine = suppressionEngine;
        this.clock = clock;
    }

    void setInput(InputStream input) {
        this.input = input;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = process(args.getNonOptionArgs().toArray(new String[0]));
    }

    @Override
    public int getExitCode() {
        return exitCode.getCode();
    }

    DedupExitCode process(String... args) {
        try {
            String content = readContent(args);
            Alert alert = alertParser.parse(content);

            Instant now = clock.instant();
            cacheSweeper.sweep(now);

            AlertFields fields = AlertFields.from(alert, alertNormalizer);
            SuppressionDecision decision = suppressionEngine.decide(fields, now);

            if (decision.isSuppressed()) {
                log.info("Alert suppressed: {}", decision.getReason());
                return DedupExitCode.SUPPRESS;
            }
            log.info("Alert allowed through deduplication filter");
            return DedupExitCode.ALLOW;

        } catch (MalformedAlertException e) {
            log.error("Could not parse alert content: {}", e.getMessage());
            return DedupExitCode.CANNOT_DECIDE;
        } catch (IOException e) {
            log.error("读取告警内容失败", e);
            return DedupExitCode.CANNOT_DECIDE;
        } catch (RuntimeException e) {
            log.error("Script execution failed", e);
            return DedupExitCode.CANNOT_DECIDE;
        }
    }

    private String readContent(String... args) throws IOException {
        if (args != null && args.length > 0) {
            return Files.readString(Paths.get(args[0]), StandardCharsets.UTF_8);
        }
        return new String(input.readAllBytes(), StandardCharsets.UTF_8);
    }
}

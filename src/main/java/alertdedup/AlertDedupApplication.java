package alertdedup;

import alertdedup.cli.DedupExitCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication
public class AlertDedupApplication {

    public static void main(String[] args) {
        System.exit(launch(args));
    }

    /**
     * 启动失败（配置错误等）时返回 CANNOT_DECIDE，不能让调用方当成抑制
     */
    static int launch(String... args) {
        try {
            return SpringApplication.exit(SpringApplication.run(AlertDedupApplication.class, args));
        } catch (RuntimeException e) {
            log.error("启动失败，无法判断告警: {}", e.getMessage());
            return DedupExitCode.CANNOT_DECIDE.getCode();
        }
    }

}

package alertdedup.cli;

/**
 * 进程退出码，调用方按非 0 跳过该告警
 */
public enum DedupExitCode {
    ALLOW(0),
    SUPPRESS(1),
    CANNOT_DECIDE(2);

    private final int code;

    DedupExitCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}

package alertdedup.dedup;

import lombok.Getter;

/**
 * 指纹已存在有效记录，插入被拒绝
 */
@Getter
public class FingerprintConflictException extends DedupException {
    private final String fingerprint;

    public FingerprintConflictException(String fingerprint) {
        super("Live cache record already exists: " + fingerprint);
        this.fingerprint = fingerprint;
    }
}

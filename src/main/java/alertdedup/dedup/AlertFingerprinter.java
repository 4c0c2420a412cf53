package alertdedup.dedup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * 告警指纹生成器 - 对语义字段做排序后的 JSON 序列化，再取 SHA-256
 */
public class AlertFingerprinter {

    public static final int SHORT_ID_LENGTH = 8;

    private final ObjectMapper objectMapper;

    public AlertFingerprinter() {
        this.objectMapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String fingerprint(AlertFields fields) {
        return fingerprint(fields.getService(), fields.getSeverity(),
                fields.getAlertType(), fields.getNormalizedMessage());
    }

    public String fingerprint(String service, String severity, String alertType, String normalizedMessage) {
        Map<String, String> keyFields = new HashMap<>();
        keyFields.put("service", StringUtils.defaultString(service));
        keyFields.put("severity", StringUtils.defaultString(severity));
        keyFields.put("message", StringUtils.defaultString(normalizedMessage));
        keyFields.put("alert_type", StringUtils.defaultString(alertType));

        return DigestUtils.sha256Hex(canonicalize(keyFields));
    }

    /**
     * 日志和判定原因里使用的短指纹
     */
    public static String shortId(String fingerprint) {
        return StringUtils.left(fingerprint, SHORT_ID_LENGTH);
    }

    private String canonicalize(Map<String, String> keyFields) {
        try {
            return objectMapper.writeValueAsString(keyFields);
        } catch (JsonProcessingException e) {
            throw new DedupException("生成告警指纹失败", e);
        }
    }
}

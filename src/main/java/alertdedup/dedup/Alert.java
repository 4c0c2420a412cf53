package alertdedup.dedup;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.Map;

/**
 * 解析后的原始告警
 */
@Value
@Builder
public class Alert {
    String service;
    String severity;
    String type;
    String message;
    Map<String, Object> attributes;   // 解析出的全部字段，仅用于审计

    public String getService() {
        return StringUtils.defaultString(service);
    }

    public String getSeverity() {
        return StringUtils.defaultString(severity);
    }

    public String getType() {
        return StringUtils.defaultString(type);
    }

    public String getMessage() {
        return StringUtils.defaultString(message);
    }

    public Map<String, Object> getAttributes() {
        return attributes == null ? Collections.emptyMap() : Collections.unmodifiableMap(attributes);
    }
}

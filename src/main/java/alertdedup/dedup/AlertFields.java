package alertdedup.dedup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.apache.commons.lang3.StringUtils;

/**
 * 告警的语义标识字段，计算指纹时只使用 service/severity/alertType/normalizedMessage
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertFields {
    @Builder.Default
    String service = "";
    @Builder.Default
    String severity = "";
    @Builder.Default
    String alertType = "";
    @Builder.Default
    String normalizedMessage = "";
    @Builder.Default
    String rawMessage = "";   // 原始消息，不参与指纹

    /**
     * 从原始告警提取字段，消息经过规范化
     */
    public static AlertFields from(Alert alert, AlertNormalizer normalizer) {
        return AlertFields.builder()
                .service(alert.getService())
                .severity(alert.getSeverity())
                .alertType(alert.getType())
                .normalizedMessage(normalizer.normalize(alert.getMessage()))
                .rawMessage(alert.getMessage())
                .build();
    }

    public String getService() {
        return StringUtils.defaultString(service);
    }

    public String getSeverity() {
        return StringUtils.defaultString(severity);
    }

    public String getAlertType() {
        return StringUtils.defaultString(alertType);
    }

    public String getNormalizedMessage() {
        return StringUtils.defaultString(normalizedMessage);
    }

    public String getRawMessage() {
        return StringUtils.defaultString(rawMessage);
    }
}

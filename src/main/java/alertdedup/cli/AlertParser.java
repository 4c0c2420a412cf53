package alertdedup.cli;

import alertdedup.dedup.Alert;
import alertdedup.dedup.MalformedAlertException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 告警内容解析 - 优先按 JSON 解析，否则从文本中提取字段
 */
public class AlertParser {

    private static final List<String> KEY_FIELDS = List.of("service", "severity", "type", "message");
    private static final List<String> TYPE_KEYWORDS = List.of("cpu", "memory", "disk", "network");
    private static final String DEFAULT_TYPE = "general";

    private static final Pattern SERVICE = Pattern.compile("service[:\\s]+([^\\n\\r]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEVERITY = Pattern.compile("severity[:\\s]+(\\w+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEVERITY_WORD = Pattern.compile("\\b(critical|high|medium|low)\\b", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public Alert parse(String content) {
        if (StringUtils.isBlank(content)) {
            throw new MalformedAlertException("No input content provided");
        }

        String trimmed = content.trim();
        JsonNode node = readJson(trimmed);
        if (node == null) {
            return parseText(trimmed);
        }
        if (!node.isObject()) {
            throw new MalformedAlertException("Alert JSON must be an object, got " + node.getNodeType());
        }
        return parseJson(node);
    }

    private JsonNode readJson(String content) {
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private Alert parseJson(JsonNode node) {
        if (KEY_FIELDS.stream().noneMatch(node::hasNonNull)) {
            throw new MalformedAlertException("Alert JSON has none of the fields " + KEY_FIELDS);
        }

        Map<String, Object> attributes = objectMapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {});
        return Alert.builder()
                .service(text(node, "service"))
                .severity(text(node, "severity"))
                .type(text(node, "type"))
                .message(text(node, "message"))
                .attributes(attributes)
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return "";
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private Alert parseText(String content) {
        Map<String, Object> attributes = new LinkedHashMap<>();

        String service = "";
        Matcher serviceMatcher = SERVICE.matcher(content);
        if (serviceMatcher.find()) {
            service = serviceMatcher.group(1).trim();
            attributes.put("service", service);
        }

        String severity = "";
        Matcher severityMatcher = SEVERITY.matcher(content);
        if (severityMatcher.find()) {
            severity = severityMatcher.group(1).trim();
        } else {
            Matcher wordMatcher = SEVERITY_WORD.matcher(content);
            if (wordMatcher.find()) {
                severity = wordMatcher.group(1);
            }
        }
        if (!severity.isEmpty()) {
            attributes.put("severity", severity);
        }

        String lower = content.toLowerCase(Locale.ROOT);
        String type = TYPE_KEYWORDS.stream()
                .filter(lower::contains)
                .findFirst()
                .orElse(DEFAULT_TYPE);

        attributes.put("message", content);
        attributes.put("type", type);

        return Alert.builder()
                .service(service)
                .severity(severity)
                .type(type)
                .message(content)
                .attributes(attributes)
                .build();
    }
}

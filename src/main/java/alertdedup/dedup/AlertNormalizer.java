package alertdedup.dedup;

import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 告警消息规范化 - 去掉时间、百分比、大小、耗时、IP 等随时变化的内容
 */
public class AlertNormalizer {

    // 顺序不可调整：日期时间必须先于单独的时间被替换
    private static final List<Replacement> REPLACEMENTS = List.of(
            new Replacement(unicode("\\d{4}-\\d{2}-\\d{2}[T\\s]\\d{2}:\\d{2}:\\d{2}"), "[TIMESTAMP]"),
            new Replacement(unicode("\\d{2}:\\d{2}:\\d{2}"), "[TIME]"),
            new Replacement(unicode("\\b\\d+\\.\\d+%"), "[PERCENTAGE]"),
            new Replacement(unicode("\\b\\d+\\s*(MB|GB|KB|bytes?)"), "[SIZE]"),
            new Replacement(unicode("\\b\\d+\\s*ms"), "[DURATION]"),
            new Replacement(unicode("\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}(:\\d+)?\\b"), "[IP]")
    );

    private static final Pattern WHITESPACE = unicode("\\s+");

    public String normalize(String message) {
        if (StringUtils.isEmpty(message)) {
            return "";
        }

        String result = message;
        for (Replacement replacement : REPLACEMENTS) {
            result = replacement.pattern.matcher(result).replaceAll(replacement.placeholder);
        }

        result = WHITESPACE.matcher(result).replaceAll(" ").trim();
        return result.toLowerCase(Locale.ROOT);
    }

    private static Pattern unicode(String regex) {
        return Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS);
    }

    private static final class Replacement {
        private final Pattern pattern;
        private final String placeholder;

        private Replacement(Pattern pattern, String placeholder) {
            this.pattern = pattern;
            this.placeholder = placeholder;
        }
    }
}

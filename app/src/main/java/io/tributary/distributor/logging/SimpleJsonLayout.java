package io.tributary.distributor.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One JSON object per log line, used with {@code --log-format json}.
 *
 * <p>MDC entries such as {@code beam} and {@code total} are written as top-level fields so a
 * distribution pass can be filtered per beam. They never replace the fixed fields.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    @Override
    public String doLayout(ILoggingEvent event) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("timestamp", Instant.ofEpochMilli(event.getTimeStamp()).toString());
        fields.put("level", String.valueOf(event.getLevel()));
        fields.put("logger", event.getLoggerName());
        fields.put("thread", event.getThreadName());
        fields.put("message", event.getFormattedMessage());
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            fields.put("error", throwable.getClassName() + ": " + throwable.getMessage());
        }
        contextOf(event).forEach(fields::putIfAbsent);

        return fields.entrySet().stream()
                .map(field -> quote(field.getKey()) + ':' + quote(field.getValue()))
                .collect(Collectors.joining(",", "{", "}")) + System.lineSeparator();
    }

    // Events built outside a configured LoggerContext have no MDC adapter.
    private static Map<String, String> contextOf(ILoggingEvent event) {
        try {
            Map<String, String> mdc = event.getMDCPropertyMap();
            return mdc == null ? Map.of() : mdc;
        } catch (RuntimeException ex) {
            return Map.of();
        }
    }

    static String quote(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder json = new StringBuilder(value.length() + 2).append('"');
        value.chars().forEach(ch -> json.append(escape((char) ch)));
        return json.append('"').toString();
    }

    private static String escape(char ch) {
        switch (ch) {
            case '"':
                return "\\\"";
            case '\\':
                return "\\\\";
            case '\n':
                return "\\n";
            case '\r':
                return "\\r";
            case '\t':
                return "\\t";
            default:
                return ch < 0x20 ? String.format("\\u%04x", (int) ch) : String.valueOf(ch);
        }
    }
}

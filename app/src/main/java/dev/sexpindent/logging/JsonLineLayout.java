package dev.sexpindent.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Writes one JSON object per event. MDC entries become top-level fields unless they collide with
 * a standard field; an attached throwable is reported as {@code error} and {@code stackTrace}.
 */
public class JsonLineLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final Set<String> RESERVED = Set.of(
            "timestamp", "level", "logger", "thread", "message", "error", "stackTrace");

    @Override
    public String doLayout(ILoggingEvent event) {
        JsonObject json = new JsonObject();
        json.field("timestamp", TIMESTAMP.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        json.field("level", String.valueOf(event.getLevel()));
        json.field("logger", event.getLoggerName());
        json.field("thread", event.getThreadName());
        json.field("message", event.getFormattedMessage());

        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null) {
            new TreeMap<>(mdc).forEach((key, value) -> {
                if (!RESERVED.contains(key)) {
                    json.field(key, value);
                }
            });
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            json.field("error", throwable.getClassName() + ": " + throwable.getMessage());
            json.field("stackTrace", ThrowableProxyUtil.asString(throwable));
        }
        return json.close() + CoreConstants.LINE_SEPARATOR;
    }

    static String escape(String value) {
        StringBuilder escaped = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '"' -> escaped.append("\\\"");
                case '\\' -> escaped.append("\\\\");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        escaped.append(String.format("\\u%04x", (int) ch));
                    } else {
                        escaped.append(ch);
                    }
                }
            }
        }
        return escaped.toString();
    }

    private static final class JsonObject {
        private final StringBuilder builder = new StringBuilder(256).append('{');
        private boolean empty = true;

        void field(String name, String value) {
            if (!empty) {
                builder.append(',');
            }
            empty = false;
            builder.append('"').append(escape(name)).append("\":");
            if (value == null) {
                builder.append("null");
            } else {
                builder.append('"').append(escape(value)).append('"');
            }
        }

        String close() {
            return builder.append('}').toString();
        }
    }
}

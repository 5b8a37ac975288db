package dev.sexpindent.config;

import dev.sexpindent.indent.IndentRule;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration assembled from CLI arguments, environment values and defaults.
 */
public record IndentConfig(
        IndentOptions options,
        int bodyIndent,
        Map<String, IndentRule> ruleOverrides,
        LogFormat logFormat
) {

    public static final int DEFAULT_BODY_INDENT = 2;

    public IndentConfig {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(logFormat, "logFormat");
        if (bodyIndent < 0) {
            throw new ConfigurationException("bodyIndent must be zero or greater");
        }
        ruleOverrides = ruleOverrides == null ? Map.of() : Map.copyOf(ruleOverrides);
    }

    public static IndentConfig defaults() {
        return new IndentConfig(IndentOptions.defaults(), DEFAULT_BODY_INDENT, Map.of(), LogFormat.TEXT);
    }
}

package dev.sexpindent.config;

import dev.sexpindent.cli.CliArguments;
import dev.sexpindent.indent.IndentRule;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds an {@link IndentConfig} by combining CLI arguments with environment variables and defaults.
 * CLI values win over environment values; rule overrides from both sources are merged.
 */
public class ConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);

    static final String ENV_PLIST_HEURISTIC = "SEXP_INDENT_PLIST_HEURISTIC";
    static final String ENV_PLIST_MARKER = "SEXP_INDENT_PLIST_MARKER";
    static final String ENV_FIXED_OFFSET = "SEXP_INDENT_FIXED_OFFSET";
    static final String ENV_TAB_WIDTH = "SEXP_INDENT_TAB_WIDTH";
    static final String ENV_BODY_INDENT = "SEXP_INDENT_BODY_INDENT";
    static final String ENV_RULES = "SEXP_INDENT_RULES";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public IndentConfig load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        boolean plistHeuristic = Optional.ofNullable(arguments.plistHeuristic())
                .or(() -> env(ENV_PLIST_HEURISTIC).map(value -> parseBoolean(ENV_PLIST_HEURISTIC, value)))
                .orElse(true);

        char plistMarker = env(ENV_PLIST_MARKER)
                .map(ConfigLoader::parseMarker)
                .orElse(IndentOptions.DEFAULT_PLIST_MARKER);

        OptionalInt fixedOffset = resolveInteger(arguments.fixedOffset(), ENV_FIXED_OFFSET)
                .map(OptionalInt::of)
                .orElse(OptionalInt.empty());

        int tabWidth = resolveInteger(arguments.tabWidth(), ENV_TAB_WIDTH)
                .orElse(IndentOptions.DEFAULT_TAB_WIDTH);

        int bodyIndent = resolveInteger(arguments.bodyIndent(), ENV_BODY_INDENT)
                .orElse(IndentConfig.DEFAULT_BODY_INDENT);

        Map<String, IndentRule> ruleOverrides = new LinkedHashMap<>();
        env(ENV_RULES).ifPresent(raw -> parseRules(Arrays.asList(raw.split(",")), ruleOverrides));
        parseRules(arguments.rules(), ruleOverrides);

        LogFormat logFormat = Optional.ofNullable(arguments.logFormat())
                .or(() -> env(ENV_LOG_FORMAT).map(LogFormat::from))
                .orElse(LogFormat.TEXT);

        IndentOptions options = new IndentOptions(plistHeuristic, fixedOffset, plistMarker, tabWidth);
        IndentConfig config = new IndentConfig(options, bodyIndent, ruleOverrides, logFormat);
        LOGGER.debug("Loaded indentation config: {}", config);
        return config;
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    private Optional<Integer> resolveInteger(Integer cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return env(envKey).map(value -> parseInteger(envKey, value));
    }

    private static int parseInteger(String key, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new ConfigurationException(key + " must be an integer: " + raw, ex);
        }
    }

    private static boolean parseBoolean(String key, String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new ConfigurationException(key + " must be true or false: " + raw);
        };
    }

    private static char parseMarker(String raw) {
        if (raw.length() != 1) {
            throw new ConfigurationException(ENV_PLIST_MARKER + " must be a single character: " + raw);
        }
        return raw.charAt(0);
    }

    static void parseRules(List<String> entries, Map<String, IndentRule> target) {
        if (entries == null) {
            return;
        }
        for (String entry : entries) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int separator = trimmed.indexOf('=');
            if (separator <= 0 || separator == trimmed.length() - 1) {
                throw new ConfigurationException("Indent rule must look like name=spec: " + trimmed);
            }
            String operator = trimmed.substring(0, separator).trim();
            target.put(operator, IndentRule.parse(trimmed.substring(separator + 1)));
        }
    }
}

package dev.sexpindent.indent;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Loads operator rule tables written as {@code operator=defun} or {@code operator=N} properties.
 */
public final class IndentRules {

    static final String DEFAULT_RESOURCE = "/indent-rules.properties";

    private IndentRules() {
    }

    public static Map<String, IndentRule> defaults() {
        return Defaults.RULES;
    }

    public static Map<String, IndentRule> load(Reader reader) throws IOException {
        Properties properties = new Properties();
        properties.load(reader);
        Map<String, IndentRule> rules = new TreeMap<>();
        for (String operator : properties.stringPropertyNames()) {
            rules.put(operator, IndentRule.parse(properties.getProperty(operator)));
        }
        return Map.copyOf(rules);
    }

    private static final class Defaults {
        private static final Map<String, IndentRule> RULES = loadResource();

        private static Map<String, IndentRule> loadResource() {
            try (InputStream in = IndentRules.class.getResourceAsStream(DEFAULT_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Missing resource " + DEFAULT_RESOURCE);
                }
                return load(new InputStreamReader(in, StandardCharsets.UTF_8));
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to load " + DEFAULT_RESOURCE, ex);
            }
        }
    }
}

package dev.sexpindent.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads process environment variables, snapshotted at construction. Blank values count as unset.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    private final Map<String, String> variables;

    public SystemEnvironmentReader() {
        this(System.getenv());
    }

    SystemEnvironmentReader(Map<String, String> variables) {
        this.variables = Map.copyOf(Objects.requireNonNull(variables, "variables"));
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(variables.get(key)).filter(value -> !value.isBlank());
    }
}

package dev.sexpindent.highlight;

import dev.sexpindent.config.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Immutable symbol table backed by maps.
 */
public final class MapSymbolTable implements SymbolTable {

    static final String DEFAULT_RESOURCE = "/symbols.properties";
    private static final String ALIAS_PREFIX = "alias:";

    private final Map<String, SymbolCategory> categories;
    private final Map<String, String> aliases;

    private MapSymbolTable(Map<String, SymbolCategory> categories, Map<String, String> aliases) {
        this.categories = Map.copyOf(categories);
        this.aliases = Map.copyOf(aliases);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads entries of the form {@code name=category} or {@code name=alias:target}.
     */
    public static MapSymbolTable load(Reader reader) throws IOException {
        Properties properties = new Properties();
        properties.load(reader);
        Builder builder = builder();
        for (String name : properties.stringPropertyNames()) {
            String value = properties.getProperty(name).trim();
            if (value.startsWith(ALIAS_PREFIX)) {
                builder.alias(name, value.substring(ALIAS_PREFIX.length()).trim());
            } else {
                builder.define(name, SymbolCategory.from(value));
            }
        }
        return builder.build();
    }

    public static MapSymbolTable bundled() {
        try (InputStream in = MapSymbolTable.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + DEFAULT_RESOURCE);
            }
            return load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load " + DEFAULT_RESOURCE, ex);
        }
    }

    @Override
    public Optional<SymbolCategory> categoryOf(String name) {
        return Optional.ofNullable(categories.get(name));
    }

    @Override
    public Optional<String> aliasTarget(String name) {
        return Optional.ofNullable(aliases.get(name));
    }

    public static final class Builder {
        private final Map<String, SymbolCategory> categories = new HashMap<>();
        private final Map<String, String> aliases = new HashMap<>();

        private Builder() {
        }

        public Builder define(String name, SymbolCategory category) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(category, "category");
            if (aliases.containsKey(name)) {
                throw new ConfigurationException("Symbol " + name + " is already an alias");
            }
            categories.put(name, category);
            return this;
        }

        public Builder alias(String name, String target) {
            Objects.requireNonNull(name, "name");
            if (target == null || target.isBlank()) {
                throw new ConfigurationException("Alias target for " + name + " must not be blank");
            }
            if (categories.containsKey(name)) {
                throw new ConfigurationException("Symbol " + name + " is already defined");
            }
            aliases.put(name, target);
            return this;
        }

        public MapSymbolTable build() {
            return new MapSymbolTable(categories, aliases);
        }
    }
}

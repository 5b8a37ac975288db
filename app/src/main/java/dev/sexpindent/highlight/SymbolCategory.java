package dev.sexpindent.highlight;

import dev.sexpindent.config.ConfigurationException;
import java.util.Locale;

/**
 * What a symbol names, as far as highlighting is concerned.
 */
public enum SymbolCategory {
    UNBOUND,
    SPECIAL_VARIABLE,
    SPECIAL_FORM,
    MACRO,
    PRIMITIVE_FUNCTION,
    LIBRARY_FUNCTION;

    public boolean isFunction() {
        return this == PRIMITIVE_FUNCTION || this == LIBRARY_FUNCTION;
    }

    /**
     * Parses names such as {@code special-form} or {@code LIBRARY_FUNCTION}.
     */
    public static SymbolCategory from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Symbol category must be provided");
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (SymbolCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        throw new ConfigurationException("Unsupported symbol category: " + raw);
    }
}

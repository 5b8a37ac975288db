package dev.sexpindent.indent;

import dev.sexpindent.config.ConfigurationException;
import java.util.Locale;
import java.util.Objects;

/**
 * Alignment convention attached to an operator name.
 *
 * <ul>
 *   <li>{@code DEFUN}: the body is indented {@code bodyIndent} right of the opening delimiter.</li>
 *   <li>{@code DISTINGUISHED}: the first {@code distinguished} arguments are special and get double body
 *   indentation, the rest are body forms.</li>
 *   <li>{@code DELEGATE}: a custom resolver decides.</li>
 * </ul>
 */
public record IndentRule(Kind kind, int distinguished, OperatorIndentResolver delegate) {

    public enum Kind {
        DEFUN,
        DISTINGUISHED,
        DELEGATE
    }

    public IndentRule {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.DISTINGUISHED && distinguished < 0) {
            throw new ConfigurationException("distinguished argument count must be zero or greater");
        }
        if (kind == Kind.DELEGATE) {
            Objects.requireNonNull(delegate, "delegate");
        }
    }

    public static IndentRule defun() {
        return new IndentRule(Kind.DEFUN, 0, null);
    }

    public static IndentRule distinguished(int count) {
        return new IndentRule(Kind.DISTINGUISHED, count, null);
    }

    public static IndentRule delegate(OperatorIndentResolver resolver) {
        return new IndentRule(Kind.DELEGATE, 0, resolver);
    }

    /**
     * Parses {@code defun} or a non-negative argument count.
     */
    public static IndentRule parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new ConfigurationException("Indent rule must not be blank");
        }
        String normalized = spec.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("defun")) {
            return defun();
        }
        try {
            return distinguished(Integer.parseInt(normalized));
        } catch (NumberFormatException ex) {
            throw new ConfigurationException("Unsupported indent rule: " + spec, ex);
        }
    }
}

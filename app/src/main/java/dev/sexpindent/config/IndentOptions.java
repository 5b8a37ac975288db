package dev.sexpindent.config;

import dev.sexpindent.scan.SexpSyntax;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Caller-supplied options for a single indentation query.
 *
 * @param keywordPlistHeuristic align the first argument line under the head when the list starts with {@code plistMarker}
 * @param fixedOffset           when present, indent every line this many columns right of the containing delimiter
 * @param plistMarker           leading character of property-list keys
 * @param tabWidth              display width of a tab character
 */
public record IndentOptions(boolean keywordPlistHeuristic, OptionalInt fixedOffset, char plistMarker, int tabWidth) {

    public static final char DEFAULT_PLIST_MARKER = ':';
    public static final int DEFAULT_TAB_WIDTH = 8;

    public IndentOptions {
        fixedOffset = Objects.requireNonNullElse(fixedOffset, OptionalInt.empty());
        if (fixedOffset.isPresent() && fixedOffset.getAsInt() < 0) {
            throw new ConfigurationException("fixedOffset must be zero or greater");
        }
        if (tabWidth < 1) {
            throw new ConfigurationException("tabWidth must be at least 1");
        }
        if (SexpSyntax.terminatesAtom(plistMarker) || SexpSyntax.isPrefix(plistMarker)) {
            throw new ConfigurationException("plistMarker must be a symbol character: '" + plistMarker + "'");
        }
    }

    public static IndentOptions defaults() {
        return new IndentOptions(true, OptionalInt.empty(), DEFAULT_PLIST_MARKER, DEFAULT_TAB_WIDTH);
    }

    public IndentOptions withKeywordPlistHeuristic(boolean enabled) {
        return new IndentOptions(enabled, fixedOffset, plistMarker, tabWidth);
    }

    public IndentOptions withFixedOffset(int offset) {
        return new IndentOptions(keywordPlistHeuristic, OptionalInt.of(offset), plistMarker, tabWidth);
    }

    public IndentOptions withTabWidth(int width) {
        return new IndentOptions(keywordPlistHeuristic, fixedOffset, plistMarker, width);
    }
}

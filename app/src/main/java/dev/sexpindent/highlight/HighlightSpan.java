package dev.sexpindent.highlight;

import java.util.Objects;

/**
 * A classified range of text, {@code end} exclusive.
 */
public record HighlightSpan(int start, int end, SymbolCategory category) {

    public HighlightSpan {
        Objects.requireNonNull(category, "category");
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid highlight span " + start + ".." + end);
        }
    }
}

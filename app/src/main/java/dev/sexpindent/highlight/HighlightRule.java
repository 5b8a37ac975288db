package dev.sexpindent.highlight;

import java.util.List;

/**
 * Produces highlight spans for a range of text. Results are returned, never stored.
 */
@FunctionalInterface
public interface HighlightRule {

    List<HighlightSpan> apply(CharSequence text, int from, int to);
}

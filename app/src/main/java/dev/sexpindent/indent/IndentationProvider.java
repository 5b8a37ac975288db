package dev.sexpindent.indent;

import dev.sexpindent.config.IndentOptions;

/**
 * Computes the indentation column of the line containing {@code cursorOffset}.
 * Implementations must not throw on malformed text.
 */
@FunctionalInterface
public interface IndentationProvider {

    IndentResult computeIndent(CharSequence text, int cursorOffset, int topLevelStart, IndentOptions options);
}

package dev.sexpindent.indent;

/**
 * Which rule produced an {@link IndentResult}.
 */
public enum IndentDecision {
    /** Cursor inside a string literal; the line is left alone. */
    STRING,
    /** Cursor inside a comment; the line keeps its own indentation. */
    COMMENT,
    /** The text before the cursor could not be scanned. */
    SCAN_FAILURE,
    TOP_LEVEL,
    FIXED_OFFSET,
    /** Nothing complete follows the opening delimiter yet. */
    LIST_OPENED,
    OPERATOR,
    ARGUMENT,
    NESTED_HEAD,
    SIBLING,
    RESOLVER,
    PLIST
}

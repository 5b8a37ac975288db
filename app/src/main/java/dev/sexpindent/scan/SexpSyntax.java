package dev.sexpindent.scan;

/**
 * Character classes of the S-expression surface syntax.
 */
public final class SexpSyntax {

    public static final char STRING_DELIMITER = '"';
    public static final char LINE_COMMENT = ';';
    public static final char ESCAPE = '\\';

    private SexpSyntax() {
    }

    public static boolean isOpen(char ch) {
        return ch == '(' || ch == '[' || ch == '{';
    }

    public static boolean isClose(char ch) {
        return ch == ')' || ch == ']' || ch == '}';
    }

    public static boolean closes(char open, char close) {
        return switch (open) {
            case '(' -> close == ')';
            case '[' -> close == ']';
            case '{' -> close == '}';
            default -> false;
        };
    }

    /**
     * Reader prefixes that attach to the following expression: quote, quasiquote, unquote, splice and dispatch.
     */
    public static boolean isPrefix(char ch) {
        return ch == '\'' || ch == '`' || ch == ',' || ch == '@' || ch == '#';
    }

    public static boolean isQuoteSigil(char ch) {
        return ch == '\'' || ch == '`';
    }

    public static boolean isWhitespace(char ch) {
        return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r' || ch == '\f';
    }

    public static boolean isHorizontalSpace(char ch) {
        return ch == ' ' || ch == '\t';
    }

    public static boolean terminatesAtom(char ch) {
        return isWhitespace(ch) || isOpen(ch) || isClose(ch) || ch == STRING_DELIMITER || ch == LINE_COMMENT;
    }
}

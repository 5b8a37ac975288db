package dev.sexpindent.scan;

import java.util.Objects;

/**
 * Splits a bounded range of text into delimiter, atom and string tokens, skipping whitespace and comments.
 *
 * <p>Reader prefixes ({@code 'x}, {@code `(a)}, {@code #'f}) are folded into the token they precede:
 * {@link Token#prefixStart()} points at the first prefix character while {@link Token#start()} points at
 * the token proper. A string or block comment still open at the end of the range is reported as an
 * {@code UNTERMINATED_*} token instead of an error.</p>
 */
public final class SexpLexer {

    public enum Kind {
        OPEN,
        CLOSE,
        ATOM,
        STRING,
        UNTERMINATED_STRING,
        UNTERMINATED_COMMENT,
        END
    }

    public record Token(Kind kind, int prefixStart, int start, int end) {

        public boolean isExpressionStart() {
            return kind == Kind.OPEN || kind == Kind.ATOM || kind == Kind.STRING;
        }

        public boolean hasPrefix() {
            return prefixStart < start;
        }
    }

    private final CharSequence text;
    private final int limit;
    private int position;

    public SexpLexer(CharSequence text, int from, int limit) {
        this.text = Objects.requireNonNull(text, "text");
        if (from < 0 || limit < from || limit > text.length()) {
            throw new ScanException("Invalid range " + from + ".." + limit, from);
        }
        this.position = from;
        this.limit = limit;
    }

    public int position() {
        return position;
    }

    public Token next() {
        while (true) {
            Token skipped = skipWhitespaceAndComments();
            if (skipped != null) {
                return skipped;
            }
            if (position >= limit) {
                return new Token(Kind.END, limit, limit, limit);
            }
            int prefixStart = position;
            while (position < limit && SexpSyntax.isPrefix(text.charAt(position)) && !startsBlockComment(position)) {
                position++;
            }
            if (position >= limit || SexpSyntax.isWhitespace(text.charAt(position)) || startsComment(position)) {
                // dangling prefix characters; nothing to attach them to
                continue;
            }
            int start = position;
            char ch = text.charAt(position);
            if (SexpSyntax.isOpen(ch)) {
                position++;
                return new Token(Kind.OPEN, prefixStart, start, position);
            }
            if (SexpSyntax.isClose(ch)) {
                position++;
                return new Token(Kind.CLOSE, start, start, position);
            }
            if (ch == SexpSyntax.STRING_DELIMITER) {
                return readString(prefixStart, start);
            }
            return readAtom(prefixStart, start);
        }
    }

    private Token skipWhitespaceAndComments() {
        while (position < limit) {
            char ch = text.charAt(position);
            if (SexpSyntax.isWhitespace(ch)) {
                position++;
            } else if (ch == SexpSyntax.LINE_COMMENT) {
                int commentStart = position;
                while (position < limit && text.charAt(position) != '\n') {
                    position++;
                }
                if (position >= limit) {
                    return new Token(Kind.UNTERMINATED_COMMENT, commentStart, commentStart, limit);
                }
            } else if (startsBlockComment(position)) {
                int commentStart = position;
                if (!skipBlockComment()) {
                    return new Token(Kind.UNTERMINATED_COMMENT, commentStart, commentStart, limit);
                }
            } else {
                return null;
            }
        }
        return null;
    }

    private boolean skipBlockComment() {
        int nesting = 0;
        while (position < limit) {
            if (startsBlockComment(position)) {
                nesting++;
                position += 2;
            } else if (text.charAt(position) == '|' && position + 1 < limit && text.charAt(position + 1) == '#') {
                nesting--;
                position += 2;
                if (nesting == 0) {
                    return true;
                }
            } else {
                position++;
            }
        }
        return false;
    }

    private Token readString(int prefixStart, int start) {
        position++;
        while (position < limit) {
            char ch = text.charAt(position);
            if (ch == SexpSyntax.ESCAPE) {
                position += 2;
            } else if (ch == SexpSyntax.STRING_DELIMITER) {
                position++;
                return new Token(Kind.STRING, prefixStart, start, position);
            } else {
                position++;
            }
        }
        position = limit;
        return new Token(Kind.UNTERMINATED_STRING, prefixStart, start, limit);
    }

    private Token readAtom(int prefixStart, int start) {
        while (position < limit) {
            char ch = text.charAt(position);
            if (ch == SexpSyntax.ESCAPE) {
                position = Math.min(limit, position + 2);
            } else if (SexpSyntax.terminatesAtom(ch)) {
                break;
            } else {
                position++;
            }
        }
        return new Token(Kind.ATOM, prefixStart, start, position);
    }

    private boolean startsComment(int index) {
        return text.charAt(index) == SexpSyntax.LINE_COMMENT || startsBlockComment(index);
    }

    private boolean startsBlockComment(int index) {
        return text.charAt(index) == '#' && index + 1 < limit && text.charAt(index + 1) == '|';
    }
}

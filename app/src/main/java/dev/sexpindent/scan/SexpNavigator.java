package dev.sexpindent.scan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Expression-level movement over a piece of text. Every operation is bounded by an explicit limit.
 */
public final class SexpNavigator {

    private final CharSequence text;

    public SexpNavigator(CharSequence text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public SexpLexer.Token tokenAt(int from, int limit) {
        return new SexpLexer(text, from, limit).next();
    }

    /**
     * Start, including reader prefixes, of the next expression in {@code [from, limit)},
     * or {@code -1} when a closing delimiter or the limit comes first.
     */
    public int nextExpressionStart(int from, int limit) {
        SexpLexer.Token token = tokenAt(from, limit);
        return token.isExpressionStart() ? token.prefixStart() : -1;
    }

    /**
     * Offset just past the expression that begins at or after {@code from}.
     *
     * @throws ScanException if no complete, balanced expression ends before {@code limit}
     */
    public int forwardExpression(int from, int limit) {
        SexpLexer lexer = new SexpLexer(text, from, limit);
        SexpLexer.Token first = lexer.next();
        switch (first.kind()) {
            case ATOM, STRING -> {
                return first.end();
            }
            case OPEN -> {
                Deque<Character> open = new ArrayDeque<>();
                open.push(text.charAt(first.start()));
                while (true) {
                    SexpLexer.Token token = lexer.next();
                    switch (token.kind()) {
                        case OPEN -> open.push(text.charAt(token.start()));
                        case CLOSE -> {
                            char close = text.charAt(token.start());
                            if (!SexpSyntax.closes(open.pop(), close)) {
                                throw new ScanException("Mismatched closing delimiter '" + close + "'", token.start());
                            }
                            if (open.isEmpty()) {
                                return token.end();
                            }
                        }
                        case ATOM, STRING -> {
                        }
                        default -> throw new ScanException("Unterminated expression", first.start());
                    }
                }
            }
            default -> throw new ScanException("No expression starts here", from);
        }
    }

    /**
     * Starts of the complete expressions directly inside the list opened at {@code open}, in order,
     * stopping at {@code limit}.
     */
    public List<Integer> childStarts(int open, int limit) {
        List<Integer> starts = new ArrayList<>();
        int position = open + 1;
        while (position < limit) {
            SexpLexer.Token token = tokenAt(position, limit);
            if (!token.isExpressionStart()) {
                break;
            }
            int end = forwardExpression(token.prefixStart(), limit);
            if (token.kind() == SexpLexer.Kind.ATOM && end >= limit) {
                break;
            }
            starts.add(token.prefixStart());
            position = end;
        }
        return starts;
    }

    /**
     * First expression on the line beginning at {@code lineStart} that sits at the level of the
     * expression at {@code limit}. Closers on that line that belong to deeper lists reset the search.
     * Returns {@code limit} when nothing precedes it on the line.
     */
    public int firstExpressionOnLine(int lineStart, int limit) {
        SexpLexer lexer = new SexpLexer(text, lineStart, limit);
        int depth = 0;
        int candidate = -1;
        while (true) {
            SexpLexer.Token token = lexer.next();
            switch (token.kind()) {
                case OPEN -> {
                    if (depth == 0 && candidate < 0) {
                        candidate = token.prefixStart();
                    }
                    depth++;
                }
                case CLOSE -> {
                    depth--;
                    if (depth < 0) {
                        depth = 0;
                        candidate = -1;
                    }
                }
                case ATOM, STRING -> {
                    if (depth == 0 && candidate < 0) {
                        candidate = token.prefixStart();
                    }
                }
                default -> {
                    return candidate >= 0 ? candidate : limit;
                }
            }
        }
    }
}

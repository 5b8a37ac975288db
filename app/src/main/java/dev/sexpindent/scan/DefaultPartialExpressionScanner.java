package dev.sexpindent.scan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Single forward pass over the range, tracking one frame per unclosed delimiter.
 */
public class DefaultPartialExpressionScanner implements PartialExpressionScanner {

    @Override
    public ParseState scan(CharSequence text, int from, int to) {
        Objects.requireNonNull(text, "text");
        SexpLexer lexer = new SexpLexer(text, from, to);
        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(Frame.topLevel());

        while (true) {
            SexpLexer.Token token = lexer.next();
            switch (token.kind()) {
                case END -> {
                    return snapshot(frames, from, to, false, false);
                }
                case UNTERMINATED_STRING -> {
                    return snapshot(frames, from, to, true, false);
                }
                case UNTERMINATED_COMMENT -> {
                    return snapshot(frames, from, to, false, true);
                }
                case OPEN -> frames.push(new Frame(token.start(), token.prefixStart(), text.charAt(token.start())));
                case CLOSE -> {
                    char close = text.charAt(token.start());
                    if (frames.size() == 1) {
                        throw new ScanException("Unbalanced closing delimiter '" + close + "'", token.start());
                    }
                    Frame closed = frames.pop();
                    if (!SexpSyntax.closes(closed.delimiter, close)) {
                        throw new ScanException("Closing delimiter '" + close + "' does not match '"
                                + closed.delimiter + "' at " + closed.open, token.start());
                    }
                    frames.peek().lastExpr = closed.prefixStart;
                }
                case STRING -> frames.peek().lastExpr = token.prefixStart();
                case ATOM -> {
                    // an atom running into the end of the range is not known to be complete yet
                    if (token.end() < to) {
                        frames.peek().lastExpr = token.prefixStart();
                    }
                }
            }
        }
    }

    private ParseState snapshot(Deque<Frame> frames, int from, int to, boolean inString, boolean inComment) {
        List<Integer> enclosing = new ArrayList<>();
        for (Iterator<Frame> it = frames.descendingIterator(); it.hasNext(); ) {
            Frame frame = it.next();
            if (frame.open >= 0) {
                enclosing.add(frame.open);
            }
        }
        Frame innermost = frames.peek();
        OptionalInt containing = innermost.open >= 0 ? OptionalInt.of(innermost.open) : OptionalInt.empty();
        OptionalInt lastExpr = innermost.lastExpr >= 0 ? OptionalInt.of(innermost.lastExpr) : OptionalInt.empty();
        return new ParseState(from, to, enclosing.size(), containing, lastExpr, inString, inComment, enclosing);
    }

    private static final class Frame {
        private final int open;
        private final int prefixStart;
        private final char delimiter;
        private int lastExpr = -1;

        private Frame(int open, int prefixStart, char delimiter) {
            this.open = open;
            this.prefixStart = prefixStart;
            this.delimiter = delimiter;
        }

        private static Frame topLevel() {
            return new Frame(-1, -1, '\0');
        }
    }
}

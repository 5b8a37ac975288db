package dev.sexpindent.scan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Snapshot of the partial parse between a top-level form start and the cursor.
 *
 * @param start          offset the scan started from
 * @param point          offset the scan stopped at (the cursor line start)
 * @param depth          number of unclosed opening delimiters at {@code point}
 * @param containing     innermost unclosed opening delimiter, empty at top level
 * @param lastExpr       start, including reader prefixes, of the last complete expression inside {@code containing}
 * @param inString       whether {@code point} lies inside a string literal
 * @param inComment      whether {@code point} lies inside a comment
 * @param enclosingStack every unclosed opening delimiter, outermost first
 */
public record ParseState(
        int start,
        int point,
        int depth,
        OptionalInt containing,
        OptionalInt lastExpr,
        boolean inString,
        boolean inComment,
        List<Integer> enclosingStack
) {

    public ParseState {
        Objects.requireNonNull(containing, "containing");
        Objects.requireNonNull(lastExpr, "lastExpr");
        enclosingStack = List.copyOf(Objects.requireNonNull(enclosingStack, "enclosingStack"));
        if (start < 0 || point < start) {
            throw new IllegalArgumentException("Invalid scan range " + start + ".." + point);
        }
        if (depth != enclosingStack.size()) {
            throw new IllegalArgumentException("depth " + depth + " does not match enclosing stack " + enclosingStack);
        }
        if (containing.isPresent() != (depth > 0)) {
            throw new IllegalArgumentException("containing must be present exactly when depth > 0");
        }
        if (containing.isPresent() && enclosingStack.get(depth - 1) != containing.getAsInt()) {
            throw new IllegalArgumentException("containing must be the innermost enclosing delimiter");
        }
        if (lastExpr.isPresent()) {
            int floor = containing.isPresent() ? containing.getAsInt() : start - 1;
            if (lastExpr.getAsInt() <= floor || lastExpr.getAsInt() >= point) {
                throw new IllegalArgumentException("lastExpr " + lastExpr.getAsInt() + " outside " + floor + ".." + point);
            }
        }
    }

    public boolean atTopLevel() {
        return depth == 0;
    }

    /**
     * Enclosing delimiters other than {@link #containing()}, innermost first.
     */
    public List<Integer> ancestors() {
        if (enclosingStack.size() < 2) {
            return List.of();
        }
        List<Integer> outer = new ArrayList<>(enclosingStack.subList(0, enclosingStack.size() - 1));
        Collections.reverse(outer);
        return List.copyOf(outer);
    }
}

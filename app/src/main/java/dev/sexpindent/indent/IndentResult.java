package dev.sexpindent.indent;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A target column for one line, or the instruction to leave the line as it is.
 */
public record IndentResult(IndentDecision decision, OptionalInt column) {

    public IndentResult {
        Objects.requireNonNull(decision, "decision");
        Objects.requireNonNull(column, "column");
        if (column.isPresent() && column.getAsInt() < 0) {
            throw new IllegalArgumentException("column must not be negative: " + column.getAsInt());
        }
    }

    public static IndentResult column(IndentDecision decision, int column) {
        return new IndentResult(decision, OptionalInt.of(column));
    }

    public static IndentResult unchanged(IndentDecision decision) {
        return new IndentResult(decision, OptionalInt.empty());
    }

    public boolean isUnchanged() {
        return column.isEmpty();
    }

    public int columnOr(int fallback) {
        return column.orElse(fallback);
    }

    @Override
    public String toString() {
        return isUnchanged() ? "unchanged (" + decision + ")" : column.getAsInt() + " (" + decision + ")";
    }
}

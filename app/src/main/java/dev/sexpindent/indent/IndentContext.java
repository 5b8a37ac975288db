package dev.sexpindent.indent;

import dev.sexpindent.config.IndentOptions;
import dev.sexpindent.scan.ParseState;
import dev.sexpindent.scan.TextPositions;
import java.util.Objects;

/**
 * What a resolver sees: the text, the line being indented, its parse state and the column the engine
 * would use on its own ({@code normalIndent}).
 */
public record IndentContext(
        CharSequence text,
        int point,
        ParseState state,
        String operator,
        int normalIndent,
        IndentOptions options
) {

    public IndentContext {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(options, "options");
        if (state.containing().isEmpty() || state.lastExpr().isEmpty()) {
            throw new IllegalArgumentException("resolvers are only consulted inside a list with a complete expression");
        }
    }

    public int containing() {
        return state.containing().getAsInt();
    }

    public int lastExpr() {
        return state.lastExpr().getAsInt();
    }

    public int column(int position) {
        return TextPositions.column(text, position, options.tabWidth());
    }
}

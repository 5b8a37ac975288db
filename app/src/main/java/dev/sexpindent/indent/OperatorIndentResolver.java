package dev.sexpindent.indent;

import java.util.OptionalInt;

/**
 * Per-operator alignment rule. An empty result means "no opinion"; the engine then applies its defaults.
 */
@FunctionalInterface
public interface OperatorIndentResolver {

    OptionalInt resolve(String operator, IndentContext context);

    static OperatorIndentResolver none() {
        return (operator, context) -> OptionalInt.empty();
    }
}

package dev.sexpindent.highlight;

import java.util.Optional;

/**
 * Read-only view of the symbols known to the language environment.
 */
public interface SymbolTable {

    /**
     * Category of a symbol defined directly under {@code name}.
     */
    Optional<SymbolCategory> categoryOf(String name);

    /**
     * The symbol {@code name} is an alias of, if any.
     */
    Optional<String> aliasTarget(String name);
}

package dev.sexpindent.highlight;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies symbol names, following alias chains until a definition is found.
 * A chain that revisits a name or ends at an undefined name classifies as {@link SymbolCategory#UNBOUND}.
 */
public class SymbolClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(SymbolClassifier.class);

    private final SymbolTable table;

    public SymbolClassifier(SymbolTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public SymbolCategory classify(String name) {
        Objects.requireNonNull(name, "name");
        Set<String> visited = new LinkedHashSet<>();
        String current = name;
        while (visited.add(current)) {
            Optional<SymbolCategory> category = table.categoryOf(current);
            if (category.isPresent()) {
                return category.get();
            }
            Optional<String> target = table.aliasTarget(current);
            if (target.isEmpty()) {
                return SymbolCategory.UNBOUND;
            }
            current = target.get();
        }
        LOGGER.debug("Alias cycle while classifying '{}': {}", name, visited);
        return SymbolCategory.UNBOUND;
    }
}

package dev.sexpindent.indent;

import dev.sexpindent.config.ConfigurationException;
import dev.sexpindent.scan.SexpNavigator;
import dev.sexpindent.scan.TextPositions;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Table-driven resolver: looks up the operator's {@link IndentRule} and applies it.
 * Operators without a rule whose name starts with {@code def} are treated as {@code defun}.
 */
public class IndentRuleResolver implements OperatorIndentResolver {

    private static final String DEFINER_PREFIX = "def";

    private final Map<String, IndentRule> rules;
    private final int bodyIndent;

    public IndentRuleResolver(Map<String, IndentRule> rules, int bodyIndent) {
        this.rules = Map.copyOf(Objects.requireNonNull(rules, "rules"));
        if (bodyIndent < 0) {
            throw new ConfigurationException("bodyIndent must be zero or greater");
        }
        this.bodyIndent = bodyIndent;
    }

    /**
     * Bundled rules with {@code overrides} applied on top.
     */
    public static IndentRuleResolver withDefaults(int bodyIndent, Map<String, IndentRule> overrides) {
        Map<String, IndentRule> merged = new HashMap<>(IndentRules.defaults());
        merged.putAll(overrides);
        return new IndentRuleResolver(merged, bodyIndent);
    }

    public Optional<IndentRule> ruleFor(String operator) {
        IndentRule rule = rules.get(operator);
        if (rule != null) {
            return Optional.of(rule);
        }
        if (operator.length() > DEFINER_PREFIX.length() && operator.startsWith(DEFINER_PREFIX)) {
            return Optional.of(IndentRule.defun());
        }
        return Optional.empty();
    }

    @Override
    public OptionalInt resolve(String operator, IndentContext context) {
        Optional<IndentRule> rule = ruleFor(operator);
        if (rule.isEmpty()) {
            return OptionalInt.empty();
        }
        return switch (rule.get().kind()) {
            case DEFUN -> defunIndent(context);
            case DISTINGUISHED -> distinguishedIndent(rule.get().distinguished(), context);
            case DELEGATE -> rule.get().delegate().resolve(operator, context);
        };
    }

    // Only while the whole header is still on the opening line; later lines follow their siblings.
    private OptionalInt defunIndent(IndentContext context) {
        if (TextPositions.sameLine(context.text(), context.containing(), context.lastExpr())) {
            return OptionalInt.of(context.column(context.containing()) + bodyIndent);
        }
        return OptionalInt.empty();
    }

    private OptionalInt distinguishedIndent(int distinguished, IndentContext context) {
        SexpNavigator navigator = new SexpNavigator(context.text());
        int point = context.point();
        int containingColumn = context.column(context.containing());
        int bodyColumn = containingColumn + bodyIndent;

        int present = 0;
        int afterOperator = navigator.forwardExpression(context.containing() + 1, point);
        int position = navigator.nextExpressionStart(afterOperator, point);
        while (position >= 0) {
            present++;
            position = navigator.nextExpressionStart(navigator.forwardExpression(position, point), point);
        }

        if (present < distinguished) {
            return OptionalInt.of(present <= 1 ? containingColumn + 2 * bodyIndent : context.normalIndent());
        }
        if (present == distinguished && (distinguished == 0 || bodyColumn <= context.normalIndent())) {
            return OptionalInt.of(bodyColumn);
        }
        return OptionalInt.of(context.normalIndent());
    }
}

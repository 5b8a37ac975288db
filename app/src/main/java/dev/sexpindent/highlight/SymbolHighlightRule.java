package dev.sexpindent.highlight;

import dev.sexpindent.scan.SexpLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Highlights every unprefixed symbol the classifier knows about. Strings, comments, numbers and
 * keywords are skipped.
 */
public class SymbolHighlightRule implements HighlightRule {

    private final SymbolClassifier classifier;

    public SymbolHighlightRule(SymbolClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    @Override
    public List<HighlightSpan> apply(CharSequence text, int from, int to) {
        SexpLexer lexer = new SexpLexer(text, from, to);
        List<HighlightSpan> spans = new ArrayList<>();
        for (SexpLexer.Token token = lexer.next(); token.kind() != SexpLexer.Kind.END; token = lexer.next()) {
            if (token.kind() == SexpLexer.Kind.UNTERMINATED_STRING || token.kind() == SexpLexer.Kind.UNTERMINATED_COMMENT) {
                break;
            }
            if (token.kind() != SexpLexer.Kind.ATOM || token.hasPrefix()) {
                continue;
            }
            String name = text.subSequence(token.start(), token.end()).toString();
            if (!isSymbolName(name)) {
                continue;
            }
            SymbolCategory category = classifier.classify(name);
            if (category != SymbolCategory.UNBOUND) {
                spans.add(new HighlightSpan(token.start(), token.end(), category));
            }
        }
        return spans;
    }

    private static boolean isSymbolName(String name) {
        char first = name.charAt(0);
        if (first == ':' || first == '?') {
            return false;
        }
        try {
            Double.parseDouble(name);
            return false;
        } catch (NumberFormatException ex) {
            return true;
        }
    }
}

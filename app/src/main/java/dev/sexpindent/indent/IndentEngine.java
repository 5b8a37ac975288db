package dev.sexpindent.indent;

import dev.sexpindent.config.IndentOptions;
import dev.sexpindent.scan.DefaultPartialExpressionScanner;
import dev.sexpindent.scan.ParseState;
import dev.sexpindent.scan.PartialExpressionScanner;
import dev.sexpindent.scan.ScanException;
import dev.sexpindent.scan.SexpLexer;
import dev.sexpindent.scan.SexpNavigator;
import dev.sexpindent.scan.SexpSyntax;
import dev.sexpindent.scan.TextPositions;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides the indentation column of a line from the syntax between the enclosing top-level form and
 * the line start.
 *
 * <p>Inside a list the line is aligned under one earlier expression (the anchor):</p>
 * <ul>
 *   <li>under a nested list heading the list,</li>
 *   <li>under the operator when the list is data (quoted, a keyword plist, or a single element so far),</li>
 *   <li>under the first argument on the first argument line of a call,</li>
 *   <li>otherwise under the first expression on the line of the last complete sibling.</li>
 * </ul>
 * <p>A per-operator resolver may override the anchor, and a line starting with a plist key aligns with
 * the earliest key of the run of key/value pairs above it.</p>
 *
 * <p>The engine never throws for malformed text; unscannable input yields an unchanged result.</p>
 */
public class IndentEngine implements IndentationProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndentEngine.class);
    private static final Pattern QUOTE_FORM = Pattern.compile("(?:back)?quote[\\t\\n\\f ]+\\(");

    private final PartialExpressionScanner scanner;
    private final OperatorIndentResolver resolver;

    public IndentEngine() {
        this(new DefaultPartialExpressionScanner(), OperatorIndentResolver.none());
    }

    public IndentEngine(PartialExpressionScanner scanner, OperatorIndentResolver resolver) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    @Override
    public IndentResult computeIndent(CharSequence text, int cursorOffset, int topLevelStart, IndentOptions options) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(options, "options");
        if (cursorOffset < 0 || cursorOffset > text.length()) {
            LOGGER.debug("Cursor offset {} outside text of length {}", cursorOffset, text.length());
            return IndentResult.unchanged(IndentDecision.SCAN_FAILURE);
        }
        int point = TextPositions.lineStart(text, cursorOffset);
        if (topLevelStart < 0 || topLevelStart > point) {
            LOGGER.debug("Top-level start {} is not before line start {}", topLevelStart, point);
            return IndentResult.unchanged(IndentDecision.SCAN_FAILURE);
        }
        try {
            ParseState state = scanner.scan(text, topLevelStart, point);
            return decide(text, point, topLevelStart, state, options);
        } catch (ScanException ex) {
            LOGGER.debug("Leaving line at {} unchanged: {} (position {})", point, ex.getMessage(), ex.getPosition());
            return IndentResult.unchanged(IndentDecision.SCAN_FAILURE);
        }
    }

    private IndentResult decide(CharSequence text, int point, int topLevelStart, ParseState state, IndentOptions options) {
        int tabWidth = options.tabWidth();
        if (state.inString()) {
            return IndentResult.unchanged(IndentDecision.STRING);
        }
        if (state.inComment()) {
            return IndentResult.column(IndentDecision.COMMENT, TextPositions.currentIndentation(text, point, tabWidth));
        }
        if (state.atTopLevel()) {
            return IndentResult.column(IndentDecision.TOP_LEVEL, TextPositions.column(text, topLevelStart, tabWidth));
        }

        int containing = state.containing().getAsInt();
        int containingColumn = TextPositions.column(text, containing, tabWidth);
        if (options.fixedOffset().isPresent()) {
            return IndentResult.column(IndentDecision.FIXED_OFFSET, containingColumn + options.fixedOffset().getAsInt());
        }
        if (state.lastExpr().isEmpty()) {
            return IndentResult.column(IndentDecision.LIST_OPENED, containingColumn + 1);
        }

        int lastExpr = state.lastExpr().getAsInt();
        SexpNavigator navigator = new SexpNavigator(text);
        int first = navigator.nextExpressionStart(containing + 1, point);
        if (first < 0) {
            throw new ScanException("List has no first element", containing);
        }
        IndentResult anchor = anchor(text, point, state, first, lastExpr, options, navigator);

        Optional<String> operator = operatorSymbol(text, first, point, navigator);
        if (operator.isPresent()) {
            IndentContext context = new IndentContext(text, point, state, operator.get(), anchor.columnOr(0), options);
            OptionalInt custom = consultResolver(operator.get(), context);
            if (custom.isPresent()) {
                return IndentResult.column(IndentDecision.RESOLVER, custom.getAsInt());
            }
        }

        OptionalInt plist = plistKeyColumn(text, point, containing, options, navigator);
        if (plist.isPresent()) {
            return IndentResult.column(IndentDecision.PLIST, plist.getAsInt());
        }
        return anchor;
    }

    private IndentResult anchor(CharSequence text, int point, ParseState state, int first, int lastExpr,
                                IndentOptions options, SexpNavigator navigator) {
        int tabWidth = options.tabWidth();
        if (SexpSyntax.isOpen(text.charAt(first))) {
            return IndentResult.column(IndentDecision.NESTED_HEAD, TextPositions.column(text, first, tabWidth));
        }
        if (TextPositions.sameLine(text, first, lastExpr)) {
            if (first == lastExpr || startsPlist(text, state.containing().getAsInt(), options) || isQuoted(text, state)) {
                return IndentResult.column(IndentDecision.OPERATOR, TextPositions.column(text, first, tabWidth));
            }
            int second = navigator.nextExpressionStart(navigator.forwardExpression(first, point), point);
            int target = second < 0 ? lastExpr : second;
            return IndentResult.column(IndentDecision.ARGUMENT, TextPositions.column(text, target, tabWidth));
        }
        int sibling = navigator.firstExpressionOnLine(TextPositions.lineStart(text, lastExpr), lastExpr);
        return IndentResult.column(IndentDecision.SIBLING, TextPositions.column(text, sibling, tabWidth));
    }

    private static boolean startsPlist(CharSequence text, int containing, IndentOptions options) {
        return options.keywordPlistHeuristic()
                && containing + 1 < text.length()
                && text.charAt(containing + 1) == options.plistMarker();
    }

    /**
     * A list is data when its own delimiter or any enclosing one carries a quote sigil, or when an
     * enclosing list is an explicit {@code (quote (...))} or {@code (backquote (...))} form.
     */
    private static boolean isQuoted(CharSequence text, ParseState state) {
        if (precededBySigil(text, state.containing().getAsInt())) {
            return true;
        }
        for (int ancestor : state.ancestors()) {
            if (precededBySigil(text, ancestor)
                    || QUOTE_FORM.matcher(text).region(ancestor + 1, text.length()).lookingAt()) {
                return true;
            }
        }
        return false;
    }

    private static boolean precededBySigil(CharSequence text, int position) {
        return position > 0 && SexpSyntax.isQuoteSigil(text.charAt(position - 1));
    }

    private static Optional<String> operatorSymbol(CharSequence text, int first, int point, SexpNavigator navigator) {
        SexpLexer.Token head = navigator.tokenAt(first, point);
        if (head.kind() != SexpLexer.Kind.ATOM || head.hasPrefix()) {
            return Optional.empty();
        }
        return Optional.of(text.subSequence(head.start(), head.end()).toString());
    }

    private OptionalInt consultResolver(String operator, IndentContext context) {
        try {
            OptionalInt column = resolver.resolve(operator, context);
            if (column == null) {
                LOGGER.warn("Indent resolver returned null for '{}'; using default alignment", operator);
                return OptionalInt.empty();
            }
            if (column.isPresent() && column.getAsInt() < 0) {
                LOGGER.warn("Indent resolver returned invalid column {} for '{}'; using default alignment",
                        column.getAsInt(), operator);
                return OptionalInt.empty();
            }
            return column;
        } catch (RuntimeException ex) {
            LOGGER.warn("Indent resolver failed for '{}': {}", operator, ex.getMessage(), ex);
            return OptionalInt.empty();
        }
    }

    /**
     * When the line starts with a plist key, walks back from the last sibling over key/value pairs
     * (a trailing bare key counts as a pair on its own) and returns the column of the earliest key reached,
     * unless that key is the list's first element.
     */
    private static OptionalInt plistKeyColumn(CharSequence text, int point, int containing, IndentOptions options,
                                              SexpNavigator navigator) {
        int lineContent = TextPositions.skipHorizontalSpace(text, point);
        char marker = options.plistMarker();
        if (lineContent >= text.length() || text.charAt(lineContent) != marker) {
            return OptionalInt.empty();
        }
        List<Integer> siblings = navigator.childStarts(containing, point);
        int index = siblings.size() - 1;
        int earliest = -1;
        if (index >= 0 && isKey(text, siblings.get(index), marker)) {
            earliest = index;
            index--;
        }
        while (index >= 1 && isKey(text, siblings.get(index - 1), marker) && !isKey(text, siblings.get(index), marker)) {
            earliest = index - 1;
            index -= 2;
        }
        if (earliest > 0) {
            return OptionalInt.of(TextPositions.column(text, siblings.get(earliest), options.tabWidth()));
        }
        return OptionalInt.empty();
    }

    private static boolean isKey(CharSequence text, int position, char marker) {
        return text.charAt(position) == marker;
    }
}

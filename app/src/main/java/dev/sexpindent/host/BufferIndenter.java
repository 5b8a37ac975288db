package dev.sexpindent.host;

import dev.sexpindent.config.IndentOptions;
import dev.sexpindent.indent.IndentResult;
import dev.sexpindent.scan.SexpSyntax;
import dev.sexpindent.scan.TextPositions;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-indents lines of a buffer with the host's active indentation provider. Only leading
 * whitespace is rewritten; the new indentation is made of spaces.
 */
public class BufferIndenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(BufferIndenter.class);

    private final LanguageModeHost host;
    private final IndentOptions options;

    public BufferIndenter(LanguageModeHost host, IndentOptions options) {
        this.host = Objects.requireNonNull(host, "host");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Start of the nearest line before {@code lineStart} that begins with an opening delimiter in
     * column zero, or 0 when there is none.
     */
    public static int topLevelStart(CharSequence text, int lineStart) {
        int candidate = TextPositions.lineStart(text, lineStart);
        while (candidate > 0) {
            candidate = TextPositions.lineStart(text, candidate - 1);
            if (candidate < text.length() && SexpSyntax.isOpen(text.charAt(candidate))) {
                return candidate;
            }
        }
        return 0;
    }

    /**
     * Computes the indentation of the line containing {@code offset} without modifying the buffer.
     */
    public IndentResult computeLine(CharSequence text, int offset) {
        int lineStart = TextPositions.lineStart(text, offset);
        return host.activeIndentationProvider()
                .computeIndent(text, lineStart, topLevelStart(text, lineStart), options);
    }

    /**
     * Re-indents the line containing {@code offset}.
     *
     * @return the provider's result; the buffer is untouched when it is unchanged
     */
    public IndentResult indentLine(StringBuilder buffer, int offset) {
        Objects.requireNonNull(buffer, "buffer");
        int lineStart = TextPositions.lineStart(buffer, offset);
        IndentResult result = computeLine(buffer, lineStart);
        result.column().ifPresent(column -> replaceIndentation(buffer, lineStart, column));
        return result;
    }

    /**
     * Re-indents every non-blank line that starts in {@code [from, to)}.
     *
     * @return number of lines whose text changed
     */
    public int indentRegion(StringBuilder buffer, int from, int to) {
        Objects.requireNonNull(buffer, "buffer");
        if (from < 0 || to > buffer.length() || from > to) {
            throw new IllegalArgumentException("Invalid region " + from + ".." + to);
        }
        int changed = 0;
        int lineStart = TextPositions.lineStart(buffer, from);
        int end = to;
        do {
            int contentStart = TextPositions.skipHorizontalSpace(buffer, lineStart);
            boolean blank = contentStart >= buffer.length() || buffer.charAt(contentStart) == '\n';
            if (!blank) {
                int before = buffer.length();
                String original = lineText(buffer, lineStart);
                indentLine(buffer, lineStart);
                end += buffer.length() - before;
                if (!original.equals(lineText(buffer, lineStart))) {
                    changed++;
                }
            }
            int next = TextPositions.nextLineStart(buffer, lineStart);
            if (next >= buffer.length()) {
                break;
            }
            lineStart = next;
        } while (lineStart < end);
        LOGGER.debug("Re-indented region {}..{}: {} line(s) changed", from, to, changed);
        return changed;
    }

    private static void replaceIndentation(StringBuilder buffer, int lineStart, int column) {
        int contentStart = TextPositions.skipHorizontalSpace(buffer, lineStart);
        String indentation = " ".repeat(column);
        if (!indentation.contentEquals(buffer.subSequence(lineStart, contentStart))) {
            buffer.replace(lineStart, contentStart, indentation);
        }
    }

    private static String lineText(CharSequence text, int lineStart) {
        return text.subSequence(lineStart, TextPositions.nextLineStart(text, lineStart)).toString();
    }
}

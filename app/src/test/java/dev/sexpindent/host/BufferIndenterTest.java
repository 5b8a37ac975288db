package dev.sexpindent.host;

import static org.assertj.core.api.Assertions.assertThat;

import dev.sexpindent.config.IndentOptions;
import dev.sexpindent.indent.IndentDecision;
import dev.sexpindent.indent.IndentEngine;
import dev.sexpindent.indent.IndentResult;
import dev.sexpindent.indent.IndentRuleResolver;
import dev.sexpindent.scan.DefaultPartialExpressionScanner;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BufferIndenterTest {

    private final LanguageModeHost host = new LanguageModeHost(new IndentEngine(
            new DefaultPartialExpressionScanner(), IndentRuleResolver.withDefaults(2, Map.of())));
    private final BufferIndenter indenter = new BufferIndenter(host, IndentOptions.defaults());

    @Test
    void reindentsRegionLineByLine() {
        StringBuilder buffer = new StringBuilder("(defun f (x)\n(let ((y 1))\n(+ x\ny)))\n");

        int changed = indenter.indentRegion(buffer, 0, buffer.length());

        assertThat(buffer.toString()).isEqualTo("(defun f (x)\n  (let ((y 1))\n    (+ x\n       y)))\n");
        assertThat(changed).isEqualTo(3);
    }

    @Test
    void reindentingIndentedBufferChangesNothing() {
        String indented = "(defun f (x)\n  (let ((y 1))\n    (+ x\n       y)))\n\n(foo bar\n     baz)\n";
        StringBuilder buffer = new StringBuilder(indented);

        int changed = indenter.indentRegion(buffer, 0, buffer.length());

        assertThat(changed).isZero();
        assertThat(buffer.toString()).isEqualTo(indented);
    }

    @Test
    void replacesTabsWithSpaces() {
        StringBuilder buffer = new StringBuilder("(foo bar\n\tbaz)");

        IndentResult result = indenter.indentLine(buffer, 10);

        assertThat(result).isEqualTo(IndentResult.column(IndentDecision.ARGUMENT, 5));
        assertThat(buffer.toString()).isEqualTo("(foo bar\n     baz)");
    }

    @Test
    void leavesStringContinuationAndBlankLinesAlone() {
        StringBuilder buffer = new StringBuilder("(foo \"a\n  b\"\n\n bar)");

        indenter.indentRegion(buffer, 0, buffer.length());

        assertThat(buffer.toString()).isEqualTo("(foo \"a\n  b\"\n\n     bar)");
    }

    @Test
    void topLevelStartIsPreviousColumnZeroOpener() {
        String text = "(a)\n(b\nc\n  (d";

        assertThat(BufferIndenter.topLevelStart(text, 7)).isEqualTo(4);
        assertThat(BufferIndenter.topLevelStart(text, 9)).isEqualTo(4);
        assertThat(BufferIndenter.topLevelStart(text, 4)).isZero();
        assertThat(BufferIndenter.topLevelStart(text, 0)).isZero();
    }

    @Test
    void usesActiveProvider() {
        host.installIndentationProvider((text, cursorOffset, topLevelStart, options) ->
                IndentResult.column(IndentDecision.RESOLVER, 1));
        StringBuilder buffer = new StringBuilder("(a\nb)");

        indenter.indentLine(buffer, 3);

        assertThat(buffer.toString()).isEqualTo("(a\n b)");
    }
}

package dev.sexpindent.scan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import org.junit.jupiter.api.Test;

class DefaultPartialExpressionScannerTest {

    private final DefaultPartialExpressionScanner scanner = new DefaultPartialExpressionScanner();

    @Test
    void tracksLastCompleteExpressionInsideContainingList() {
        String text = "(a (b c) \"s\"\n";

        ParseState state = scanner.scan(text, 0, text.length());

        assertThat(state.depth()).isEqualTo(1);
        assertThat(state.containing()).hasValue(0);
        assertThat(state.lastExpr()).hasValue(9);
        assertThat(state.inString()).isFalse();
        assertThat(state.inComment()).isFalse();
    }

    @Test
    void recordsEnclosingStackOutermostFirst() {
        String text = "(a (b\n";

        ParseState state = scanner.scan(text, 0, text.length());

        assertThat(state.enclosingStack()).containsExactly(0, 3);
        assertThat(state.containing()).hasValue(3);
        assertThat(state.lastExpr()).hasValue(4);
        assertThat(state.ancestors()).containsExactly(0);
    }

    @Test
    void lastExpressionIncludesReaderPrefix() {
        String text = "(a 'b\n";

        ParseState state = scanner.scan(text, 0, text.length());

        assertThat(state.lastExpr()).hasValue(3);
    }

    @Test
    void atomTouchingTheLimitIsNotComplete() {
        ParseState state = scanner.scan("(ab", 0, 3);

        assertThat(state.lastExpr()).isEmpty();
    }

    @Test
    void closedListBecomesLastExpressionOfItsParent() {
        String text = "(x '(y z)\n";

        ParseState state = scanner.scan(text, 0, text.length());

        assertThat(state.depth()).isEqualTo(1);
        assertThat(state.lastExpr()).hasValue(3);
    }

    @Test
    void reportsOpenString() {
        String text = "(a \"bc\n";

        ParseState state = scanner.scan(text, 0, text.length());

        assertThat(state.inString()).isTrue();
    }

    @Test
    void reportsOpenBlockComment() {
        String text = "(a #| note\n";

        ParseState state = scanner.scan(text, 0, text.length());

        assertThat(state.inComment()).isTrue();
        assertThat(state.inString()).isFalse();
    }

    @Test
    void ignoresDelimitersInsideCommentsAndStrings() {
        String text = "(a ; (((\n \")\" #| ) |#\n";

        ParseState state = scanner.scan(text, 0, text.length());

        assertThat(state.depth()).isEqualTo(1);
        assertThat(state.lastExpr()).hasValue(10);
    }

    @Test
    void completeTopLevelFormLeavesDepthZero() {
        String text = "(a b)\n";

        ParseState state = scanner.scan(text, 0, text.length());

        assertThat(state.atTopLevel()).isTrue();
        assertThat(state.containing()).isEmpty();
        assertThat(state.lastExpr()).hasValue(0);
    }

    @Test
    void rejectsMismatchedCloser() {
        Throwable thrown = catchThrowable(() -> scanner.scan("(a [b)", 0, 6));

        assertThat(thrown).isInstanceOf(ScanException.class)
                .hasMessageContaining("does not match");
        assertThat(((ScanException) thrown).getPosition()).isEqualTo(5);
    }

    @Test
    void rejectsStrayCloser() {
        Throwable thrown = catchThrowable(() -> scanner.scan(")\n(a", 0, 4));

        assertThat(thrown).isInstanceOf(ScanException.class)
                .hasMessageContaining("Unbalanced");
    }
}

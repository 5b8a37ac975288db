package dev.sexpindent.host;

import static org.assertj.core.api.Assertions.assertThat;

import dev.sexpindent.highlight.HighlightSpan;
import dev.sexpindent.highlight.SymbolCategory;
import dev.sexpindent.indent.IndentDecision;
import dev.sexpindent.indent.IndentResult;
import dev.sexpindent.indent.IndentationProvider;
import java.util.List;
import org.junit.jupiter.api.Test;

class LanguageModeHostTest {

    private final IndentationProvider fallback = fixed(0);
    private final LanguageModeHost host = new LanguageModeHost(fallback);

    @Test
    void defaultProviderIsActiveInitially() {
        assertThat(host.activeIndentationProvider()).isSameAs(fallback);
    }

    @Test
    void mostRecentLiveProviderIsActive() {
        IndentationProvider first = fixed(1);
        IndentationProvider second = fixed(2);

        Registration firstRegistration = host.installIndentationProvider(first);
        Registration secondRegistration = host.installIndentationProvider(second);
        assertThat(host.activeIndentationProvider()).isSameAs(second);

        secondRegistration.close();
        assertThat(host.activeIndentationProvider()).isSameAs(first);

        firstRegistration.close();
        assertThat(host.activeIndentationProvider()).isSameAs(fallback);
    }

    @Test
    void closingAnOlderRegistrationKeepsNewerActive() {
        IndentationProvider first = fixed(1);
        IndentationProvider second = fixed(2);
        Registration firstRegistration = host.installIndentationProvider(first);
        host.installIndentationProvider(second);

        firstRegistration.close();

        assertThat(host.activeIndentationProvider()).isSameAs(second);
        assertThat(firstRegistration.isActive()).isFalse();
    }

    @Test
    void closeIsIdempotent() {
        Registration registration = host.installIndentationProvider(fixed(1));
        Registration other = host.installIndentationProvider(fixed(2));
        other.close();

        registration.close();
        registration.close();

        assertThat(registration.isActive()).isFalse();
        assertThat(host.activeIndentationProvider()).isSameAs(fallback);
    }

    @Test
    void highlightMergesRulesInOffsetOrder() {
        host.addHighlightRule((text, from, to) -> List.of(new HighlightSpan(4, 6, SymbolCategory.MACRO)));
        Registration late = host.addHighlightRule(
                (text, from, to) -> List.of(new HighlightSpan(0, 2, SymbolCategory.SPECIAL_FORM)));

        assertThat(host.highlight("abcdefg"))
                .extracting(HighlightSpan::start)
                .containsExactly(0, 4);

        late.close();

        assertThat(host.highlight("abcdefg"))
                .extracting(HighlightSpan::start)
                .containsExactly(4);
        assertThat(host.highlightRuleCount()).isEqualTo(1);
    }

    private static IndentationProvider fixed(int column) {
        return (text, cursorOffset, topLevelStart, options) -> IndentResult.column(IndentDecision.RESOLVER, column);
    }
}

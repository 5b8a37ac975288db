package dev.sexpindent.host;

import static org.assertj.core.api.Assertions.assertThat;

import dev.sexpindent.highlight.HighlightRule;
import dev.sexpindent.indent.IndentEngine;
import dev.sexpindent.indent.IndentationProvider;
import java.util.List;
import org.junit.jupiter.api.Test;

class ModeActivationTest {

    private final IndentationProvider fallback = new IndentEngine();
    private final IndentationProvider engine = new IndentEngine();
    private final HighlightRule rule = (text, from, to) -> List.of();
    private final LanguageModeHost host = new LanguageModeHost(fallback);
    private final ModeActivation activation = new ModeActivation(host, engine, rule);

    @Test
    void enablingInstallsProviderAndRule() {
        activation.setEnabled(true);

        assertThat(activation.isEnabled()).isTrue();
        assertThat(host.activeIndentationProvider()).isSameAs(engine);
        assertThat(host.highlightRuleCount()).isEqualTo(1);
    }

    @Test
    void enablingTwiceDoesNotDuplicateRegistrations() {
        activation.setEnabled(true);
        activation.setEnabled(true);

        assertThat(host.highlightRuleCount()).isEqualTo(1);
        activation.revokeIndentation();
        assertThat(host.activeIndentationProvider()).isSameAs(fallback);
    }

    @Test
    void registrationsAreRevokedIndependently() {
        activation.setEnabled(true);

        activation.revokeIndentation();

        assertThat(host.activeIndentationProvider()).isSameAs(fallback);
        assertThat(host.highlightRuleCount()).isEqualTo(1);
        assertThat(activation.isIndentationActive()).isFalse();
        assertThat(activation.isHighlightingActive()).isTrue();
        assertThat(activation.isEnabled()).isTrue();

        activation.revokeHighlighting();

        assertThat(host.highlightRuleCount()).isZero();
        assertThat(activation.isEnabled()).isFalse();
    }

    @Test
    void disablingWithdrawsBoth() {
        activation.setEnabled(true);

        activation.setEnabled(false);

        assertThat(host.activeIndentationProvider()).isSameAs(fallback);
        assertThat(host.highlightRuleCount()).isZero();
        assertThat(activation.isEnabled()).isFalse();
    }

    @Test
    void reEnablingRestoresOnlyRevokedPart() {
        activation.setEnabled(true);
        activation.revokeHighlighting();

        activation.setEnabled(true);

        assertThat(host.activeIndentationProvider()).isSameAs(engine);
        assertThat(host.highlightRuleCount()).isEqualTo(1);
    }
}

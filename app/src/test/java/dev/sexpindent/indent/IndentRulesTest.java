package dev.sexpindent.indent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.sexpindent.config.ConfigurationException;
import java.io.StringReader;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IndentRulesTest {

    @Test
    void bundledTableCoversCoreForms() {
        Map<String, IndentRule> rules = IndentRules.defaults();

        assertThat(rules)
                .containsEntry("let", IndentRule.distinguished(1))
                .containsEntry("if", IndentRule.distinguished(2))
                .containsEntry("progn", IndentRule.distinguished(0))
                .containsEntry("lambda", IndentRule.defun());
    }

    @Test
    void loadsRulesFromProperties() throws Exception {
        Map<String, IndentRule> rules = IndentRules.load(new StringReader("foo = defun\nbar=3\n# comment\n"));

        assertThat(rules).containsOnly(
                Map.entry("foo", IndentRule.defun()),
                Map.entry("bar", IndentRule.distinguished(3)));
    }

    @Test
    void parseRejectsUnknownRule() {
        assertThatThrownBy(() -> IndentRule.parse("sometimes"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("sometimes");
        assertThatThrownBy(() -> IndentRule.parse("-1"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> IndentRules.load(new StringReader("foo=maybe")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void parseAcceptsCaseAndWhitespace() {
        assertThat(IndentRule.parse(" DEFUN ")).isEqualTo(IndentRule.defun());
        assertThat(IndentRule.parse("2")).isEqualTo(IndentRule.distinguished(2));
    }
}

package dev.sexpindent.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import dev.sexpindent.cli.CliArguments;
import dev.sexpindent.indent.IndentRule;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--plist-heuristic", "false",
                "--fixed-offset", "3",
                "--tab-width", "4",
                "--body-indent", "3",
                "--rule", "my-when=1",
                "--rule", "my-def=defun",
                "--log-format", "json");

        IndentConfig config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.options().keywordPlistHeuristic()).isFalse();
        assertThat(config.options().fixedOffset()).hasValue(3);
        assertThat(config.options().tabWidth()).isEqualTo(4);
        assertThat(config.options().plistMarker()).isEqualTo(':');
        assertThat(config.bodyIndent()).isEqualTo(3);
        assertThat(config.ruleOverrides())
                .containsEntry("my-when", IndentRule.distinguished(1))
                .containsEntry("my-def", IndentRule.defun());
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void usesDefaultsWhenNothingIsConfigured() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        IndentConfig config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config).isEqualTo(IndentConfig.defaults());
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_PLIST_HEURISTIC, "off");
        envValues.put(ConfigLoader.ENV_PLIST_MARKER, "&");
        envValues.put(ConfigLoader.ENV_FIXED_OFFSET, "1");
        envValues.put(ConfigLoader.ENV_TAB_WIDTH, "2");
        envValues.put(ConfigLoader.ENV_BODY_INDENT, "4");
        envValues.put(ConfigLoader.ENV_RULES, "foo=2, bar=defun,");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        IndentConfig config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments);

        assertThat(config.options().keywordPlistHeuristic()).isFalse();
        assertThat(config.options().plistMarker()).isEqualTo('&');
        assertThat(config.options().fixedOffset()).hasValue(1);
        assertThat(config.options().tabWidth()).isEqualTo(2);
        assertThat(config.bodyIndent()).isEqualTo(4);
        assertThat(config.ruleOverrides()).containsOnlyKeys("foo", "bar");
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void cliValuesOverrideEnvironment() {
        Map<String, String> envValues = Map.of(
                ConfigLoader.ENV_TAB_WIDTH, "2",
                ConfigLoader.ENV_RULES, "foo=2,bar=1",
                ConfigLoader.ENV_PLIST_HEURISTIC, "false");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--tab-width", "6",
                "--rule", "foo=0",
                "--plist-heuristic", "true");

        IndentConfig config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments);

        assertThat(config.options().tabWidth()).isEqualTo(6);
        assertThat(config.options().keywordPlistHeuristic()).isTrue();
        assertThat(config.ruleOverrides())
                .containsEntry("foo", IndentRule.distinguished(0))
                .containsEntry("bar", IndentRule.distinguished(1));
    }

    @Test
    void rejectsNonNumericEnvironmentValue() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());
        ConfigLoader loader = new ConfigLoader(key -> ConfigLoader.ENV_TAB_WIDTH.equals(key)
                ? Optional.of("wide")
                : Optional.empty());

        Throwable thrown = catchThrowable(() -> loader.load(cliArguments));

        assertThat(thrown).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining(ConfigLoader.ENV_TAB_WIDTH);
    }

    @Test
    void rejectsMalformedRule() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--rule", "when");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("name=spec");
    }

    @Test
    void rejectsInvalidOptionValues() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--tab-width", "0");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void rejectsMultiCharacterMarker() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());
        ConfigLoader loader = new ConfigLoader(key -> ConfigLoader.ENV_PLIST_MARKER.equals(key)
                ? Optional.of("::")
                : Optional.empty());

        assertThat(catchThrowable(() -> loader.load(cliArguments)))
                .isInstanceOf(ConfigurationException.class);
    }
}

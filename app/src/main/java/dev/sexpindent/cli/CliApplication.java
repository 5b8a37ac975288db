package dev.sexpindent.cli;

import dev.sexpindent.config.ConfigLoader;
import dev.sexpindent.config.ConfigurationException;
import dev.sexpindent.config.IndentConfig;
import dev.sexpindent.config.SystemEnvironmentReader;
import dev.sexpindent.highlight.MapSymbolTable;
import dev.sexpindent.highlight.SymbolClassifier;
import dev.sexpindent.highlight.SymbolHighlightRule;
import dev.sexpindent.host.BufferIndenter;
import dev.sexpindent.host.LanguageModeHost;
import dev.sexpindent.host.ModeActivation;
import dev.sexpindent.indent.IndentEngine;
import dev.sexpindent.indent.IndentResult;
import dev.sexpindent.indent.IndentRuleResolver;
import dev.sexpindent.logging.LoggingConfigurator;
import dev.sexpindent.scan.DefaultPartialExpressionScanner;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point: reads a source buffer and reports or applies indentation.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    static final int EXIT_FAILURE = 1;
    static final String STDIN_SOURCE = "<stdin>";

    private final ConfigLoader configLoader;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), System.in, System.out, System.err);
    }

    CliApplication(ConfigLoader configLoader, InputStream in, PrintStream out, PrintStream err) {
        this.configLoader = configLoader;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            commandLine.getErr().flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            commandLine.getOut().flush();
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            commandLine.getOut().flush();
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        IndentConfig config;
        try {
            config = configLoader.load(cliArguments);
        } catch (ConfigurationException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.getErr().flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());

        String source = cliArguments.file() == null ? STDIN_SOURCE : cliArguments.file().toString();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("source", source)) {
            String text = readSource(cliArguments);
            BufferIndenter indenter = new BufferIndenter(activateMode(config), config.options());
            if (cliArguments.lines().isEmpty()) {
                StringBuilder buffer = new StringBuilder(text);
                int changed = indenter.indentRegion(buffer, 0, buffer.length());
                LOGGER.info("Re-indented {} line(s)", changed);
                out.print(buffer);
                out.flush();
                return 0;
            }
            return reportLines(indenter, text, cliArguments.lines(), cliArguments.explain());
        } catch (IOException ex) {
            LOGGER.error("Failed to read {}", source, ex);
            err.println("Failed to read " + source + ": " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private LanguageModeHost activateMode(IndentConfig config) {
        IndentEngine engine = new IndentEngine(new DefaultPartialExpressionScanner(),
                IndentRuleResolver.withDefaults(config.bodyIndent(), config.ruleOverrides()));
        LanguageModeHost host = new LanguageModeHost(new IndentEngine());
        SymbolHighlightRule highlightRule = new SymbolHighlightRule(new SymbolClassifier(MapSymbolTable.bundled()));
        new ModeActivation(host, engine, highlightRule).setEnabled(true);
        return host;
    }

    private int reportLines(BufferIndenter indenter, String text, List<Integer> lines, boolean explain) {
        List<Integer> lineStarts = lineStarts(text);
        for (Integer line : lines) {
            if (line < 1 || line > lineStarts.size()) {
                err.println("Line " + line + " is outside the input (1.." + lineStarts.size() + ")");
                return EXIT_FAILURE;
            }
        }
        for (Integer line : lines) {
            IndentResult result = indenter.computeLine(text, lineStarts.get(line - 1));
            StringBuilder row = new StringBuilder().append(line).append('\t');
            if (result.isUnchanged()) {
                row.append("unchanged");
            } else {
                row.append(result.column().getAsInt());
            }
            if (explain) {
                row.append('\t').append(result.decision());
            }
            out.println(row);
        }
        out.flush();
        return 0;
    }

    private String readSource(CliArguments arguments) throws IOException {
        if (arguments.file() != null) {
            return Files.readString(arguments.file(), StandardCharsets.UTF_8);
        }
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    static List<Integer> lineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts;
    }
}

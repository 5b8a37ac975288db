package dev.sexpindent.cli;

import dev.sexpindent.config.LogFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "sexp-indent", mixinStandardHelpOptions = true, version = "sexp-indent 0.1.0",
        description = "Computes indentation for S-expression source lines")
public class CliArguments {

    @CommandLine.Option(names = "--file", description = "Source file to read (default: standard input)", paramLabel = "PATH")
    private Path file;

    @CommandLine.Option(names = "--line", description = "1-based line to report; may be repeated", paramLabel = "N")
    private List<Integer> lines = new ArrayList<>();

    @CommandLine.Option(names = "--explain", description = "Append the decision that produced each column")
    private boolean explain;

    @CommandLine.Option(names = "--plist-heuristic", arity = "1", description = "Align keyword-led lists as data: true or false", paramLabel = "BOOL")
    private Boolean plistHeuristic;

    @CommandLine.Option(names = "--fixed-offset", description = "Indent every line this far past its open delimiter", paramLabel = "COLUMNS")
    private Integer fixedOffset;

    @CommandLine.Option(names = "--tab-width", description = "Display width of a tab character", paramLabel = "COLUMNS")
    private Integer tabWidth;

    @CommandLine.Option(names = "--body-indent", description = "Extra indentation of body forms", paramLabel = "COLUMNS")
    private Integer bodyIndent;

    @CommandLine.Option(names = "--rule", description = "Per-operator rule such as when=1 or my-defmacro=defun; may be repeated", paramLabel = "NAME=SPEC")
    private List<String> rules = new ArrayList<>();

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path file() {
        return file;
    }

    public List<Integer> lines() {
        return lines;
    }

    public boolean explain() {
        return explain;
    }

    public Boolean plistHeuristic() {
        return plistHeuristic;
    }

    public Integer fixedOffset() {
        return fixedOffset;
    }

    public Integer tabWidth() {
        return tabWidth;
    }

    public Integer bodyIndent() {
        return bodyIndent;
    }

    public List<String> rules() {
        return rules;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}

package dev.sexpindent.cli;

import dev.sexpindent.config.LogFormat;
import picocli.CommandLine;

/**
 * Parses the {@code --log-format} option.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
    @Override
    public LogFormat convert(String value) {
        return LogFormat.from(value);
    }
}

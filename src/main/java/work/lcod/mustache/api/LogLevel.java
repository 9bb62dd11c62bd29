package work.lcod.mustache.api;

import java.util.Locale;

/**
 * Diagnostic thresholds for renders and the CLI.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return FATAL;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public boolean allows(LogLevel level) {
        return level.ordinal() >= ordinal();
    }
}

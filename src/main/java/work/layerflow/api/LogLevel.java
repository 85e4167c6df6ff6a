package work.layerflow.api;

import java.util.Locale;

/**
 * Log thresholds accepted on the command line; {@code FATAL} is treated as {@code ERROR}.
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
            return INFO;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }
}

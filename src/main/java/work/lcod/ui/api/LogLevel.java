package work.lcod.ui.api;

import java.util.Locale;

/**
 * Log thresholds understood by the compiler, mapped onto the SLF4J simple logger levels.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /** Value for the {@code org.slf4j.simpleLogger.defaultLogLevel} property. */
    public String simpleLoggerName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package work.bindlang.api;

import java.util.Locale;

/**
 * Log thresholds understood by the slf4j-simple binding.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    static final String SIMPLE_LOGGER_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

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

    /**
     * Sets the default threshold; only effective before the first logger is created.
     */
    public void apply() {
        System.setProperty(SIMPLE_LOGGER_PROPERTY, name().toLowerCase(Locale.ROOT));
    }
}

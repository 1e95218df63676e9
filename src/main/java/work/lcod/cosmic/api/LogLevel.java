package work.lcod.cosmic.api;

import java.util.Locale;

/**
 * Log thresholds accepted on the command line, mapped onto the SLF4J simple binding.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    static final String SIMPLE_LOGGER_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

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
     * Sets the default level of the simple logger. Only effective before the first logger is created.
     */
    public void apply() {
        System.setProperty(SIMPLE_LOGGER_LEVEL_PROPERTY, name().toLowerCase(Locale.ROOT));
    }
}

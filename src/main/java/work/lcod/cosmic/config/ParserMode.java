package work.lcod.cosmic.config;

import java.util.Locale;

/**
 * Which YAML parser to use for measurement files.
 */
public enum ParserMode {
    /** Jackson YAML when it is on the classpath, the built-in parser otherwise. */
    AUTO,
    BUILTIN,
    JACKSON;

    public static ParserMode from(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return ParserMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported parser mode: " + value + " (expected auto, builtin or jackson)");
        }
    }
}

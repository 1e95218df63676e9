package work.lcod.cosmic.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The four COSMIC data movement kinds.
 */
public enum DataMovementType {
    ENTRY("E"),
    EXIT("X"),
    READ("R"),
    WRITE("W");

    private final String code;

    DataMovementType(String code) {
        this.code = code;
    }

    /**
     * Single-letter code used in configuration files and reports.
     */
    public String code() {
        return code;
    }

    /**
     * Accepts the code ({@code E}, {@code X}, {@code R}, {@code W}) or the full name, ignoring case.
     */
    public static DataMovementType from(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        for (var type : values()) {
            if (type.code.equals(normalized) || type.name().equals(normalized)) {
                return type;
            }
        }
        String valid = Arrays.stream(values()).map(DataMovementType::code).collect(Collectors.joining(", "));
        throw new IllegalArgumentException(
            "Unsupported data movement type '" + value + "'. Expected one of: " + valid + "."
        );
    }
}

package work.lcod.cosmic.config.yaml;

import work.lcod.cosmic.config.ConfigParseException;

/**
 * Structural violation found by the built-in YAML parser (mixed block kinds, tab indentation, stray dedent).
 */
public final class YamlStructureException extends ConfigParseException {
    private final int lineNumber;

    public YamlStructureException(String message, int lineNumber) {
        super(message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }

    /**
     * 1-based line of the source text where the violation was detected.
     */
    public int lineNumber() {
        return lineNumber;
    }
}

package work.lcod.cosmic.config.yaml;

import java.util.Objects;

/**
 * A significant source line: its 1-based position, its indentation in spaces and the text after the indentation.
 */
public record LineRecord(int lineNumber, int indent, String content) {
    public LineRecord {
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative: " + indent);
        }
        Objects.requireNonNull(content, "content");
    }
}

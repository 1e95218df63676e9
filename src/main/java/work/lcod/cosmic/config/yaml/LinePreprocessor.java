package work.lcod.cosmic.config.yaml;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits configuration text into {@link LineRecord}s, dropping blank lines and full-line {@code #} comments.
 */
public final class LinePreprocessor {
    private LinePreprocessor() {}

    public static List<LineRecord> preprocess(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        var records = new ArrayList<LineRecord>();
        String[] lines = text.split("\r\n|\r|\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].stripTrailing();
            if (line.isEmpty() || line.stripLeading().startsWith("#")) {
                continue;
            }
            int lineNumber = i + 1;
            if (hasTabInIndentation(line)) {
                throw new YamlStructureException("Tab characters are not supported for indentation", lineNumber);
            }
            int indent = countLeadingSpaces(line);
            records.add(new LineRecord(lineNumber, indent, line.substring(indent)));
        }
        return List.copyOf(records);
    }

    private static int countLeadingSpaces(String line) {
        int count = 0;
        while (count < line.length() && line.charAt(count) == ' ') {
            count++;
        }
        return count;
    }

    private static boolean hasTabInIndentation(String line) {
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '\t') {
                return true;
            }
            if (!Character.isWhitespace(ch)) {
                return false;
            }
        }
        return false;
    }
}

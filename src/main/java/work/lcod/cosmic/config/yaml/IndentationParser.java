package work.lcod.cosmic.config.yaml;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.cosmic.config.ParsedValue;

/**
 * Recursive block parser driven only by indentation.
 *
 * <p>Every call consumes one indentation block starting at {@code start} and returns the value together with the
 * index of the first line it did not consume, so any sub-range of a line list can be parsed on its own. A block is
 * either a list (lines starting with {@code "- "}) or a mapping ({@code key: value} lines), never both. A nested
 * block's indentation is the indentation of its first line, which only has to be strictly deeper than its parent.
 */
public final class IndentationParser {
    private IndentationParser() {}

    /**
     * Value of one block and the index of the line following it.
     */
    public record Parse(ParsedValue value, int nextIndex) {}

    private record Entry(String key, ParsedValue value, int nextIndex) {}

    public static Parse parse(List<LineRecord> lines, int start, int indent) {
        List<ParsedValue> sequence = null;
        Map<String, ParsedValue> mapping = null;
        int index = start;

        while (index < lines.size()) {
            LineRecord line = lines.get(index);
            if (line.indent() < indent) {
                break;
            }
            if (isListItem(line.content())) {
                if (mapping != null) {
                    throw mixedStructures(line);
                }
                if (sequence == null) {
                    sequence = new ArrayList<>();
                }
                Parse item = parseListItem(lines, index);
                sequence.add(item.value());
                index = item.nextIndex();
            } else {
                if (sequence != null) {
                    throw mixedStructures(line);
                }
                if (mapping == null) {
                    mapping = new LinkedHashMap<>();
                }
                Entry entry = parseMappingEntry(lines, index);
                mapping.put(entry.key(), entry.value());
                index = entry.nextIndex();
            }
        }

        if (sequence != null) {
            return new Parse(new ParsedValue.Sequence(sequence), index);
        }
        return new Parse(mapping == null ? ParsedValue.Mapping.empty() : new ParsedValue.Mapping(mapping), index);
    }

    private static Parse parseListItem(List<LineRecord> lines, int index) {
        LineRecord line = lines.get(index);
        String remainder = line.content().length() > 1 ? line.content().substring(2).trim() : "";
        int next = index + 1;

        if (remainder.isEmpty()) {
            if (isDeeper(lines, next, line.indent())) {
                return parse(lines, next, lines.get(next).indent());
            }
            return new Parse(ParsedValue.Scalar.NULL, next);
        }

        int colon = remainder.indexOf(':');
        if (colon >= 0) {
            String key = remainder.substring(0, colon).trim();
            String valuePart = remainder.substring(colon + 1).trim();
            var item = new LinkedHashMap<String, ParsedValue>();
            if (!valuePart.isEmpty()) {
                item.put(key, ScalarCoercion.coerce(valuePart));
            } else if (isDeeper(lines, next, line.indent())) {
                Parse nested = parse(lines, next, lines.get(next).indent());
                item.put(key, nested.value());
                next = nested.nextIndex();
            } else {
                item.put(key, ParsedValue.Scalar.NULL);
            }

            // remaining fields of the same item sit on the following, deeper lines
            while (isDeeper(lines, next, line.indent())) {
                LineRecord continuation = lines.get(next);
                Parse extra = parse(lines, next, continuation.indent());
                if (!(extra.value() instanceof ParsedValue.Mapping extraMapping)) {
                    throw new YamlStructureException(
                        "List item mappings must contain dictionary structures at consistent indentation",
                        continuation.lineNumber()
                    );
                }
                item.putAll(extraMapping.entries());
                next = extra.nextIndex();
            }
            return new Parse(new ParsedValue.Mapping(item), next);
        }

        ParsedValue.Scalar scalar = ScalarCoercion.coerce(remainder);
        if (!isDeeper(lines, next, line.indent())) {
            return new Parse(scalar, next);
        }
        Parse nested = parse(lines, next, lines.get(next).indent());
        if (nested.value() instanceof ParsedValue.Mapping nestedMapping) {
            var wrapped = new LinkedHashMap<String, ParsedValue>();
            wrapped.put(wrapKey(scalar, remainder), nestedMapping);
            return new Parse(new ParsedValue.Mapping(wrapped), nested.nextIndex());
        }
        var merged = new ArrayList<ParsedValue>();
        merged.add(scalar);
        if (nested.value() instanceof ParsedValue.Sequence nestedSequence) {
            merged.addAll(nestedSequence.items());
        } else {
            merged.add(nested.value());
        }
        return new Parse(new ParsedValue.Sequence(merged), nested.nextIndex());
    }

    // keywords and numbers keep their source spelling; quoted text loses its quotes
    private static String wrapKey(ParsedValue.Scalar scalar, String remainder) {
        return scalar.value() instanceof String text ? text : remainder;
    }

    private static Entry parseMappingEntry(List<LineRecord> lines, int index) {
        LineRecord line = lines.get(index);
        String content = line.content();
        int colon = content.indexOf(':');
        String key = (colon >= 0 ? content.substring(0, colon) : content).trim();
        String valuePart = colon >= 0 ? content.substring(colon + 1).trim() : "";
        int next = index + 1;

        if (!valuePart.isEmpty()) {
            return new Entry(key, ScalarCoercion.coerce(valuePart), next);
        }
        if (isDeeper(lines, next, line.indent())) {
            Parse nested = parse(lines, next, lines.get(next).indent());
            return new Entry(key, nested.value(), nested.nextIndex());
        }
        return new Entry(key, ParsedValue.Scalar.NULL, next);
    }

    private static boolean isListItem(String content) {
        return content.startsWith("- ") || "-".equals(content);
    }

    private static boolean isDeeper(List<LineRecord> lines, int index, int indent) {
        return index < lines.size() && lines.get(index).indent() > indent;
    }

    private static YamlStructureException mixedStructures(LineRecord line) {
        return new YamlStructureException(
            "Mixed list and mapping structures are not supported at the same indentation",
            line.lineNumber()
        );
    }
}

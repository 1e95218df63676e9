package work.lcod.cosmic.config.yaml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.cosmic.config.ConfigParser;
import work.lcod.cosmic.config.ParsedValue;

/**
 * Built-in parser for the indentation-based YAML subset used by measurement files.
 *
 * <p>Supports nested mappings and lists, list items made of several {@code key: value} lines, and typed scalars.
 * Flow collections, anchors, block scalars, tags and multi-document streams are not recognised.
 */
public final class SimpleYamlParser implements ConfigParser {
    private static final Logger LOG = LoggerFactory.getLogger(SimpleYamlParser.class);

    @Override
    public ParsedValue parse(String text) {
        var lines = LinePreprocessor.preprocess(text);
        if (lines.isEmpty()) {
            return ParsedValue.Mapping.empty();
        }
        var result = IndentationParser.parse(lines, 0, lines.get(0).indent());
        if (result.nextIndex() < lines.size()) {
            LineRecord stray = lines.get(result.nextIndex());
            throw new YamlStructureException(
                "Line is indented less than the first line of the document",
                stray.lineNumber()
            );
        }
        LOG.debug("Parsed {} significant lines into a {}", lines.size(), result.value().kind());
        return result.value();
    }

    @Override
    public String name() {
        return "builtin";
    }
}

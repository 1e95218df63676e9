package work.lcod.cosmic.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLParser;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * {@link ConfigParser} backed by a Jackson {@link ObjectMapper} (JSON, or YAML through {@link YAMLFactory}).
 */
public final class JacksonConfigParser implements ConfigParser {
    private final ObjectMapper mapper;
    private final String name;

    JacksonConfigParser(ObjectMapper mapper, String name) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * YAML reader that keeps {@code yes}/{@code no}/{@code on}/{@code off} as strings, like the built-in parser.
     */
    public static JacksonConfigParser yaml() {
        var factory = YAMLFactory.builder()
            .enable(YAMLParser.Feature.PARSE_BOOLEAN_LIKE_WORDS_AS_STRINGS)
            .build();
        return new JacksonConfigParser(new ObjectMapper(factory), "jackson-yaml");
    }

    public static JacksonConfigParser json() {
        return new JacksonConfigParser(new ObjectMapper(), "jackson-json");
    }

    @Override
    public ParsedValue parse(String text) {
        JsonNode root;
        try {
            root = mapper.readTree(text == null ? "" : text);
        } catch (JsonProcessingException ex) {
            throw new ConfigParseException(ex.getOriginalMessage(), ex);
        }
        if (root == null || root.isMissingNode()) {
            return ParsedValue.Mapping.empty();
        }
        return convertNode(root);
    }

    @Override
    public String name() {
        return name;
    }

    private static ParsedValue convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, ParsedValue>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return new ParsedValue.Mapping(map);
        }
        if (node.isArray()) {
            var list = new ArrayList<ParsedValue>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return new ParsedValue.Sequence(list);
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong()
                ? ParsedValue.Scalar.of(node.longValue())
                : ParsedValue.Scalar.of(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return ParsedValue.Scalar.of(node.doubleValue());
        }
        if (node.isBoolean()) {
            return ParsedValue.Scalar.of(node.booleanValue());
        }
        if (node.isNull()) {
            return ParsedValue.Scalar.NULL;
        }
        return ParsedValue.Scalar.of(node.asText());
    }
}

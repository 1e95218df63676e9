package work.lcod.cosmic.config.yaml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.cosmic.config.ConfigParseException;
import work.lcod.cosmic.config.ParsedValue;

class SimpleYamlParserTest {
    private final SimpleYamlParser parser = new SimpleYamlParser();

    @Test
    void emptyDocumentIsEmptyMapping() {
        assertEquals(ParsedValue.Mapping.empty(), parser.parse(""));
        assertEquals(ParsedValue.Mapping.empty(), parser.parse("# nothing here\n\n"));
    }

    @Test
    void firstLineMayBeIndented() {
        assertEquals(Map.of("a", 1L, "b", 2L), parser.parse("  a: 1\n  b: 2\n").toPlainObject());
    }

    @Test
    void lineShallowerThanDocumentStartFails() {
        var error = assertThrows(YamlStructureException.class, () -> parser.parse("  a: 1\nb: 2\n"));
        assertEquals(2, error.lineNumber());
        assertTrue(error.getMessage().contains("(line 2)"));
    }

    @Test
    void structureErrorsAreConfigParseExceptions() {
        assertThrows(ConfigParseException.class, () -> parser.parse("- a\nb: c\n"));
    }

    @Test
    void reparsingSerializedTreeIsStable() throws Exception {
        String text = """
            system:
              name: Demo
            functional_processes:
              - name: First
                data_movements:
                  - type: E
                    description: In
            """;
        var first = parser.parse(text);
        var second = parser.parse(text);
        var json = new ObjectMapper();
        assertEquals(json.writeValueAsString(first.toPlainObject()), json.writeValueAsString(second.toPlainObject()));
        assertEquals(
            Map.of(
                "system", Map.of("name", "Demo"),
                "functional_processes", List.of(Map.of(
                    "name", "First",
                    "data_movements", List.of(Map.of("type", "E", "description", "In"))
                ))
            ),
            first.toPlainObject()
        );
    }

    @Test
    void reportsItsName() {
        assertEquals("builtin", parser.name());
    }
}

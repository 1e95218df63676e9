package work.lcod.cosmic.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.cosmic.config.ParserMode;

class CosmicRunnerTest {
    private static final Path EXAMPLE = Path.of("src/test/resources/measurements/example_measurement.yaml");

    @Test
    void runProducesReportAndMetadata(@TempDir Path dir) {
        Path output = dir.resolve("out/report.xlsx");
        var result = new CosmicRunner().run(CosmicRunConfiguration.builder()
            .configPath(EXAMPLE)
            .outputPath(output)
            .parserMode(ParserMode.BUILTIN)
            .build());

        assertTrue(result.isSuccess());
        assertEquals(0, result.status().exitCode());
        assertTrue(Files.exists(output));
        assertEquals(output.toAbsolutePath().toString(), result.output().orElseThrow());
        assertTrue(result.error().isEmpty());
        assertFalse(result.elapsed().isNegative());
        assertEquals("builtin", result.metadata().get("parser"));
        assertEquals("Order Service", result.metadata().get("system"));
        assertEquals(8, result.metadata().get("totalCfp"));
        assertEquals(Map.of("Submit Order", 4, "Cancel Order", 4), result.metadata().get("processes"));
    }

    @Test
    void failureIsReportedNotThrown(@TempDir Path dir) {
        Path missing = dir.resolve("missing.yaml");
        var result = new CosmicRunner().run(CosmicRunConfiguration.builder()
            .configPath(missing)
            .outputPath(dir.resolve("never.xlsx"))
            .build());

        assertFalse(result.isSuccess());
        assertEquals(1, result.status().exitCode());
        assertEquals("Configuration file '" + missing + "' does not exist.", result.error().orElseThrow());
        assertEquals("MeasurementParserException", result.metadata().get("exception"));
        assertTrue(result.output().isEmpty());
        assertFalse(Files.exists(dir.resolve("never.xlsx")));
    }

    @Test
    void invalidDefinitionIsAFailure(@TempDir Path dir) throws Exception {
        Path config = Files.writeString(dir.resolve("bad.yaml"), """
            functional_processes:
              - name: Broken
                data_movements:
                  - type: Q
                    description: Unknown
            """);
        var result = new CosmicRunner().run(CosmicRunConfiguration.builder()
            .configPath(config)
            .outputPath(dir.resolve("bad.xlsx"))
            .build());

        assertFalse(result.isSuccess());
        assertTrue(result.error().orElseThrow().startsWith("Unsupported data movement type 'Q'"));
    }

    @Test
    void summarySerializesToJson(@TempDir Path dir) throws Exception {
        var result = new CosmicRunner().run(CosmicRunConfiguration.builder()
            .configPath(EXAMPLE)
            .outputPath(dir.resolve("report.xlsx"))
            .build());

        var tree = new ObjectMapper().readTree(result.toPrettyJson());
        assertEquals("success", tree.get("status").asText());
        assertEquals(8, tree.get("metadata").get("totalCfp").asInt());
        assertEquals(4, tree.get("metadata").get("processes").get("Cancel Order").asInt());
    }

    @Test
    void configurationRequiresConfigPath() {
        assertThrows(NullPointerException.class, () -> CosmicRunConfiguration.builder().build());
        var defaults = CosmicRunConfiguration.builder().configPath(EXAMPLE).build();
        assertEquals(CosmicRunConfiguration.DEFAULT_OUTPUT, defaults.outputPath());
        assertEquals(ParserMode.AUTO, defaults.parserMode());
    }

    @Test
    void logLevelParsing() {
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals(LogLevel.DEBUG, LogLevel.from("debug"));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
    }
}

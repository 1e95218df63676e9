package work.lcod.cosmic.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.cosmic.config.yaml.SimpleYamlParser;
import work.lcod.cosmic.config.yaml.YamlStructureException;
import work.lcod.cosmic.model.DataMovementType;
import work.lcod.cosmic.model.FunctionalProcess;

class MeasurementLoaderTest {
    private static final Path EXAMPLE_YAML = Path.of("src/test/resources/measurements/example_measurement.yaml");
    private static final Path EXAMPLE_JSON = Path.of("src/test/resources/measurements/example_measurement.json");

    @Test
    void loadsYamlWithBuiltinParser() {
        var measurement = new MeasurementLoader(new SimpleYamlParser()).load(EXAMPLE_YAML);

        assertEquals("Order Service", measurement.name());
        assertEquals("REST API of the order service", measurement.boundary());
        assertEquals(List.of("Orders database"), measurement.persistenceResources());
        assertEquals(List.of("Customer", "Warehouse system"), measurement.externalActors());
        assertEquals(List.of("Order", "Customer"), measurement.objectsOfInterest());
        assertEquals(List.of("Submit Order", "Cancel Order"),
            measurement.functionalProcesses().stream().map(FunctionalProcess::name).toList());

        var submit = measurement.functionalProcesses().get(0);
        assertEquals("Customer places an order: items are validated and stored", submit.description());
        assertEquals("Customer", submit.dataMovements().get(1).objectOfInterest());
        assertEquals("OrderController.submit", submit.dataMovements().get(2).codeReference());
        assertEquals("Includes the order number", submit.dataMovements().get(3).additionalNotes());

        var cancel = measurement.functionalProcesses().get(1);
        assertEquals("Customer cancels an open order", cancel.description());
        assertEquals("Order", cancel.objectOfInterest());
        assertEquals(
            List.of(DataMovementType.ENTRY, DataMovementType.READ, DataMovementType.WRITE, DataMovementType.EXIT),
            cancel.dataMovements().stream().map(movement -> movement.type()).toList()
        );
    }

    @Test
    void jacksonYamlProducesSameMeasurement() {
        var builtin = new MeasurementLoader(new SimpleYamlParser()).load(EXAMPLE_YAML);
        var jackson = new MeasurementLoader(JacksonConfigParser.yaml()).load(EXAMPLE_YAML);
        assertEquals(builtin, jackson);
    }

    @Test
    void loadsJsonByExtension() {
        var measurement = new MeasurementLoader(new SimpleYamlParser()).load(EXAMPLE_JSON);

        assertEquals("Order Service", measurement.name());
        assertNull(measurement.description());
        assertEquals(List.of("Order", "Customer"), measurement.objectsOfInterest());
        assertEquals(8, measurement.totalCfp());
    }

    @Test
    void missingFileIsReported(@TempDir Path dir) {
        Path missing = dir.resolve("absent.yaml");
        var error = assertThrows(MeasurementParserException.class, () -> new MeasurementLoader().load(missing));
        assertEquals("Configuration file '" + missing + "' does not exist.", error.getMessage());
    }

    @Test
    void rootMustBeMapping(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("list.yaml"), "- a\n- b\n");
        var error = assertThrows(MeasurementParserException.class,
            () -> new MeasurementLoader(new SimpleYamlParser()).load(file));
        assertTrue(error.getMessage().startsWith("Measurement configuration must define a mapping"));
    }

    @Test
    void parseErrorsAreWrappedWithFileName(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("broken.yaml"), "- a\nkey: value\n");
        var error = assertThrows(MeasurementParserException.class,
            () -> new MeasurementLoader(new SimpleYamlParser()).load(file));
        assertTrue(error.getMessage().startsWith("Failed to parse YAML configuration file '" + file + "'"));
        assertInstanceOf(YamlStructureException.class, error.getCause());
    }

    @Test
    void jsonParseErrorsNameJson(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("broken.JSON"), "{\"system\": ");
        var error = assertThrows(MeasurementParserException.class, () -> new MeasurementLoader().load(file));
        assertTrue(error.getMessage().startsWith("Failed to parse JSON configuration file"));
    }

    @Test
    void emptyFileGivesUnnamedSystem(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("empty.yaml"), "# nothing yet\n");
        var measurement = new MeasurementLoader(new SimpleYamlParser()).load(file);
        assertEquals("Unnamed System", measurement.name());
        assertEquals(0, measurement.totalCfp());
    }
}

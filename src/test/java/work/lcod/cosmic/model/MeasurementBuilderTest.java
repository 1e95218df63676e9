package work.lcod.cosmic.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.cosmic.config.ParsedValue;
import work.lcod.cosmic.config.yaml.SimpleYamlParser;

class MeasurementBuilderTest {
    private final SimpleYamlParser parser = new SimpleYamlParser();

    @Test
    void missingSystemUsesDefaultName() {
        var measurement = MeasurementBuilder.fromValue(parser.parse("functional_processes:\n"));
        assertEquals(MeasurementBuilder.DEFAULT_SYSTEM_NAME, measurement.name());
        assertTrue(measurement.functionalProcesses().isEmpty());
    }

    @Test
    void processRequiresName() {
        var error = assertThrows(IllegalArgumentException.class, () -> MeasurementBuilder.fromValue(parser.parse("""
            functional_processes:
              - trigger: Timer
            """)));
        assertEquals("Functional process definition must include a 'name' field.", error.getMessage());
    }

    @Test
    void emptyNameCountsAsMissing() {
        assertThrows(IllegalArgumentException.class,
            () -> MeasurementBuilder.functionalProcess(parser.parse("name: ''\n")));
    }

    @Test
    void movementRequiresTypeAndDescription() {
        var noType = assertThrows(IllegalArgumentException.class,
            () -> MeasurementBuilder.dataMovement(parser.parse("description: In\n")));
        assertEquals("Data movement definition must include a 'type' field.", noType.getMessage());

        var noDescription = assertThrows(IllegalArgumentException.class,
            () -> MeasurementBuilder.dataMovement(parser.parse("type: E\n")));
        assertEquals("Data movement definition must include a 'description' field.", noDescription.getMessage());
    }

    @Test
    void movementMustBeMapping() {
        var error = assertThrows(IllegalArgumentException.class,
            () -> MeasurementBuilder.dataMovement(ParsedValue.Scalar.of("E")));
        assertEquals("Data movement definition must be a mapping, got a scalar.", error.getMessage());
    }

    @Test
    void resolvesAliasesInOrder() {
        var movement = MeasurementBuilder.dataMovement(parser.parse("""
            type: W
            description: '  Store  '
            object_of_interest:
            ooi: Order
            additional_notes: kept
            """));

        assertEquals(DataMovementType.WRITE, movement.type());
        assertEquals("Store", movement.description());
        assertEquals("Order", movement.objectOfInterest());
        assertEquals("kept", movement.additionalNotes());
        assertNull(movement.trigger());
        assertNull(movement.codeReference());
    }

    @Test
    void processDescriptionFallsBackToPurpose() {
        var process = MeasurementBuilder.functionalProcess(parser.parse("""
            name: '  Report  '
            purpose: Monthly totals
            data_movements:
              - type: R
                description: Read ledger
            """));

        assertEquals("Report", process.name());
        assertEquals("Monthly totals", process.description());
        assertEquals(1, process.totalCfp());
    }

    @Test
    void scalarValuesAreRenderedAsText() {
        var process = MeasurementBuilder.functionalProcess(parser.parse("name: 42\ntrigger: true\n"));
        assertEquals("42", process.name());
        assertEquals("true", process.trigger());
    }

    @Test
    void textListsSkipNullsAndAcceptSingleValue() {
        var measurement = MeasurementBuilder.fromValue(parser.parse("""
            system:
              name: Demo
              external_actors:
                - Clerk
                - null
              persistence_resources: Ledger
            """));

        assertEquals(List.of("Clerk"), measurement.externalActors());
        assertEquals(List.of("Ledger"), measurement.persistenceResources());
    }

    @Test
    void processListMustBeList() {
        var error = assertThrows(IllegalArgumentException.class,
            () -> MeasurementBuilder.fromValue(parser.parse("functional_processes: none\n")));
        assertEquals("Field 'functional_processes' must be a list, got a scalar.", error.getMessage());
    }
}

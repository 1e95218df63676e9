package work.lcod.cosmic.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.cosmic.config.ParsedValue;

/**
 * Builds the domain records from a parsed configuration tree, validating required fields.
 */
public final class MeasurementBuilder {
    static final String DEFAULT_SYSTEM_NAME = "Unnamed System";

    private MeasurementBuilder() {}

    public static SystemMeasurement fromValue(ParsedValue value) {
        ParsedValue.Mapping payload = requireMapping(value, "Measurement configuration");
        ParsedValue.Mapping system = FieldAliases.SYSTEM.resolve(payload)
            .map(node -> requireMapping(node, "Field 'system'"))
            .orElse(ParsedValue.Mapping.empty());

        var processes = new ArrayList<FunctionalProcess>();
        for (ParsedValue item : sequence(payload, FieldAliases.FUNCTIONAL_PROCESSES)) {
            processes.add(functionalProcess(item));
        }

        return new SystemMeasurement(
            optionalText(system, FieldAliases.NAME).orElse(DEFAULT_SYSTEM_NAME),
            optionalText(system, FieldAliases.BOUNDARY).orElse(null),
            optionalText(system, FieldAliases.DESCRIPTION).orElse(null),
            textList(system, FieldAliases.PERSISTENCE_RESOURCES),
            textList(system, FieldAliases.EXTERNAL_ACTORS),
            textList(payload, FieldAliases.OBJECTS),
            processes
        );
    }

    public static FunctionalProcess functionalProcess(ParsedValue value) {
        ParsedValue.Mapping payload = requireMapping(value, "Functional process definition");
        String name = optionalText(payload, FieldAliases.NAME)
            .orElseThrow(() -> missingField("Functional process", FieldAliases.NAME))
            .strip();

        var movements = new ArrayList<DataMovement>();
        for (ParsedValue item : sequence(payload, FieldAliases.DATA_MOVEMENTS)) {
            movements.add(dataMovement(item));
        }

        return new FunctionalProcess(
            name,
            optionalText(payload, FieldAliases.PROCESS_DESCRIPTION).orElse(null),
            optionalText(payload, FieldAliases.TRIGGER).orElse(null),
            optionalText(payload, FieldAliases.OBJECT_OF_INTEREST).orElse(null),
            movements
        );
    }

    public static DataMovement dataMovement(ParsedValue value) {
        ParsedValue.Mapping payload = requireMapping(value, "Data movement definition");
        String type = optionalText(payload, FieldAliases.TYPE)
            .orElseThrow(() -> missingField("Data movement", FieldAliases.TYPE));
        String description = optionalText(payload, FieldAliases.DESCRIPTION)
            .orElseThrow(() -> missingField("Data movement", FieldAliases.DESCRIPTION))
            .strip();

        return new DataMovement(
            DataMovementType.from(type),
            description,
            optionalText(payload, FieldAliases.OBJECT_OF_INTEREST).orElse(null),
            optionalText(payload, FieldAliases.TRIGGER).orElse(null),
            optionalText(payload, FieldAliases.CODE_REFERENCE).orElse(null),
            optionalText(payload, FieldAliases.NOTES).orElse(null)
        );
    }

    private static ParsedValue.Mapping requireMapping(ParsedValue value, String what) {
        if (value instanceof ParsedValue.Mapping mapping) {
            return mapping;
        }
        throw new IllegalArgumentException(what + " must be a mapping, got a " + value.kind() + ".");
    }

    private static Optional<String> optionalText(ParsedValue.Mapping payload, FieldAliases field) {
        return field.resolve(payload).map(value -> scalarText(value, field));
    }

    private static List<ParsedValue> sequence(ParsedValue.Mapping payload, FieldAliases field) {
        Optional<ParsedValue> value = field.resolve(payload);
        if (value.isEmpty()) {
            return List.of();
        }
        if (value.get() instanceof ParsedValue.Sequence sequence) {
            return sequence.items();
        }
        throw new IllegalArgumentException(
            "Field '" + field.primary() + "' must be a list, got a " + value.get().kind() + "."
        );
    }

    private static List<String> textList(ParsedValue.Mapping payload, FieldAliases field) {
        Optional<ParsedValue> value = field.resolve(payload);
        if (value.isEmpty()) {
            return List.of();
        }
        var texts = new ArrayList<String>();
        if (value.get() instanceof ParsedValue.Sequence sequence) {
            for (ParsedValue item : sequence.items()) {
                String text = scalarText(item, field);
                if (text != null) {
                    texts.add(text);
                }
            }
        } else {
            texts.add(scalarText(value.get(), field));
        }
        return texts;
    }

    private static String scalarText(ParsedValue value, FieldAliases field) {
        if (value instanceof ParsedValue.Scalar scalar) {
            return scalar.asText();
        }
        throw new IllegalArgumentException(
            "Field '" + field.primary() + "' must hold scalar values, got a " + value.kind() + "."
        );
    }

    private static IllegalArgumentException missingField(String owner, FieldAliases field) {
        return new IllegalArgumentException(
            owner + " definition must include a '" + field.primary() + "' field."
        );
    }
}

package work.lcod.cosmic.model;

import java.util.List;
import java.util.Optional;
import work.lcod.cosmic.config.ParsedValue;

/**
 * Ordered list of keys accepted for one field. The first key holding a non-empty value wins.
 */
public record FieldAliases(List<String> names) {
    static final FieldAliases NAME = of("name");
    static final FieldAliases TYPE = of("type");
    static final FieldAliases DESCRIPTION = of("description");
    static final FieldAliases PROCESS_DESCRIPTION = of("description", "purpose");
    static final FieldAliases TRIGGER = of("trigger");
    static final FieldAliases OBJECT_OF_INTEREST = of("object_of_interest", "ooi");
    static final FieldAliases CODE_REFERENCE = of("code_reference");
    static final FieldAliases NOTES = of("notes", "additional_notes");
    static final FieldAliases DATA_MOVEMENTS = of("data_movements");
    static final FieldAliases SYSTEM = of("system");
    static final FieldAliases BOUNDARY = of("boundary");
    static final FieldAliases PERSISTENCE_RESOURCES = of("persistence_resources");
    static final FieldAliases EXTERNAL_ACTORS = of("external_actors");
    static final FieldAliases OBJECTS = of("objects", "objects_of_interest");
    static final FieldAliases FUNCTIONAL_PROCESSES = of("functional_processes");

    public FieldAliases {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("at least one field name is required");
        }
        names = List.copyOf(names);
    }

    public static FieldAliases of(String... names) {
        return new FieldAliases(List.of(names));
    }

    /**
     * Name used in validation messages.
     */
    public String primary() {
        return names.get(0);
    }

    public Optional<ParsedValue> resolve(ParsedValue.Mapping mapping) {
        for (String name : names) {
            ParsedValue value = mapping.get(name);
            if (value != null && !isEmpty(value)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private static boolean isEmpty(ParsedValue value) {
        if (value instanceof ParsedValue.Scalar scalar) {
            return scalar.isNull() || "".equals(scalar.value());
        }
        if (value instanceof ParsedValue.Sequence sequence) {
            return sequence.size() == 0;
        }
        return ((ParsedValue.Mapping) value).size() == 0;
    }
}

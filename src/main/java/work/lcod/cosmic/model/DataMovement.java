package work.lcod.cosmic.model;

import java.util.Objects;

/**
 * One classified data movement of a functional process. Optional fields are {@code null} when absent.
 */
public record DataMovement(
    DataMovementType type,
    String description,
    String objectOfInterest,
    String trigger,
    String codeReference,
    String additionalNotes
) {
    public DataMovement {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(description, "description");
    }

    public static DataMovement of(DataMovementType type, String description) {
        return new DataMovement(type, description, null, null, null, null);
    }
}

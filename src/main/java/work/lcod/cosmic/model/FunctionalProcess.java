package work.lcod.cosmic.model;

import java.util.List;
import java.util.Objects;

/**
 * A named functional process and its ordered data movements.
 */
public record FunctionalProcess(
    String name,
    String description,
    String trigger,
    String objectOfInterest,
    List<DataMovement> dataMovements
) {
    public FunctionalProcess {
        Objects.requireNonNull(name, "name");
        dataMovements = dataMovements == null ? List.of() : List.copyOf(dataMovements);
    }

    public long countMovements(DataMovementType type) {
        return dataMovements.stream().filter(movement -> movement.type() == type).count();
    }

    /**
     * One CFP per data movement.
     */
    public int totalCfp() {
        return dataMovements.size();
    }
}

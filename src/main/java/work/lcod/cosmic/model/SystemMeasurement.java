package work.lcod.cosmic.model;

import java.util.List;
import java.util.Objects;

/**
 * Full COSMIC measurement of one system boundary.
 */
public record SystemMeasurement(
    String name,
    String boundary,
    String description,
    List<String> persistenceResources,
    List<String> externalActors,
    List<String> objectsOfInterest,
    List<FunctionalProcess> functionalProcesses
) {
    public SystemMeasurement {
        Objects.requireNonNull(name, "name");
        persistenceResources = copy(persistenceResources);
        externalActors = copy(externalActors);
        objectsOfInterest = copy(objectsOfInterest);
        functionalProcesses = copy(functionalProcesses);
    }

    public int totalCfp() {
        return functionalProcesses.stream().mapToInt(FunctionalProcess::totalCfp).sum();
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}

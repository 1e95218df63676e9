package work.lcod.cosmic.calc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.cosmic.model.DataMovementType;
import work.lcod.cosmic.model.FunctionalProcess;
import work.lcod.cosmic.model.SystemMeasurement;

/**
 * Computes COSMIC function point totals for a measurement.
 */
public final class CosmicCalculator {
    private final SystemMeasurement measurement;

    public CosmicCalculator(SystemMeasurement measurement) {
        this.measurement = Objects.requireNonNull(measurement, "measurement");
    }

    public FunctionalProcessSummary summarize(FunctionalProcess process) {
        return new FunctionalProcessSummary(
            process.name(),
            process.countMovements(DataMovementType.ENTRY),
            process.countMovements(DataMovementType.EXIT),
            process.countMovements(DataMovementType.READ),
            process.countMovements(DataMovementType.WRITE),
            process.totalCfp(),
            process.trigger(),
            process.objectOfInterest(),
            process.description()
        );
    }

    /**
     * Summaries keyed by process name in declaration order. A repeated name replaces the earlier summary in place.
     */
    public Map<String, FunctionalProcessSummary> summarize() {
        var summaries = new LinkedHashMap<String, FunctionalProcessSummary>();
        for (var process : measurement.functionalProcesses()) {
            summaries.put(process.name(), summarize(process));
        }
        return Collections.unmodifiableMap(summaries);
    }

    public int totalCfp() {
        return measurement.totalCfp();
    }
}

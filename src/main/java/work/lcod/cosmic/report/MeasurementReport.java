package work.lcod.cosmic.report;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import work.lcod.cosmic.calc.CosmicCalculator;
import work.lcod.cosmic.calc.FunctionalProcessSummary;
import work.lcod.cosmic.model.DataMovement;
import work.lcod.cosmic.model.FunctionalProcess;
import work.lcod.cosmic.model.SystemMeasurement;
import work.lcod.cosmic.xlsx.CellValue;
import work.lcod.cosmic.xlsx.Sheet;
import work.lcod.cosmic.xlsx.Workbook;
import work.lcod.cosmic.xlsx.XlsxWriter;

/**
 * Excel report of a measurement: a summary sheet, one row per functional process, one row per data movement.
 */
public final class MeasurementReport {
    public static final String SUMMARY_SHEET = "Summary";
    public static final String PROCESSES_SHEET = "Functional Processes";
    public static final String MOVEMENTS_SHEET = "Data Movements";

    static final List<String> PROCESS_HEADER = List.of(
        "Functional Process",
        "Trigger",
        "Object of Interest",
        "Description",
        "Entry (E)",
        "Exit (X)",
        "Read (R)",
        "Write (W)",
        "Total CFP"
    );

    static final List<String> MOVEMENT_HEADER = List.of(
        "Functional Process",
        "Sequence",
        "Movement Type",
        "Description",
        "Object of Interest",
        "Trigger",
        "Code Reference",
        "Notes"
    );

    private final SystemMeasurement measurement;
    private final CosmicCalculator calculator;

    public MeasurementReport(SystemMeasurement measurement) {
        this.measurement = Objects.requireNonNull(measurement, "measurement");
        this.calculator = new CosmicCalculator(measurement);
    }

    public Workbook workbook() {
        return Workbook.of(
            new Sheet(SUMMARY_SHEET, summaryRows()),
            new Sheet(PROCESSES_SHEET, processRows()),
            new Sheet(MOVEMENTS_SHEET, movementRows())
        );
    }

    /**
     * Writes the report workbook and returns {@code path}.
     */
    public Path export(Path path) {
        return XlsxWriter.write(workbook(), path);
    }

    List<List<CellValue>> summaryRows() {
        return List.of(
            row("Metric", "Value"),
            row("Total CFP", calculator.totalCfp())
        );
    }

    List<List<CellValue>> processRows() {
        var rows = new ArrayList<List<CellValue>>();
        rows.add(header(PROCESS_HEADER));
        for (FunctionalProcessSummary summary : calculator.summarize().values()) {
            rows.add(row(
                summary.name(),
                summary.trigger(),
                summary.objectOfInterest(),
                summary.description(),
                summary.entryCount(),
                summary.exitCount(),
                summary.readCount(),
                summary.writeCount(),
                summary.totalCfp()
            ));
        }
        return rows;
    }

    List<List<CellValue>> movementRows() {
        var rows = new ArrayList<List<CellValue>>();
        rows.add(header(MOVEMENT_HEADER));
        for (FunctionalProcess process : measurement.functionalProcesses()) {
            int sequence = 1;
            for (DataMovement movement : process.dataMovements()) {
                rows.add(row(
                    process.name(),
                    sequence++,
                    movement.type().code(),
                    movement.description(),
                    firstPresent(movement.objectOfInterest(), process.objectOfInterest()),
                    firstPresent(movement.trigger(), process.trigger()),
                    movement.codeReference(),
                    movement.additionalNotes()
                ));
            }
        }
        return rows;
    }

    private static String firstPresent(String preferred, String fallback) {
        return preferred != null && !preferred.isEmpty() ? preferred : fallback;
    }

    private static List<CellValue> header(List<String> titles) {
        return titles.stream().map(CellValue::of).toList();
    }

    private static List<CellValue> row(Object... values) {
        return Arrays.stream(values).map(CellValue::of).toList();
    }
}

package work.lcod.cosmic.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.cosmic.config.MeasurementLoader;
import work.lcod.cosmic.config.yaml.SimpleYamlParser;
import work.lcod.cosmic.xlsx.CellValue;

class MeasurementReportTest {
    private MeasurementReport report;

    @BeforeEach
    void loadExample() {
        var measurement = new MeasurementLoader(new SimpleYamlParser())
            .load(Path.of("src/test/resources/measurements/example_measurement.yaml"));
        report = new MeasurementReport(measurement);
    }

    @Test
    void summaryReportsTotal() {
        assertEquals(List.of(
            List.of(new CellValue.Text("Metric"), new CellValue.Text("Value")),
            List.of(new CellValue.Text("Total CFP"), new CellValue.WholeNumber(8))
        ), report.summaryRows());
    }

    @Test
    void processRowsCountEachKind() {
        var rows = report.processRows();
        assertEquals(3, rows.size());
        assertEquals(MeasurementReport.PROCESS_HEADER.size(), rows.get(0).size());

        var submit = rows.get(1);
        assertEquals(new CellValue.Text("Submit Order"), submit.get(0));
        assertEquals(new CellValue.Text("Customer submits an order"), submit.get(1));
        assertEquals(new CellValue.Text("Order"), submit.get(2));
        for (var row : rows.subList(1, rows.size())) {
            assertEquals(List.of(
                new CellValue.WholeNumber(1),
                new CellValue.WholeNumber(1),
                new CellValue.WholeNumber(1),
                new CellValue.WholeNumber(1),
                new CellValue.WholeNumber(4)
            ), row.subList(4, 9));
        }
    }

    @Test
    void movementRowsFallBackToProcessContext() {
        var rows = report.movementRows();
        assertEquals(9, rows.size());

        var read = rows.get(2);
        assertEquals(new CellValue.WholeNumber(2), read.get(1));
        assertEquals(new CellValue.Text("R"), read.get(2));
        assertEquals(new CellValue.Text("Customer"), read.get(4));
        assertEquals(new CellValue.Text("Customer submits an order"), read.get(5));
        assertEquals(CellValue.BLANK, read.get(6));

        var cancelEntry = rows.get(5);
        assertEquals(new CellValue.Text("Cancel Order"), cancelEntry.get(0));
        assertEquals(new CellValue.WholeNumber(1), cancelEntry.get(1));
        assertEquals(new CellValue.Text("E"), cancelEntry.get(2));
        assertEquals(new CellValue.Text("Order"), cancelEntry.get(4));
    }

    @Test
    void exportWritesThreeSheets(@TempDir Path dir) throws IOException {
        Path target = report.export(dir.resolve("report.xlsx"));

        var names = new ArrayList<String>();
        String workbookXml = null;
        try (InputStream in = Files.newInputStream(target); var zip = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                names.add(entry.getName());
                if (entry.getName().equals("xl/workbook.xml")) {
                    workbookXml = new String(zip.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
        }
        assertEquals(8, names.size());
        assertTrue(workbookXml.indexOf("name=\"Summary\"") < workbookXml.indexOf("name=\"Functional Processes\""));
        assertTrue(workbookXml.indexOf("name=\"Functional Processes\"") < workbookXml.indexOf("name=\"Data Movements\""));
    }
}

package work.lcod.cosmic.xlsx;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;

/**
 * Ordered sheets of one spreadsheet. Position decides tab order and the 1-based sheet identifiers.
 */
public record Workbook(List<Sheet> sheets) {
    public Workbook {
        if (sheets == null || sheets.isEmpty()) {
            throw new IllegalArgumentException("A workbook needs at least one sheet");
        }
        sheets = List.copyOf(sheets);
        var names = new HashSet<String>();
        for (var sheet : sheets) {
            if (!names.add(sheet.name().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Duplicate sheet name: '" + sheet.name() + "'");
            }
        }
    }

    public static Workbook of(Sheet... sheets) {
        return new Workbook(List.of(sheets));
    }

    public int size() {
        return sheets.size();
    }
}

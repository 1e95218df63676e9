package work.lcod.cosmic.xlsx;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Named worksheet: ordered rows of cell values. The first row is usually a header, which the writer does not enforce.
 */
public record Sheet(String name, List<List<CellValue>> rows) {
    static final int MAX_NAME_LENGTH = 31;
    private static final String FORBIDDEN_NAME_CHARS = "[]:*?/\\";

    public Sheet {
        Objects.requireNonNull(name, "name");
        if (name.isBlank() || name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Sheet name must be 1-" + MAX_NAME_LENGTH + " characters: '" + name + "'");
        }
        for (char ch : name.toCharArray()) {
            if (FORBIDDEN_NAME_CHARS.indexOf(ch) >= 0) {
                throw new IllegalArgumentException("Sheet name must not contain '" + ch + "': '" + name + "'");
            }
        }
        Objects.requireNonNull(rows, "rows");
        var copy = new ArrayList<List<CellValue>>(rows.size());
        for (var row : rows) {
            copy.add(row.stream().map(CellValue::of).toList());
        }
        rows = List.copyOf(copy);
    }

    /**
     * Builds a sheet from plain Java values, converted with {@link CellValue#of(Object)}.
     */
    public static Sheet of(String name, List<? extends List<?>> rows) {
        var converted = new ArrayList<List<CellValue>>(rows.size());
        for (var row : rows) {
            var cells = new ArrayList<CellValue>(row.size());
            for (Object value : row) {
                cells.add(CellValue.of(value));
            }
            converted.add(cells);
        }
        return new Sheet(name, converted);
    }
}

package work.lcod.cosmic.xlsx;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Writes single {@code <c>} elements of SpreadsheetML sheet data.
 */
public final class CellEncoder {
    /** Day zero of spreadsheet serial dates (keeps the 1900 leap-year quirk aligned). */
    public static final LocalDate EPOCH = LocalDate.of(1899, 12, 30);
    /** Index of the date format in {@code xl/styles.xml}. */
    public static final int DATE_STYLE_INDEX = 1;

    private CellEncoder() {}

    public static String encode(CellValue value, int row, int column) {
        String ref = cellReference(row, column);
        if (value == null || value instanceof CellValue.Blank) {
            return "<c r=\"" + ref + "\"/>";
        }
        if (value instanceof CellValue.WholeNumber number) {
            return "<c r=\"" + ref + "\"><v>" + number.value() + "</v></c>";
        }
        if (value instanceof CellValue.DecimalNumber number) {
            return "<c r=\"" + ref + "\"><v>" + Double.toString(number.value()) + "</v></c>";
        }
        if (value instanceof CellValue.DateValue date) {
            return "<c r=\"" + ref + "\" s=\"" + DATE_STYLE_INDEX + "\"><v>" + serialDay(date.value()) + "</v></c>";
        }
        if (value instanceof CellValue.Text text) {
            return "<c r=\"" + ref + "\" t=\"inlineStr\"><is><t xml:space=\"preserve\">"
                + escape(text.value())
                + "</t></is></c>";
        }
        throw new IllegalArgumentException("Unsupported cell value: " + value);
    }

    /**
     * Bijective base-26 column name: 1 is {@code A}, 26 is {@code Z}, 27 is {@code AA}.
     */
    public static String columnLetter(int index) {
        if (index < 1) {
            throw new IllegalArgumentException("Column index must be >= 1: " + index);
        }
        var letters = new StringBuilder();
        int remaining = index;
        while (remaining > 0) {
            remaining -= 1;
            letters.append((char) ('A' + remaining % 26));
            remaining /= 26;
        }
        return letters.reverse().toString();
    }

    public static String cellReference(int row, int column) {
        if (row < 1) {
            throw new IllegalArgumentException("Row index must be >= 1: " + row);
        }
        return columnLetter(column) + row;
    }

    public static long serialDay(LocalDate date) {
        return ChronoUnit.DAYS.between(EPOCH, date);
    }

    /**
     * Escapes XML markup characters and drops code points XML 1.0 cannot carry.
     */
    public static String escape(String text) {
        var out = new StringBuilder(text.length() + 16);
        text.codePoints().forEach(cp -> {
            switch (cp) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&apos;");
                default -> {
                    if (isXmlChar(cp)) {
                        out.appendCodePoint(cp);
                    }
                }
            }
        });
        return out.toString();
    }

    private static boolean isXmlChar(int cp) {
        return cp == 0x9 || cp == 0xA || cp == 0xD
            || (cp >= 0x20 && cp <= 0xD7FF)
            || (cp >= 0xE000 && cp <= 0xFFFD)
            || (cp >= 0x10000 && cp <= 0x10FFFF);
    }
}

package work.lcod.cosmic.xlsx;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Static value of one worksheet cell.
 */
public sealed interface CellValue
    permits CellValue.Blank, CellValue.WholeNumber, CellValue.DecimalNumber, CellValue.Text, CellValue.DateValue {

    Blank BLANK = new Blank();

    record Blank() implements CellValue {}

    record WholeNumber(long value) implements CellValue {}

    record DecimalNumber(double value) implements CellValue {
        public DecimalNumber {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Cell numbers must be finite: " + value);
            }
        }
    }

    record Text(String value) implements CellValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }
    }

    record DateValue(LocalDate value) implements CellValue {
        public DateValue {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Maps a plain Java value: {@code null} to blank, integral numbers to whole numbers, other numbers to decimals,
     * {@link LocalDate} to a date, anything else (booleans and non-finite numbers included) to its text.
     */
    static CellValue of(Object value) {
        if (value == null) {
            return BLANK;
        }
        if (value instanceof CellValue cell) {
            return cell;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new WholeNumber(((Number) value).longValue());
        }
        if (value instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            return new WholeNumber(big.longValue());
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal || value instanceof BigInteger) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? new DecimalNumber(number) : new Text(String.valueOf(value));
        }
        if (value instanceof LocalDate date) {
            return new DateValue(date);
        }
        return new Text(String.valueOf(value));
    }
}

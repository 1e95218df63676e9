package work.lcod.cosmic.config.yaml;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;
import work.lcod.cosmic.config.ParsedValue;

/**
 * Types a raw scalar token: quoted string, boolean, null, integer, decimal, or plain string.
 *
 * <p>Keywords are matched case-insensitively. Anything that does not parse stays a string.
 */
public final class ScalarCoercion {
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private ScalarCoercion() {}

    public static ParsedValue.Scalar coerce(String token) {
        if (token == null) {
            return ParsedValue.Scalar.NULL;
        }
        String value = token.trim();
        if (isQuoted(value)) {
            return ParsedValue.Scalar.of(value.substring(1, value.length() - 1));
        }
        String lowered = value.toLowerCase(Locale.ROOT);
        if ("true".equals(lowered) || "false".equals(lowered)) {
            return ParsedValue.Scalar.of(Boolean.valueOf(lowered));
        }
        if ("null".equals(lowered)) {
            return ParsedValue.Scalar.NULL;
        }
        if (INTEGER.matcher(value).matches()) {
            var integer = new BigInteger(value);
            return ParsedValue.Scalar.of(integer.bitLength() < Long.SIZE ? (Object) integer.longValue() : integer);
        }
        if (value.indexOf('.') >= 0 && DECIMAL.matcher(value).matches()) {
            return ParsedValue.Scalar.of(Double.parseDouble(value));
        }
        return ParsedValue.Scalar.of(value);
    }

    private static boolean isQuoted(String value) {
        if (value.length() < 2) {
            return false;
        }
        char first = value.charAt(0);
        return (first == '\'' || first == '"') && value.charAt(value.length() - 1) == first;
    }
}

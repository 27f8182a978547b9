package amplTransformator;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Strict number recognition for .dat literals. {@link Double#parseDouble(String)} alone
 * also accepts hex floats and type suffixes like "1d", which are not valid data here.
 */
public final class DatNumbers {

    private static final Pattern DECIMAL = Pattern.compile("^[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?$");

    private DatNumbers() {
    }

    /**
     * @return the parsed value, or {@code null} if the literal is not a number
     */
    public static Double tryParse(String literal) {
        String s = literal.trim();
        if (DECIMAL.matcher(s).matches()) {
            return Double.parseDouble(s);
        }
        String unsigned = s;
        boolean negative = false;
        if (s.startsWith("+") || s.startsWith("-")) {
            negative = s.charAt(0) == '-';
            unsigned = s.substring(1);
        }
        switch (unsigned.toLowerCase(Locale.ROOT)) {
            case "inf":
            case "infinity":
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            case "nan":
                return Double.NaN;
            default:
                return null;
        }
    }
}

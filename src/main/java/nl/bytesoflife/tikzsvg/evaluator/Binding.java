package nl.bytesoflife.tikzsvg.evaluator;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Value bound to a variable. Loop values such as {@code red} or {@code A} are kept as text,
 * everything that evaluates to a number is stored numerically.
 */
public record Binding(double number, String text) {

    public static Binding number(double value) {
        return new Binding(value, null);
    }

    public static Binding text(String value) {
        return new Binding(Double.NaN, value);
    }

    public boolean isNumeric() {
        return text == null;
    }

    /**
     * Text form used when the value is substituted into labels, names or option values.
     * Integral numbers print without a fraction.
     */
    public String asText() {
        if (!isNumeric()) {
            return text;
        }
        return formatNumber(number);
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            long whole = (long) value;
            return Long.toString(whole);
        }
        String plain = new BigDecimal(value).setScale(6, RoundingMode.HALF_UP)
            .stripTrailingZeros().toPlainString();
        return plain.equals("-0") ? "0" : plain;
    }
}

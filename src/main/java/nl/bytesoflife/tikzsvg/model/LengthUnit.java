package nl.bytesoflife.tikzsvg.model;

import java.util.Locale;

/**
 * Length units accepted in coordinates and option values, with their size in centimetres.
 */
public enum LengthUnit {
    CM("cm", 1.0),
    MM("mm", 0.1),
    PT("pt", 2.54 / 72.27),
    BP("bp", 2.54 / 72.0),
    IN("in", 2.54);

    private final String suffix;
    private final double centimetres;

    LengthUnit(String suffix, double centimetres) {
        this.suffix = suffix;
        this.centimetres = centimetres;
    }

    public String getSuffix() {
        return suffix;
    }

    public double toCentimetres(double value) {
        return value * centimetres;
    }

    /**
     * Splits a trailing unit suffix off a length such as {@code 2.5mm} or {@code \r pt}.
     * Values without a suffix are in centimetres.
     */
    public static Length split(String raw) {
        String trimmed = raw.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (LengthUnit unit : values()) {
            if (lower.endsWith(unit.suffix) && lower.length() > unit.suffix.length()) {
                // "\rpt" is a variable, not a unit
                if (isVariableTail(trimmed, trimmed.length() - unit.suffix.length())) {
                    continue;
                }
                return new Length(trimmed.substring(0, trimmed.length() - unit.suffix.length()).trim(), unit);
            }
        }
        return new Length(trimmed, CM);
    }

    private static boolean isVariableTail(String text, int suffixStart) {
        int i = suffixStart - 1;
        while (i >= 0 && Character.isLetter(text.charAt(i))) {
            i--;
        }
        return i >= 0 && text.charAt(i) == '\\';
    }

    /**
     * An unevaluated magnitude expression with its unit.
     */
    public record Length(String expression, LengthUnit unit) {
    }
}

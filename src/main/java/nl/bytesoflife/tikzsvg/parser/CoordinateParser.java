package nl.bytesoflife.tikzsvg.parser;

import nl.bytesoflife.tikzsvg.model.Coordinate;
import nl.bytesoflife.tikzsvg.model.LengthUnit;

import java.util.regex.Pattern;

/**
 * Classifies the text between parentheses: a top-level comma makes it cartesian, a top-level
 * colon polar, anything else a named coordinate with an optional {@code .anchor}.
 */
public class CoordinateParser {

    private static final Pattern ANCHOR = Pattern.compile("[a-z]+(?: [a-z]+)*|\\d+(?:\\.\\d+)?");

    public Coordinate parse(String raw) {
        String text = raw.trim();
        if (text.isEmpty()) {
            throw new ParseException("Empty coordinate");
        }
        if (text.startsWith("$")) {
            throw new ParseException("Coordinate calculations are not supported: (" + text + ")");
        }

        int comma = OptionListParser.indexOfTopLevel(text, ',');
        if (comma >= 0) {
            String yPart = text.substring(comma + 1);
            if (OptionListParser.indexOfTopLevel(yPart, ',') >= 0) {
                throw new ParseException("Three-dimensional coordinates are not supported: (" + text + ")");
            }
            LengthUnit.Length x = LengthUnit.split(OptionListParser.stripBraces(text.substring(0, comma).trim()));
            LengthUnit.Length y = LengthUnit.split(OptionListParser.stripBraces(yPart.trim()));
            requireValue(x.expression(), text);
            requireValue(y.expression(), text);
            return new Coordinate.Cartesian(x.expression(), x.unit(), y.expression(), y.unit());
        }

        int colon = OptionListParser.indexOfTopLevel(text, ':');
        if (colon >= 0) {
            String angle = OptionListParser.stripBraces(text.substring(0, colon).trim());
            LengthUnit.Length radius = LengthUnit.split(OptionListParser.stripBraces(text.substring(colon + 1).trim()));
            requireValue(angle, text);
            requireValue(radius.expression(), text);
            return new Coordinate.Polar(angle, radius.expression(), radius.unit());
        }

        int dot = text.lastIndexOf('.');
        if (dot > 0 && dot < text.length() - 1) {
            String anchor = text.substring(dot + 1).trim();
            String name = text.substring(0, dot).trim();
            if (ANCHOR.matcher(anchor).matches() && !isNumber(name)) {
                return new Coordinate.Named(name, anchor);
            }
        }
        return new Coordinate.Named(text, null);
    }

    private static boolean isNumber(String text) {
        return text.chars().allMatch(Character::isDigit);
    }

    private static void requireValue(String value, String text) {
        if (value.isEmpty()) {
            throw new ParseException("Missing coordinate component in (" + text + ")");
        }
    }
}

package nl.bytesoflife.tikzsvg.parser;

import nl.bytesoflife.tikzsvg.ConversionException;

/**
 * Malformed input: unbalanced groups, unknown commands, missing macro arguments and the like.
 */
public class ParseException extends ConversionException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, int line, int column) {
        super(message, line, column);
    }

    /**
     * Builds an exception whose location is derived from an offset into {@code source}.
     */
    public static ParseException at(String message, String source, int offset) {
        int line = 1;
        int column = 1;
        int end = Math.min(offset, source.length());
        for (int i = 0; i < end; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new ParseException(message, line, column);
    }
}

package nl.bytesoflife.tikzsvg.evaluator;

import nl.bytesoflife.tikzsvg.ConversionException;

/**
 * A loop value tuple does not have one entry per loop variable.
 */
public class ArityMismatchException extends ConversionException {

    public ArityMismatchException(String value, int expected, int actual) {
        super("Loop value '" + value + "' has " + actual + " part(s), expected " + expected);
    }
}

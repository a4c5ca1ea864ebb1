package nl.bytesoflife.tikzsvg.renderer.svg;

import nl.bytesoflife.tikzsvg.ConversionException;

/**
 * A relative coordinate or pen-centred operation was used before the path had a position.
 */
public class NoCurrentPositionException extends ConversionException {

    public NoCurrentPositionException(String construct) {
        super("No current position for " + construct + "; start the path with an absolute coordinate");
    }
}

package nl.bytesoflife.tikzsvg.model;

/**
 * A text label: options, optional name and raw text. Position is supplied by the context
 * (an {@code at} clause or the pen position on a path).
 */
public record NodeSpec(OptionList options, String name, String text) {
}

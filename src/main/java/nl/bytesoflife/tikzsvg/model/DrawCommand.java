package nl.bytesoflife.tikzsvg.model;

public enum DrawCommand {
    DRAW,
    FILL,
    FILLDRAW,
    CLIP,
    /** {@code \path}: neither stroked nor filled unless options say so. */
    PATH
}

package nl.bytesoflife.tikzsvg.model;

public enum SegmentOperation {
    MOVETO,
    LINETO,
    CURVETO,
    ARC,
    CIRCLE,
    ELLIPSE,
    RECTANGLE,
    GRID,
    /** {@code -|}: horizontal first, then vertical. */
    HORIZONTAL_THEN_VERTICAL,
    /** {@code |-}: vertical first, then horizontal. */
    VERTICAL_THEN_HORIZONTAL,
    CLOSE
}

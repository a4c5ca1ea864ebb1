package nl.bytesoflife.tikzsvg.renderer.svg;

/**
 * Output settings for one conversion. Immutable; the {@code with*} methods return copies.
 */
public final class SvgOptions {

    public static final double DEFAULT_SIZE = 500;
    /** Pixels per centimetre. */
    public static final double DEFAULT_SCALE = 28.35;
    /** Pixel offset applied for compass anchors such as {@code A.north}. */
    public static final double DEFAULT_ANCHOR_DISTANCE = 10;
    public static final int DEFAULT_MAX_MACRO_DEPTH = 20;

    private final double width;
    private final double height;
    private final double scale;
    private final boolean fitToContent;
    private final double margin;
    private final double anchorDistance;
    private final int maxMacroDepth;

    private SvgOptions(double width, double height, double scale, boolean fitToContent, double margin,
                       double anchorDistance, int maxMacroDepth) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Width and height must be positive: " + width + "x" + height);
        }
        if (scale <= 0) {
            throw new IllegalArgumentException("Scale must be positive: " + scale);
        }
        if (margin < 0) {
            throw new IllegalArgumentException("Margin must not be negative: " + margin);
        }
        this.width = width;
        this.height = height;
        this.scale = scale;
        this.fitToContent = fitToContent;
        this.margin = margin;
        if (maxMacroDepth < 1) {
            throw new IllegalArgumentException("Macro depth must be at least 1: " + maxMacroDepth);
        }
        this.anchorDistance = anchorDistance;
        this.maxMacroDepth = maxMacroDepth;
    }

    /**
     * 500x500 pixels, 28.35 pixels per centimetre, origin in the centre.
     */
    public static SvgOptions defaults() {
        return new SvgOptions(DEFAULT_SIZE, DEFAULT_SIZE, DEFAULT_SCALE, false, 0, DEFAULT_ANCHOR_DISTANCE,
            DEFAULT_MAX_MACRO_DEPTH);
    }

    public SvgOptions withSize(double width, double height) {
        return new SvgOptions(width, height, scale, fitToContent, margin, anchorDistance, maxMacroDepth);
    }

    public SvgOptions withScale(double scale) {
        return new SvgOptions(width, height, scale, fitToContent, margin, anchorDistance, maxMacroDepth);
    }

    /**
     * Shrinks the view box to the drawn content plus {@code margin} pixels on every side.
     */
    public SvgOptions withFitToContent(double margin) {
        return new SvgOptions(width, height, scale, true, margin, anchorDistance, maxMacroDepth);
    }

    public SvgOptions withAnchorDistance(double anchorDistance) {
        return new SvgOptions(width, height, scale, fitToContent, margin, anchorDistance, maxMacroDepth);
    }

    /** Bound on nested macro and style expansion. */
    public SvgOptions withMaxMacroDepth(int maxMacroDepth) {
        return new SvgOptions(width, height, scale, fitToContent, margin, anchorDistance, maxMacroDepth);
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getScale() {
        return scale;
    }

    public boolean isFitToContent() {
        return fitToContent;
    }

    public double getMargin() {
        return margin;
    }

    public double getAnchorDistance() {
        return anchorDistance;
    }

    public int getMaxMacroDepth() {
        return maxMacroDepth;
    }

    public double getOriginX() {
        return width / 2;
    }

    public double getOriginY() {
        return height / 2;
    }

    @Override
    public String toString() {
        return "SvgOptions{" + width + "x" + height + ", scale=" + scale
            + (fitToContent ? ", fit margin=" + margin : "") + "}";
    }
}

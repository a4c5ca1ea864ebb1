package nl.bytesoflife.tikzsvg.renderer.svg;

/**
 * Maps picture coordinates (centimetres, origin in the middle, y up) to output pixels
 * (origin top-left, y down): {@code outX = originX + x*scale}, {@code outY = originY - y*scale}.
 */
public class CoordinateTransformer {

    private final double originX;
    private final double originY;
    private final double scale;

    public CoordinateTransformer(SvgOptions options) {
        this(options.getOriginX(), options.getOriginY(), options.getScale());
    }

    public CoordinateTransformer(double originX, double originY, double scale) {
        this.originX = originX;
        this.originY = originY;
        this.scale = scale;
    }

    public Point toSvg(double x, double y) {
        return new Point(originX + x * scale, originY - y * scale);
    }

    public Point toSvg(Transform transform, double x, double y) {
        return toSvg(transform.applyX(x), transform.applyY(y));
    }

    /** Pixel length of {@code centimetres} under {@code transform}. */
    public double length(Transform transform, double centimetres) {
        return centimetres * scale * transform.scale();
    }

    public Point origin() {
        return new Point(originX, originY);
    }

    public double getScale() {
        return scale;
    }
}

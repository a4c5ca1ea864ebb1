package nl.bytesoflife.tikzsvg.renderer.svg;

/**
 * A position in output (pixel) space: origin top-left, y pointing down.
 */
public record Point(double x, double y) {

    public Point plus(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public Point interpolate(Point other, double t) {
        return new Point(x + (other.x - x) * t, y + (other.y - y) * t);
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    public boolean sameAs(Point other) {
        return other != null && Math.abs(x - other.x) < 1e-9 && Math.abs(y - other.y) < 1e-9;
    }

    @Override
    public String toString() {
        return SvgFormat.number(x) + " " + SvgFormat.number(y);
    }
}

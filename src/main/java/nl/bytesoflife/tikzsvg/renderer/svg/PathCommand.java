package nl.bytesoflife.tikzsvg.renderer.svg;

/**
 * SVG path data primitives.
 */
public sealed interface PathCommand permits PathCommand.MoveTo, PathCommand.LineTo, PathCommand.QuadTo,
    PathCommand.CubicTo, PathCommand.ArcTo, PathCommand.Close {

    String toSvg();

    /** Position of the SVG current point after this command, {@code null} for close. */
    Point end();

    record MoveTo(Point point) implements PathCommand {
        @Override
        public String toSvg() {
            return "M " + point;
        }

        @Override
        public Point end() {
            return point;
        }
    }

    record LineTo(Point point) implements PathCommand {
        @Override
        public String toSvg() {
            return "L " + point;
        }

        @Override
        public Point end() {
            return point;
        }
    }

    record QuadTo(Point control, Point point) implements PathCommand {
        @Override
        public String toSvg() {
            return "Q " + control + " " + point;
        }

        @Override
        public Point end() {
            return point;
        }
    }

    record CubicTo(Point control1, Point control2, Point point) implements PathCommand {
        @Override
        public String toSvg() {
            return "C " + control1 + " " + control2 + " " + point;
        }

        @Override
        public Point end() {
            return point;
        }
    }

    record ArcTo(double rx, double ry, boolean largeArc, boolean sweep, Point point) implements PathCommand {
        @Override
        public String toSvg() {
            return "A " + SvgFormat.number(rx) + " " + SvgFormat.number(ry) + " 0 "
                + (largeArc ? 1 : 0) + " " + (sweep ? 1 : 0) + " " + point;
        }

        @Override
        public Point end() {
            return point;
        }
    }

    record Close() implements PathCommand {
        @Override
        public String toSvg() {
            return "Z";
        }

        @Override
        public Point end() {
            return null;
        }
    }
}

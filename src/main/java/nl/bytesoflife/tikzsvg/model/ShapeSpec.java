package nl.bytesoflife.tikzsvg.model;

/**
 * Extra parameters of the path operations that are not plain coordinates.
 * Values are unevaluated length or angle expressions.
 */
public sealed interface ShapeSpec permits ShapeSpec.Radii, ShapeSpec.Arc, ShapeSpec.Grid {

    /** Circle and ellipse radii. */
    record Radii(String xRadius, String yRadius) implements ShapeSpec {
    }

    /** Exactly one of {@code endAngle} and {@code deltaAngle} is set. */
    record Arc(String startAngle, String endAngle, String deltaAngle, String xRadius, String yRadius) implements ShapeSpec {
    }

    record Grid(String xStep, String yStep) implements ShapeSpec {
        public static Grid unit() {
            return new Grid("1", "1");
        }
    }
}

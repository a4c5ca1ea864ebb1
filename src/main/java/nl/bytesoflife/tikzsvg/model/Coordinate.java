package nl.bytesoflife.tikzsvg.model;

/**
 * A position in a path. Components are kept as unevaluated expressions; the resolver evaluates
 * them against the variable scope in effect when the statement is rendered.
 */
public sealed interface Coordinate permits Coordinate.Cartesian, Coordinate.Polar, Coordinate.Named, Coordinate.Relative {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitCartesian(Cartesian coordinate);

        R visitPolar(Polar coordinate);

        R visitNamed(Named coordinate);

        R visitRelative(Relative coordinate);
    }

    /** {@code (x, y)}; each component carries its own unit. */
    record Cartesian(String x, LengthUnit xUnit, String y, LengthUnit yUnit) implements Coordinate {
        public static Cartesian of(String x, String y) {
            return new Cartesian(x, LengthUnit.CM, y, LengthUnit.CM);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCartesian(this);
        }
    }

    /** {@code (angle:radius)}, angle in degrees. */
    record Polar(String angle, String radius, LengthUnit unit) implements Coordinate {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPolar(this);
        }
    }

    /** {@code (A)} or {@code (A.north)}; anchor is {@code null} when absent. */
    record Named(String name, String anchor) implements Coordinate {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNamed(this);
        }
    }

    /** {@code ++(dx,dy)} when persistent, {@code +(dx,dy)} otherwise. */
    record Relative(Coordinate delta, boolean persistent) implements Coordinate {
        public Relative {
            if (delta instanceof Relative || delta instanceof Named) {
                throw new IllegalArgumentException("Relative offset must be cartesian or polar: " + delta);
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRelative(this);
        }
    }
}

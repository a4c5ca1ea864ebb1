package nl.bytesoflife.tikzsvg.renderer.svg;

import nl.bytesoflife.tikzsvg.evaluator.EvaluationException;
import nl.bytesoflife.tikzsvg.evaluator.ExpressionEvaluator;
import nl.bytesoflife.tikzsvg.evaluator.TextSubstitution;
import nl.bytesoflife.tikzsvg.model.Coordinate;
import nl.bytesoflife.tikzsvg.model.LengthUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Turns coordinates into output positions.
 * <p>
 * Numeric components that fail to evaluate become 0 (with a warning). Unknown names resolve to
 * the output origin, also with a warning. Relative coordinates need a pen position and fail with
 * {@link NoCurrentPositionException} without one.
 */
public class CoordinateResolver {

    private static final Logger log = LoggerFactory.getLogger(CoordinateResolver.class);

    private static final double DIAGONAL = Math.sqrt(0.5);

    private final CoordinateTransformer transformer;
    private final ExpressionEvaluator evaluator;
    private final NamedCoordinateRegistry registry;
    private final double anchorDistance;

    public CoordinateResolver(CoordinateTransformer transformer, ExpressionEvaluator evaluator,
                              NamedCoordinateRegistry registry, double anchorDistance) {
        this.transformer = transformer;
        this.evaluator = evaluator;
        this.registry = registry;
        this.anchorDistance = anchorDistance;
    }

    /**
     * @param pen current pen position, or {@code null} at the start of a path
     */
    public Point resolve(Coordinate coordinate, Point pen, RenderScope scope) {
        Point point = coordinate.accept(new Coordinate.Visitor<Point>() {
            @Override
            public Point visitCartesian(Coordinate.Cartesian c) {
                double x = c.xUnit().toCentimetres(evalValue(c.x(), scope));
                double y = c.yUnit().toCentimetres(evalValue(c.y(), scope));
                return transformer.toSvg(scope.transform(), x, y);
            }

            @Override
            public Point visitPolar(Coordinate.Polar c) {
                double angle = Math.toRadians(evalValue(c.angle(), scope));
                double radius = c.unit().toCentimetres(evalValue(c.radius(), scope));
                return transformer.toSvg(scope.transform(), radius * Math.cos(angle), radius * Math.sin(angle));
            }

            @Override
            public Point visitNamed(Coordinate.Named c) {
                return resolveNamed(c, scope);
            }

            @Override
            public Point visitRelative(Coordinate.Relative c) {
                if (pen == null) {
                    throw new NoCurrentPositionException((c.persistent() ? "++" : "+") + " coordinate");
                }
                double[] delta = offset(c.delta(), scope);
                return pen.plus(delta[0], delta[1]);
            }
        });
        if (!point.isFinite()) {
            log.warn("Coordinate {} resolved to a non-finite position, using the origin", coordinate);
            return transformer.origin();
        }
        return point;
    }

    /**
     * Pixel offset of a cartesian or polar coordinate, used for relative moves.
     */
    private double[] offset(Coordinate delta, RenderScope scope) {
        double dx;
        double dy;
        if (delta instanceof Coordinate.Cartesian c) {
            dx = c.xUnit().toCentimetres(evalValue(c.x(), scope));
            dy = c.yUnit().toCentimetres(evalValue(c.y(), scope));
        } else if (delta instanceof Coordinate.Polar p) {
            double angle = Math.toRadians(evalValue(p.angle(), scope));
            double radius = p.unit().toCentimetres(evalValue(p.radius(), scope));
            dx = radius * Math.cos(angle);
            dy = radius * Math.sin(angle);
        } else {
            throw new IllegalArgumentException("Unsupported relative offset " + delta);
        }
        return new double[]{
            transformer.length(scope.transform(), dx),
            -transformer.length(scope.transform(), dy)
        };
    }

    private Point resolveNamed(Coordinate.Named coordinate, RenderScope scope) {
        String name = TextSubstitution.substitute(coordinate.name(), scope.variables()).trim();
        String anchor = coordinate.anchor();
        if (anchor != null) {
            Point stored = registry.lookup(name + "." + anchor).orElse(null);
            if (stored != null) {
                return stored;
            }
        }
        Point base = registry.lookup(name).orElse(null);
        if (base == null) {
            log.warn("Unknown coordinate '{}', using the origin", name);
            return transformer.origin();
        }
        if (anchor == null) {
            return base;
        }
        double[] direction = anchorDirection(anchor);
        return base.plus(direction[0] * anchorDistance, direction[1] * anchorDistance);
    }

    /**
     * Unit offset of a compass or angle anchor in output space (y down).
     */
    static double[] anchorDirection(String anchor) {
        switch (anchor.toLowerCase(Locale.ROOT)) {
            case "north":
                return new double[]{0, -1};
            case "south":
                return new double[]{0, 1};
            case "east":
                return new double[]{1, 0};
            case "west":
                return new double[]{-1, 0};
            case "north east":
                return new double[]{DIAGONAL, -DIAGONAL};
            case "north west":
                return new double[]{-DIAGONAL, -DIAGONAL};
            case "south east":
                return new double[]{DIAGONAL, DIAGONAL};
            case "south west":
                return new double[]{-DIAGONAL, DIAGONAL};
            default:
                break;
        }
        try {
            double angle = Math.toRadians(Double.parseDouble(anchor));
            return new double[]{Math.cos(angle), -Math.sin(angle)};
        } catch (NumberFormatException e) {
            // center, base, mid and unknown anchors sit on the coordinate itself
            return new double[]{0, 0};
        }
    }

    public void store(String name, Point position) {
        registry.store(name, position);
        log.trace("Stored coordinate {} at {}", name, position);
    }

    /**
     * Evaluates a numeric component; failures become 0 so a single bad value does not abort
     * the picture.
     */
    public double evalValue(String expression, RenderScope scope) {
        try {
            return evaluator.evaluate(expression, scope.variables());
        } catch (EvaluationException e) {
            log.warn("{}; using 0", e.getMessage());
            return 0;
        }
    }

    /**
     * Evaluates a length such as {@code 1cm}, {@code 5mm} or {@code \r} and returns pixels.
     */
    public double evalLength(String raw, RenderScope scope) {
        LengthUnit.Length length = LengthUnit.split(raw);
        double centimetres = length.unit().toCentimetres(evalValue(length.expression(), scope));
        return transformer.length(scope.transform(), centimetres);
    }

    public CoordinateTransformer getTransformer() {
        return transformer;
    }

    public NamedCoordinateRegistry getRegistry() {
        return registry;
    }
}

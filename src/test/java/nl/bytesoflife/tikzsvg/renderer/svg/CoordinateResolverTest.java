package nl.bytesoflife.tikzsvg.renderer.svg;

import nl.bytesoflife.tikzsvg.evaluator.Binding;
import nl.bytesoflife.tikzsvg.evaluator.EvaluationContext;
import nl.bytesoflife.tikzsvg.evaluator.ExpressionEvaluator;
import nl.bytesoflife.tikzsvg.model.Coordinate;
import nl.bytesoflife.tikzsvg.model.LengthUnit;
import nl.bytesoflife.tikzsvg.parser.CoordinateParser;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CoordinateResolverTest {

    private static final double EPSILON = 0.005;

    private final EvaluationContext context = new EvaluationContext();
    private final NamedCoordinateRegistry registry = new NamedCoordinateRegistry();
    private final CoordinateResolver resolver = new CoordinateResolver(
        new CoordinateTransformer(SvgOptions.defaults()), new ExpressionEvaluator(), registry,
        SvgOptions.DEFAULT_ANCHOR_DISTANCE);
    private final CoordinateParser parser = new CoordinateParser();
    private final RenderScope scope = new RenderScope(context.root(), Map.of(), Transform.identity());

    private Point resolve(String text) {
        return resolver.resolve(parser.parse(text), null, scope);
    }

    private static void assertPoint(double x, double y, Point actual) {
        assertEquals(x, actual.x(), EPSILON, "x of " + actual);
        assertEquals(y, actual.y(), EPSILON, "y of " + actual);
    }

    @Test
    void mapsCartesianToOutputSpace() {
        assertPoint(250, 250, resolve("0,0"));
        assertPoint(306.70, 193.30, resolve("2,2"));
        assertPoint(363.40, 250.00, resolve("4,0"));
        assertPoint(250, 278.35, resolve("0,-1"));
    }

    @Test
    void honoursUnits() {
        assertPoint(250 + 28.35, 250, resolve("10mm,0"));
        assertPoint(250 + 2.54 * 28.35, 250, resolve("1in,0"));
    }

    @Test
    void mapsPolar() {
        assertPoint(250, 250 - 28.35, resolve("90:1"));
        assertPoint(250 - 2 * 28.35, 250, resolve("180:2"));
    }

    @Test
    void evaluatesVariables() {
        context.root().defineNumber("x", 2);
        assertPoint(306.70, 193.30, resolve("\\x, \\x"));
        assertPoint(250 + 4 * 28.35, 250, resolve("2*\\x, 0"));
    }

    @Test
    void badComponentBecomesZero() {
        assertPoint(250, 193.30, resolve("\\undefined, 2"));
    }

    @Test
    void namedCoordinateEqualsDirectPosition() {
        resolver.store("A", resolve("2,2"));
        Point named = resolver.resolve(new Coordinate.Named("A", null), null, scope);
        assertPoint(306.70, 193.30, named);
    }

    @Test
    void unknownNameResolvesToOrigin() {
        Point point = resolver.resolve(new Coordinate.Named("nowhere", null), null, scope);
        assertPoint(250, 250, point);
    }

    @Test
    void compassAnchorsOffsetFromTheCentre() {
        resolver.store("A", new Point(100, 100));
        assertPoint(100, 90, resolver.resolve(new Coordinate.Named("A", "north"), null, scope));
        assertPoint(110, 100, resolver.resolve(new Coordinate.Named("A", "east"), null, scope));
        assertPoint(100, 100, resolver.resolve(new Coordinate.Named("A", "center"), null, scope));
        assertPoint(90, 100, resolver.resolve(new Coordinate.Named("A", "180"), null, scope));
    }

    @Test
    void storedAnchorWins() {
        resolver.store("A", new Point(100, 100));
        resolver.store("A.north", new Point(1, 2));
        assertPoint(1, 2, resolver.resolve(new Coordinate.Named("A", "north"), null, scope));
    }

    @Test
    void nameIsSubstitutedFromVariables() {
        context.root().define("n", Binding.text("3"));
        resolver.store("p3", new Point(5, 6));
        assertPoint(5, 6, resolver.resolve(new Coordinate.Named("p\\n", null), null, scope));
    }

    @Test
    void relativeMovesFromThePen() {
        Coordinate relative = new Coordinate.Relative(Coordinate.Cartesian.of("1", "1"), true);
        Point pen = new Point(250, 250);
        assertPoint(278.35, 221.65, resolver.resolve(relative, pen, scope));
    }

    @Test
    void relativeWithoutPenFails() {
        Coordinate relative = new Coordinate.Relative(Coordinate.Cartesian.of("1", "0"), false);
        assertThrows(NoCurrentPositionException.class, () -> resolver.resolve(relative, null, scope));
    }

    @Test
    void scopeTransformScalesAndShifts() {
        RenderScope shifted = scope.withTransform(new Transform(2, 1, 0));
        Point point = resolver.resolve(Coordinate.Cartesian.of("1", "1"), null, shifted);
        assertPoint(250 + 3 * 28.35, 250 - 2 * 28.35, point);

        Coordinate relative = new Coordinate.Relative(Coordinate.Cartesian.of("1", "0"), true);
        assertPoint(250 + 2 * 28.35, 250, resolver.resolve(relative, new Point(250, 250), shifted));
    }

    @Test
    void evaluatesLengths() {
        assertEquals(28.35, resolver.evalLength("1cm", scope), 1e-9);
        assertEquals(14.175, resolver.evalLength("5mm", scope), 1e-9);
        assertEquals(28.35, resolver.evalLength("1", scope), 1e-9);
        assertEquals(LengthUnit.CM, LengthUnit.split("3").unit());
    }
}

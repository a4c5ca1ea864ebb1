package nl.bytesoflife.tikzsvg.parser;

import nl.bytesoflife.tikzsvg.model.Coordinate;
import nl.bytesoflife.tikzsvg.model.DrawCommand;
import nl.bytesoflife.tikzsvg.model.LoopHeader;
import nl.bytesoflife.tikzsvg.model.PathElement;
import nl.bytesoflife.tikzsvg.model.Picture;
import nl.bytesoflife.tikzsvg.model.SegmentOperation;
import nl.bytesoflife.tikzsvg.model.ShapeSpec;
import nl.bytesoflife.tikzsvg.model.Statement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TikzParserTest {

    private final TikzParser parser = new TikzParser();

    private static List<SegmentOperation> operations(Statement statement) {
        return ((Statement.DrawStatement) statement).path().elements().stream()
            .filter(e -> e instanceof PathElement.Segment)
            .map(e -> ((PathElement.Segment) e).operation())
            .collect(Collectors.toList());
    }

    @Test
    void parsesPictureEnvironmentWithOptions() {
        Picture picture = parser.parse("""
                \\begin{tikzpicture}[scale=2, thick]
                  \\draw (0,0) -- (1,1);
                \\end{tikzpicture}
                """);
        assertEquals(2, picture.options().options().size());
        assertEquals(1, picture.statements().size());
    }

    @Test
    void parsesBareStatements() {
        Picture picture = parser.parse("\\draw (0,0) -- (1,0); \\fill[red] (0,0) rectangle (1,1);");
        assertEquals(2, picture.statements().size());
        Statement.DrawStatement fill = (Statement.DrawStatement) picture.statements().get(1);
        assertEquals(DrawCommand.FILL, fill.command());
        assertTrue(fill.options().hasFlag("red"));
        assertEquals(List.of(SegmentOperation.MOVETO, SegmentOperation.RECTANGLE), operations(fill));
    }

    @Test
    void parsesEverySegmentOperator() {
        Picture picture = parser.parse(
            "\\draw (0,0) -- (1,0) -| (2,1) |- (3,2) to (4,0) -- ++(1,0) -- +(0,1) -- cycle;");
        assertEquals(List.of(
            SegmentOperation.MOVETO, SegmentOperation.LINETO, SegmentOperation.HORIZONTAL_THEN_VERTICAL,
            SegmentOperation.VERTICAL_THEN_HORIZONTAL, SegmentOperation.LINETO, SegmentOperation.LINETO,
            SegmentOperation.LINETO, SegmentOperation.CLOSE), operations(picture.statements().get(0)));

        List<PathElement> elements = ((Statement.DrawStatement) picture.statements().get(0)).path().elements();
        Coordinate persistent = ((PathElement.Segment) elements.get(5)).destination();
        Coordinate once = ((PathElement.Segment) elements.get(6)).destination();
        assertTrue(((Coordinate.Relative) persistent).persistent());
        assertFalse(((Coordinate.Relative) once).persistent());
    }

    @Test
    void parsesCurves() {
        Picture picture = parser.parse(
            "\\draw (0,0) .. controls (1,0) .. (2,0) .. controls (3,1) and (4,1) .. (5,0);");
        List<PathElement> elements = ((Statement.DrawStatement) picture.statements().get(0)).path().elements();
        PathElement.Segment quadratic = (PathElement.Segment) elements.get(1);
        PathElement.Segment cubic = (PathElement.Segment) elements.get(2);

        assertEquals(SegmentOperation.CURVETO, quadratic.operation());
        assertEquals(1, quadratic.controls().size());
        assertEquals(Coordinate.Cartesian.of("2", "0"), quadratic.destination());
        assertEquals(2, cubic.controls().size());
    }

    @Test
    void curveWithoutControlsIsRejected() {
        assertThrows(ParseException.class, () -> parser.parse("\\draw (0,0) .. (1,1);"));
    }

    @Test
    void parsesShapes() {
        Picture picture = parser.parse(
            "\\draw (0,0) circle (1) ellipse (2 and 1) circle [radius=3mm] arc (0:90:1) arc [start angle=0, delta angle=45, radius=2];"
                + "\\draw[step=0.5] (0,0) grid [step=0.5] (2,2);");
        List<PathElement> elements = ((Statement.DrawStatement) picture.statements().get(0)).path().elements();

        assertEquals(new ShapeSpec.Radii("1", "1"), ((PathElement.Segment) elements.get(1)).shape());
        assertEquals(new ShapeSpec.Radii("2", "1"), ((PathElement.Segment) elements.get(2)).shape());
        assertEquals(new ShapeSpec.Radii("3mm", "3mm"), ((PathElement.Segment) elements.get(3)).shape());
        assertEquals(new ShapeSpec.Arc("0", "90", null, "1", "1"), ((PathElement.Segment) elements.get(4)).shape());
        assertEquals(new ShapeSpec.Arc("0", null, "45", "2", "2"), ((PathElement.Segment) elements.get(5)).shape());

        PathElement.Segment grid = (PathElement.Segment) ((Statement.DrawStatement) picture.statements().get(1))
            .path().elements().get(1);
        assertEquals(SegmentOperation.GRID, grid.operation());
        assertEquals(new ShapeSpec.Grid("0.5", "0.5"), grid.shape());
    }

    @Test
    void parsesNodes() {
        Picture picture = parser.parse("\\node[above] (A) at (1,2) {Label}; \\node (B) at (0,0) [red] {x};");
        Statement.NodeStatement first = (Statement.NodeStatement) picture.statements().get(0);
        assertEquals("A", first.node().name());
        assertEquals("Label", first.node().text());
        assertEquals(Coordinate.Cartesian.of("1", "2"), first.position());
        assertTrue(first.node().options().hasFlag("above"));

        Statement.NodeStatement second = (Statement.NodeStatement) picture.statements().get(1);
        assertTrue(second.node().options().hasFlag("red"));
    }

    @Test
    void inlineNodeAfterConnectorGetsMidway() {
        Picture picture = parser.parse("\\draw (0,0) -- node {m} (2,0) node[right] {end};");
        List<PathElement> elements = ((Statement.DrawStatement) picture.statements().get(0)).path().elements();

        assertInstanceOf(PathElement.Segment.class, elements.get(1));
        PathElement.InlineNode midway = (PathElement.InlineNode) elements.get(2);
        assertTrue(midway.node().options().hasFlag("midway"));
        PathElement.InlineNode atEnd = (PathElement.InlineNode) elements.get(3);
        assertFalse(atEnd.node().options().hasFlag("midway"));
    }

    @Test
    void parsesCoordinatesAndScopes() {
        Picture picture = parser.parse("""
                \\coordinate (A) at (1,1);
                \\begin{scope}[color=red]
                  \\draw (A) -- (A.north);
                \\end{scope}
                """);
        assertInstanceOf(Statement.CoordinateDefinition.class, picture.statements().get(0));
        Statement.ScopeBlock scope = (Statement.ScopeBlock) picture.statements().get(1);
        assertEquals("red", scope.options().get("color").orElseThrow());
        assertEquals(1, scope.body().size());
    }

    @Test
    void parsesForeachHeaders() {
        Picture picture = parser.parse(
            "\\foreach \\x/\\n [evaluate=\\x as \\y using \\x*2, count=\\c from 0] in {1/a, 2/b} { \\node at (\\x,0) {\\n}; }"
                + "\\foreach \\i in {0,2,...,8} \\draw (\\i,0) -- (\\i,1);");
        Statement.ForeachLoop first = (Statement.ForeachLoop) picture.statements().get(0);
        LoopHeader header = first.header();
        assertEquals(List.of("x", "n"), header.variables());
        assertEquals(new LoopHeader.ExplicitList(List.of("1/a", "2/b")), header.values());
        assertEquals(List.of(new LoopHeader.EvaluateBinding("x", "y", "\\x*2")), header.evaluations());
        assertEquals(new LoopHeader.CountBinding("c", "0"), header.count());

        Statement.ForeachLoop second = (Statement.ForeachLoop) picture.statements().get(1);
        assertEquals(new LoopHeader.Range("0", "2", "8"), second.header().values());
        assertEquals(1, second.body().size());
    }

    @Test
    void parsesInlineForeach() {
        Picture picture = parser.parse("\\draw (0,0) \\foreach \\i in {1,2} { -- ++(\\i,1) };");
        List<PathElement> elements = ((Statement.DrawStatement) picture.statements().get(0)).path().elements();
        PathElement.InlineForeach loop = (PathElement.InlineForeach) elements.get(1);
        assertEquals(1, loop.body().size());
    }

    @Test
    void parsesLayersStylesAndMacros() {
        Picture picture = parser.parse("""
                \\pgfdeclarelayer{background}
                \\pgfsetlayers{background,main}
                \\tikzset{box/.style={draw, thick}}
                \\pgfmathsetmacro{\\r}{2*3}
                \\pgfmathtruncatemacro\\n{7/2}
                \\begin{pgfonlayer}{background}
                  \\fill (0,0) circle (1);
                \\end{pgfonlayer}
                """);
        List<Statement> statements = picture.statements();
        assertEquals(new Statement.LayerDeclaration("background"), statements.get(0));
        assertEquals(new Statement.LayerOrder(List.of("background", "main")), statements.get(1));
        assertEquals("box", ((Statement.StyleDefinition) statements.get(2)).name());
        assertEquals(new Statement.MacroDefinition("r", "2*3", false), statements.get(3));
        assertEquals(new Statement.MacroDefinition("n", "7/2", true), statements.get(4));
        assertEquals("background", ((Statement.LayerBlock) statements.get(5)).name());
    }

    @Test
    void syntaxErrorsReportTheLocation() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("\\draw (0,0) -- (1,1);\n\\draw (0,0) --;"));
        assertEquals(2, e.getLine());
        assertTrue(e.getMessage().contains("line 2"));
    }

    @Test
    void rejectsUnsupportedInput() {
        assertThrows(ParseException.class, () -> parser.parse("\\unknowncmd;"));
        assertThrows(ParseException.class, () -> parser.parse("\\draw (0,0) -- (1,1)"));
        assertThrows(ParseException.class, () -> parser.parse("\\begin{tikzpicture}\\draw (0,0);"));
        assertThrows(ParseException.class, () -> parser.parse("\\begin{tikzpicture}\\begin{scope}\\begin{tikzpicture}\\end{tikzpicture}\\end{scope}\\end{tikzpicture}"));
        assertThrows(ParseException.class, () -> parser.parse("\\foreach \\i in {1,...} {}"));
        assertThrows(ParseException.class, () -> parser.parse("\\draw ++(1,0) -- (A.north) -- (0,0) foo;"));
    }
}

package nl.bytesoflife.tikzsvg.renderer.svg;

import nl.bytesoflife.tikzsvg.evaluator.EvaluationContext;
import nl.bytesoflife.tikzsvg.evaluator.ExpressionEvaluator;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import java.util.Map;

import static nl.bytesoflife.tikzsvg.renderer.svg.OptionProcessor.*;
import static org.junit.jupiter.api.Assertions.*;

class LabelRendererTest {

    private final EvaluationContext context = new EvaluationContext();
    private final CoordinateResolver resolver = new CoordinateResolver(
        new CoordinateTransformer(SvgOptions.defaults()), new ExpressionEvaluator(), new NamedCoordinateRegistry(), 10);
    private final LabelRenderer labels = new LabelRenderer(resolver, new StyleConverter(), 10);
    private final RenderScope scope = new RenderScope(context.root(), Map.of(), Transform.identity());
    private final Point point = new Point(100, 100);

    private String render(String text, Map<String, Object> style) {
        return labels.render(text, point, style, scope).element();
    }

    @Test
    void centredByDefault() {
        assertEquals("<text x=\"100.00\" y=\"100.00\" style=\"font-size: 10px; fill: #000000; font-family: sans-serif\""
                + " text-anchor=\"middle\" dominant-baseline=\"middle\">Label</text>",
            render("Label", Map.of()));
    }

    @Test
    void placementKeywordsMoveTheLabel() {
        String above = render("A", Map.of("above", true));
        assertTrue(above.contains("x=\"100.00\" y=\"90.00\""), above);
        assertTrue(above.contains("dominant-baseline=\"auto\""));

        String belowLeft = render("A", Map.of("below left", true));
        assertTrue(belowLeft.contains("x=\"90.00\" y=\"110.00\""), belowLeft);
        assertTrue(belowLeft.contains("text-anchor=\"end\""));
        assertTrue(belowLeft.contains("dominant-baseline=\"hanging\""));
    }

    @Test
    void placementDistance() {
        assertTrue(render("A", Map.of("right", 1.0)).contains("x=\"128.35\""));
        assertTrue(render("A", Map.of("above", "1cm")).contains("y=\"71.65\""));
    }

    @Test
    void anchorPutsThatSideOnThePoint() {
        String west = render("A", Map.of("anchor", "west"));
        assertTrue(west.contains("x=\"100.00\" y=\"100.00\""), west);
        assertTrue(west.contains("text-anchor=\"start\""));

        String north = render("A", Map.of("anchor", "north"));
        assertTrue(north.contains("dominant-baseline=\"hanging\""));
    }

    @Test
    void usesTextColorAndFont() {
        String label = render("A", Map.of(TEXT_COLOR, "#FF0000", FONT, "small"));
        assertTrue(label.contains("style=\"font-size: 9px; fill: #FF0000; font-family: sans-serif\""), label);
    }

    @Test
    void emptyTextRendersNothing() {
        assertNull(labels.render("", point, Map.of(), scope));
        assertNull(labels.render("  {} ", point, Map.of(), scope));
    }

    @Test
    void escapesMarkup() {
        assertTrue(render("a<b & c", Map.of()).contains(">a&lt;b &amp; c</text>"));
    }

    @Test
    void cleansTex() {
        context.root().defineNumber("i", 3);
        assertEquals("x^2", LabelRenderer.cleanText("$x^2$", scope));
        assertEquals("Bold text", LabelRenderer.cleanText("\\textbf{Bold} text", scope));
        assertEquals("one two", LabelRenderer.cleanText("one\\\\two", scope));
        assertEquals("P3", LabelRenderer.cleanText("P\\i", scope));
        assertEquals("", LabelRenderer.cleanText(null, scope));
    }

    @Test
    void estimatesBounds() {
        Envelope bounds = labels.render("Label", point, Map.of(), scope).bounds();
        assertEquals(85, bounds.getMinX(), 1e-9);
        assertEquals(115, bounds.getMaxX(), 1e-9);
        assertEquals(95, bounds.getMinY(), 1e-9);
        assertEquals(105, bounds.getMaxY(), 1e-9);
    }
}

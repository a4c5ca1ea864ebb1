package nl.bytesoflife.tikzsvg.renderer.svg;

import nl.bytesoflife.tikzsvg.model.DrawCommand;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static nl.bytesoflife.tikzsvg.renderer.svg.OptionProcessor.*;
import static org.junit.jupiter.api.Assertions.*;

class StyleConverterTest {

    private final StyleConverter converter = new StyleConverter();

    @Test
    void defaultsPerCommand() {
        assertEquals("stroke: #000000; fill: none; stroke-width: 1.0px", converter.pathStyle(Map.of(), DrawCommand.DRAW));
        assertEquals("stroke: none; fill: #000000", converter.pathStyle(Map.of(), DrawCommand.FILL));
        assertEquals("stroke: #000000; fill: #000000; stroke-width: 1.0px",
            converter.pathStyle(Map.of(), DrawCommand.FILLDRAW));
        assertFalse(converter.strokes(Map.of(), DrawCommand.PATH));
        assertFalse(converter.fills(Map.of(), DrawCommand.CLIP));
    }

    @Test
    void optionsOverrideTheCommand() {
        assertFalse(converter.strokes(Map.of(DRAW, false), DrawCommand.DRAW));
        assertTrue(converter.fills(Map.of(FILL, true), DrawCommand.DRAW));
        assertTrue(converter.strokes(Map.of(DRAW, true), DrawCommand.PATH));
    }

    @Test
    void writesColorsWidthAndDashes() {
        Map<String, Object> style = new HashMap<>();
        style.put(STROKE_COLOR, "#FF0000");
        style.put(FILL_COLOR, "#0000FF");
        style.put(LINE_WIDTH, 2.0);
        style.put(DASH, "5,5");
        style.put(LINE_CAP, "round");
        assertEquals("stroke: #FF0000; fill: #0000FF; stroke-width: 2.0px; stroke-dasharray: 5,5; stroke-linecap: round",
            converter.pathStyle(style, DrawCommand.FILLDRAW));
    }

    @Test
    void strokePropertiesOnlyWhenStroking() {
        assertEquals("stroke: none; fill: #FF0000",
            converter.pathStyle(Map.of(FILL_COLOR, "#FF0000", LINE_WIDTH, 3.0, DASH, "5,5"), DrawCommand.FILL));
    }

    @Test
    void opacityIsClamped() {
        String style = converter.pathStyle(Map.of(OPACITY, 0.5, FILL_OPACITY, 1.5), DrawCommand.DRAW);
        assertTrue(style.endsWith("opacity: 0.5; fill-opacity: 1.0"), style);
    }

    @Test
    void groupStyleHoldsOnlyOwnKeys() {
        assertEquals("", converter.groupStyle(Map.of()));
        assertEquals("stroke: #FF0000", converter.groupStyle(Map.of(STROKE_COLOR, "#FF0000")));
        assertEquals("fill: #00FF00; stroke-width: 2.0px",
            converter.groupStyle(Map.of(FILL, true, FILL_COLOR, "#00FF00", LINE_WIDTH, 2.0)));
    }

    @Test
    void textStyle() {
        assertEquals("font-size: 10px; fill: #000000; font-family: sans-serif", converter.textStyle(Map.of()));
        assertEquals("font-size: 16px; fill: #FF0000; font-family: sans-serif",
            converter.textStyle(Map.of(FONT, "Large", TEXT_COLOR, "#FF0000")));
    }

    @Test
    void fontSizes() {
        assertEquals(10, StyleConverter.fontSize(null));
        assertEquals(7, StyleConverter.fontSize("tiny"));
        assertEquals(9, StyleConverter.fontSize("bfseries small"));
        assertEquals(20, StyleConverter.fontSize("small Huge"));
        assertEquals(10, StyleConverter.fontSize("itshape"));
    }
}

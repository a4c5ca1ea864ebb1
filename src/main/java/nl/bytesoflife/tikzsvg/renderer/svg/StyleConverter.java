package nl.bytesoflife.tikzsvg.renderer.svg;

import nl.bytesoflife.tikzsvg.model.DrawCommand;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static nl.bytesoflife.tikzsvg.renderer.svg.OptionProcessor.*;

/**
 * Writes normalized style maps as SVG {@code style} attribute values, e.g.
 * {@code stroke: #FF0000; fill: none; stroke-width: 1.0px}.
 */
public class StyleConverter {

    static final String DEFAULT_COLOR = "#000000";
    static final double DEFAULT_LINE_WIDTH = 1.0;
    static final int DEFAULT_FONT_SIZE = 10;

    /** Whether a path of {@code command} with {@code style} is stroked. */
    public boolean strokes(Map<String, Object> style, DrawCommand command) {
        if (style.get(DRAW) instanceof Boolean draw) {
            return draw;
        }
        return command == DrawCommand.DRAW || command == DrawCommand.FILLDRAW;
    }

    public boolean fills(Map<String, Object> style, DrawCommand command) {
        if (style.get(FILL) instanceof Boolean filled) {
            return filled;
        }
        return command == DrawCommand.FILL || command == DrawCommand.FILLDRAW;
    }

    public String pathStyle(Map<String, Object> style, DrawCommand command) {
        boolean stroke = strokes(style, command);
        boolean fill = fills(style, command);

        List<String> parts = new ArrayList<>();
        parts.add("stroke: " + (stroke ? string(style, STROKE_COLOR, DEFAULT_COLOR) : "none"));
        parts.add("fill: " + (fill ? string(style, FILL_COLOR, DEFAULT_COLOR) : "none"));
        if (stroke) {
            parts.add("stroke-width: " + SvgFormat.compact(number(style, LINE_WIDTH, DEFAULT_LINE_WIDTH)) + "px");
            String dash = string(style, DASH, NO_DASH);
            if (!dash.equals(NO_DASH)) {
                parts.add("stroke-dasharray: " + dash);
            }
            if (style.containsKey(LINE_CAP)) {
                parts.add("stroke-linecap: " + style.get(LINE_CAP));
            }
            if (style.containsKey(LINE_JOIN)) {
                parts.add("stroke-linejoin: " + style.get(LINE_JOIN));
            }
        }
        addOpacity(style, parts);
        return String.join("; ", parts);
    }

    /**
     * Style for a scope group: only what the scope itself sets.
     */
    public String groupStyle(Map<String, Object> own) {
        List<String> parts = new ArrayList<>();
        if (own.get(STROKE_COLOR) instanceof String color) {
            parts.add("stroke: " + color);
        }
        if (Boolean.FALSE.equals(own.get(DRAW))) {
            parts.add("stroke: none");
        }
        if (Boolean.TRUE.equals(own.get(FILL)) && own.get(FILL_COLOR) instanceof String fill) {
            parts.add("fill: " + fill);
        }
        if (own.get(LINE_WIDTH) instanceof Double width) {
            parts.add("stroke-width: " + SvgFormat.compact(width) + "px");
        }
        if (own.get(DASH) instanceof String dash && !dash.equals(NO_DASH)) {
            parts.add("stroke-dasharray: " + dash);
        }
        addOpacity(own, parts);
        return String.join("; ", parts);
    }

    public String textStyle(Map<String, Object> style) {
        List<String> parts = new ArrayList<>();
        parts.add("font-size: " + fontSize(style.get(FONT)) + "px");
        parts.add("fill: " + string(style, TEXT_COLOR, DEFAULT_COLOR));
        parts.add("font-family: sans-serif");
        if (style.get(OPACITY) instanceof Double opacity) {
            parts.add("opacity: " + SvgFormat.compact(clamp(opacity)));
        }
        return String.join("; ", parts);
    }

    static int fontSize(Object font) {
        if (!(font instanceof String name)) {
            return DEFAULT_FONT_SIZE;
        }
        // the last size command wins, e.g. "\bfseries\Large"
        int size = DEFAULT_FONT_SIZE;
        for (String command : name.split("[\\s\\\\]+")) {
            switch (command) {
                case "tiny":
                    size = 7;
                    break;
                case "scriptsize":
                case "footnotesize":
                    size = 8;
                    break;
                case "small":
                    size = 9;
                    break;
                case "normalsize":
                    size = 10;
                    break;
                case "large":
                    size = 14;
                    break;
                case "Large":
                    size = 16;
                    break;
                case "huge":
                    size = 18;
                    break;
                case "Huge":
                    size = 20;
                    break;
                default:
                    break;
            }
        }
        return size;
    }

    private static void addOpacity(Map<String, Object> style, List<String> parts) {
        if (style.get(OPACITY) instanceof Double opacity) {
            parts.add("opacity: " + SvgFormat.compact(clamp(opacity)));
        }
        if (style.get(DRAW_OPACITY) instanceof Double opacity) {
            parts.add("stroke-opacity: " + SvgFormat.compact(clamp(opacity)));
        }
        if (style.get(FILL_OPACITY) instanceof Double opacity) {
            parts.add("fill-opacity: " + SvgFormat.compact(clamp(opacity)));
        }
    }

    private static double clamp(double opacity) {
        return Math.max(0, Math.min(1, opacity));
    }

    private static String string(Map<String, Object> style, String key, String fallback) {
        return style.get(key) instanceof String value ? value : fallback;
    }

    private static double number(Map<String, Object> style, String key, double fallback) {
        return style.get(key) instanceof Double value ? value : fallback;
    }
}

package nl.bytesoflife.tikzsvg.renderer.svg;

import nl.bytesoflife.tikzsvg.evaluator.TextSubstitution;
import org.locationtech.jts.geom.Envelope;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Writes node labels as {@code <text>} elements.
 * <p>
 * Position keywords ({@code above}, {@code below left}, ...) and {@code anchor=} move the label
 * away from its point by the anchor distance and pick the matching {@code text-anchor} and
 * {@code dominant-baseline}.
 */
public class LabelRenderer {

    private static final Pattern FORMATTING = Pattern.compile(
        "\\\\(textbf|textit|textrm|texttt|textsf|emph|mathrm|mathbf|mathit|text)\\s*(?=\\{)");
    private static final Pattern LINE_BREAK = Pattern.compile("\\\\\\\\");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // rough advance width of a sans-serif glyph relative to the font size
    private static final double GLYPH_WIDTH = 0.6;

    private final CoordinateResolver resolver;
    private final StyleConverter styleConverter;
    private final double anchorDistance;

    public LabelRenderer(CoordinateResolver resolver, StyleConverter styleConverter, double anchorDistance) {
        this.resolver = resolver;
        this.styleConverter = styleConverter;
        this.anchorDistance = anchorDistance;
    }

    /**
     * A rendered label and the area it covers.
     */
    public record Label(String element, Envelope bounds) {
    }

    /**
     * @return the label, or {@code null} when the text is empty
     */
    public Label render(String rawText, Point position, Map<String, Object> style, RenderScope scope) {
        String text = cleanText(rawText, scope);
        if (text.isEmpty()) {
            return null;
        }

        int horizontal = 0;
        int vertical = 0;
        double distance = anchorDistance;
        for (Map.Entry<String, Object> entry : style.entrySet()) {
            String key = entry.getKey();
            int[] direction = placement(key);
            if (direction != null) {
                horizontal = direction[0];
                vertical = direction[1];
                if (!Boolean.TRUE.equals(entry.getValue())) {
                    distance = distance(entry.getValue(), scope);
                }
            } else if (key.equals("anchor") && entry.getValue() instanceof String anchor) {
                int[] opposite = placement(anchorToPlacement(anchor));
                horizontal = opposite == null ? 0 : opposite[0];
                vertical = opposite == null ? 0 : opposite[1];
                distance = 0;
            }
        }

        double x = position.x() + horizontal * distance;
        double y = position.y() + vertical * distance;
        String textAnchor = horizontal < 0 ? "end" : horizontal > 0 ? "start" : "middle";
        String baseline = vertical < 0 ? "auto" : vertical > 0 ? "hanging" : "middle";

        StringBuilder element = new StringBuilder();
        element.append("<text x=\"").append(SvgFormat.number(x))
            .append("\" y=\"").append(SvgFormat.number(y))
            .append("\" style=\"").append(styleConverter.textStyle(style))
            .append("\" text-anchor=\"").append(textAnchor)
            .append("\" dominant-baseline=\"").append(baseline).append("\">")
            .append(SvgFormat.escapeXml(text))
            .append("</text>");

        int fontSize = StyleConverter.fontSize(style.get(OptionProcessor.FONT));
        double width = text.length() * fontSize * GLYPH_WIDTH;
        double left = horizontal < 0 ? x - width : horizontal > 0 ? x : x - width / 2;
        double top = vertical < 0 ? y - fontSize : vertical > 0 ? y : y - fontSize / 2.0;
        Envelope bounds = new Envelope(left, left + width, top, top + fontSize);
        return new Label(element.toString(), bounds);
    }

    /**
     * Label text as displayed: variables substituted, math delimiters and simple formatting
     * commands removed. Not yet XML-escaped.
     */
    public static String cleanText(String raw, RenderScope scope) {
        if (raw == null) {
            return "";
        }
        String text = TextSubstitution.substitute(raw, scope.variables());
        text = text.replace("$", "");
        text = LINE_BREAK.matcher(text).replaceAll(" ");
        text = FORMATTING.matcher(text).replaceAll("");
        text = text.replace("{", "").replace("}", "");
        text = text.replace("\\", "");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /** {horizontal, vertical} unit offsets in output space, or {@code null} for other keys. */
    private static int[] placement(String key) {
        if (key == null) {
            return null;
        }
        switch (key) {
            case "above":
                return new int[]{0, -1};
            case "below":
                return new int[]{0, 1};
            case "left":
                return new int[]{-1, 0};
            case "right":
                return new int[]{1, 0};
            case "above left":
                return new int[]{-1, -1};
            case "above right":
                return new int[]{1, -1};
            case "below left":
                return new int[]{-1, 1};
            case "below right":
                return new int[]{1, 1};
            default:
                return null;
        }
    }

    /** {@code anchor=north} puts the label's top on the point, which reads as {@code below}. */
    private static String anchorToPlacement(String anchor) {
        switch (anchor.trim().toLowerCase(Locale.ROOT)) {
            case "north":
                return "below";
            case "south":
            case "base":
                return "above";
            case "east":
                return "left";
            case "west":
                return "right";
            case "north east":
                return "below left";
            case "north west":
                return "below right";
            case "south east":
                return "above left";
            case "south west":
                return "above right";
            default:
                return null;
        }
    }

    private double distance(Object value, RenderScope scope) {
        if (value instanceof Double centimetres) {
            return resolver.getTransformer().length(scope.transform(), centimetres);
        }
        if (value instanceof String length) {
            return resolver.evalLength(length, scope);
        }
        return anchorDistance;
    }
}

package nl.bytesoflife.tikzsvg.renderer.svg;

import nl.bytesoflife.tikzsvg.evaluator.EvaluationException;
import nl.bytesoflife.tikzsvg.evaluator.ExpansionTooDeepException;
import nl.bytesoflife.tikzsvg.evaluator.ExpressionEvaluator;
import nl.bytesoflife.tikzsvg.evaluator.TextSubstitution;
import nl.bytesoflife.tikzsvg.model.LengthUnit;
import nl.bytesoflife.tikzsvg.model.Option;
import nl.bytesoflife.tikzsvg.model.OptionList;
import nl.bytesoflife.tikzsvg.parser.OptionListParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates and normalizes a statement's options into style keys.
 * <p>
 * Colors end up as hex values under {@link #STROKE_COLOR}, {@link #FILL_COLOR} and
 * {@link #TEXT_COLOR}, widths in pixels under {@link #LINE_WIDTH}, dashes as an SVG dash array
 * under {@link #DASH}. Named styles are expanded in place. Other values are evaluated as
 * expressions when possible and kept as literals otherwise; nothing here throws for a bad value.
 */
public class OptionProcessor {

    private static final Logger log = LoggerFactory.getLogger(OptionProcessor.class);

    public static final String STROKE_COLOR = "stroke color";
    public static final String FILL_COLOR = "fill color";
    public static final String TEXT_COLOR = "text color";
    /** {@code Boolean}: stroke forced on or off regardless of the command. */
    public static final String DRAW = "draw";
    /** {@code Boolean}: fill forced on or off regardless of the command. */
    public static final String FILL = "fill";
    public static final String LINE_WIDTH = "line width";
    public static final String DASH = "dash";
    public static final String ARROWS = "arrows";
    public static final String LINE_CAP = "line cap";
    public static final String LINE_JOIN = "line join";
    public static final String OPACITY = "opacity";
    public static final String DRAW_OPACITY = "draw opacity";
    public static final String FILL_OPACITY = "fill opacity";
    public static final String FONT = "font";
    public static final String XSHIFT = "xshift";
    public static final String YSHIFT = "yshift";
    public static final String SCALE = "scale";
    public static final String NO_DASH = "none";

    private static final Map<String, Double> LINE_WIDTHS = new LinkedHashMap<>();
    private static final Map<String, String> DASHES = new LinkedHashMap<>();

    static {
        LINE_WIDTHS.put("ultra thin", 0.5);
        LINE_WIDTHS.put("very thin", 0.75);
        LINE_WIDTHS.put("thin", 1.0);
        LINE_WIDTHS.put("semithick", 1.5);
        LINE_WIDTHS.put("thick", 2.0);
        LINE_WIDTHS.put("very thick", 3.0);
        LINE_WIDTHS.put("ultra thick", 4.0);

        DASHES.put("dashed", "5,5");
        DASHES.put("dotted", "2,2");
        DASHES.put("densely dashed", "3,2");
        DASHES.put("loosely dashed", "6,6");
        DASHES.put("densely dotted", "1,1");
        DASHES.put("loosely dotted", "1,4");
        DASHES.put("solid", NO_DASH);
    }

    private final ExpressionEvaluator evaluator;
    private final StyleRegistry styles;
    private final OptionListParser optionParser = new OptionListParser();
    private final double pixelsPerCentimetre;
    private final int maxStyleDepth;

    public OptionProcessor(ExpressionEvaluator evaluator, StyleRegistry styles, double pixelsPerCentimetre, int maxStyleDepth) {
        this.evaluator = evaluator;
        this.styles = styles;
        this.pixelsPerCentimetre = pixelsPerCentimetre;
        this.maxStyleDepth = maxStyleDepth;
    }

    /**
     * Normalizes {@code options} on their own, without inherited values.
     */
    public Map<String, Object> process(OptionList options, RenderScope scope) {
        Map<String, Object> result = new LinkedHashMap<>();
        apply(options, scope, result, 0, null);
        return result;
    }

    /**
     * Child keys override parent keys; everything else is inherited.
     */
    public static Map<String, Object> merge(Map<String, Object> parent, Map<String, Object> child) {
        if (child.isEmpty()) {
            return parent;
        }
        Map<String, Object> merged = new LinkedHashMap<>(parent);
        merged.putAll(child);
        return merged;
    }

    private void apply(OptionList options, RenderScope scope, Map<String, Object> out, int depth, String styleName) {
        if (depth > maxStyleDepth) {
            throw new ExpansionTooDeepException(styleName, maxStyleDepth);
        }
        for (Option option : options.options()) {
            String key = TextSubstitution.substituteText(option.key(), scope.variables()).trim();
            if (option.isFlag()) {
                applyFlag(key, scope, out, depth);
            } else {
                String value = TextSubstitution.substituteText(option.value(), scope.variables()).trim();
                applyValue(key, value, scope, out);
            }
        }
    }

    private void applyFlag(String key, RenderScope scope, Map<String, Object> out, int depth) {
        if (styles.contains(key)) {
            apply(styles.get(key).orElseThrow(), scope, out, depth + 1, key);
            return;
        }
        Double width = LINE_WIDTHS.get(key);
        if (width != null) {
            out.put(LINE_WIDTH, width);
            return;
        }
        String dash = DASHES.get(key);
        if (dash != null) {
            out.put(DASH, dash);
            return;
        }
        if (ArrowMarkers.isArrowSpec(key)) {
            out.put(ARROWS, key);
            return;
        }
        if (key.equals(DRAW)) {
            out.put(DRAW, Boolean.TRUE);
            return;
        }
        if (key.equals(FILL)) {
            out.put(FILL, Boolean.TRUE);
            return;
        }
        String color = ColorTable.resolve(key).orElse(null);
        if (color != null) {
            setColor(out, color);
            return;
        }
        out.put(key, Boolean.TRUE);
    }

    private void applyValue(String key, String value, RenderScope scope, Map<String, Object> out) {
        if (key.endsWith("/.style")) {
            String name = key.substring(0, key.length() - "/.style".length()).trim();
            styles.define(name, optionParser.parse(value));
            log.debug("Defined style '{}'", name);
            return;
        }
        switch (key) {
            case "color":
                color(value).ifPresent(c -> setColor(out, c));
                break;
            case DRAW:
                if (value.equals("none")) {
                    out.put(DRAW, Boolean.FALSE);
                } else {
                    color(value).ifPresent(c -> out.put(STROKE_COLOR, c));
                    out.put(DRAW, Boolean.TRUE);
                }
                break;
            case FILL:
                if (value.equals("none")) {
                    out.put(FILL, Boolean.FALSE);
                } else {
                    color(value).ifPresent(c -> out.put(FILL_COLOR, c));
                    out.put(FILL, Boolean.TRUE);
                }
                break;
            case "text":
                color(value).ifPresent(c -> out.put(TEXT_COLOR, c));
                break;
            case LINE_WIDTH:
                out.put(LINE_WIDTH, lineWidth(value, scope));
                break;
            case "dash pattern":
                out.put(DASH, dashPattern(value, scope));
                break;
            case ARROWS:
                out.put(ARROWS, value);
                break;
            case XSHIFT:
            case YSHIFT:
                out.put(key, centimetres(value, scope));
                break;
            case LINE_CAP:
            case LINE_JOIN:
                out.put(key, value.toLowerCase(Locale.ROOT));
                break;
            case FONT:
                out.put(FONT, value.replace("\\", "").trim());
                break;
            default:
                out.put(key, evaluateOrLiteral(value, scope));
                break;
        }
    }

    private static void setColor(Map<String, Object> out, String hex) {
        out.put(STROKE_COLOR, hex);
        out.put(FILL_COLOR, hex);
        out.put(TEXT_COLOR, hex);
    }

    private static Optional<String> color(String value) {
        Optional<String> resolved = ColorTable.resolve(value);
        if (resolved.isEmpty()) {
            log.warn("Unknown color '{}', ignoring", value);
        }
        return resolved;
    }

    /**
     * Evaluates a value as an expression; returns the number or, when it is not one, the literal.
     */
    public Object evaluateOrLiteral(String value, RenderScope scope) {
        try {
            return evaluator.evaluate(value, scope.variables());
        } catch (EvaluationException e) {
            return value;
        }
    }

    /** Line width in pixels; a bare number is in points. */
    private double lineWidth(String value, RenderScope scope) {
        String trimmed = value.trim();
        LengthUnit.Length length = LengthUnit.split(trimmed);
        LengthUnit unit = length.expression().equals(trimmed) ? LengthUnit.PT : length.unit();
        Object number = evaluateOrLiteral(length.expression(), scope);
        if (!(number instanceof Double magnitude)) {
            log.warn("Invalid line width '{}', using 1px", value);
            return 1.0;
        }
        return unit.toCentimetres(magnitude) * pixelsPerCentimetre;
    }

    private double centimetres(String value, RenderScope scope) {
        LengthUnit.Length length = LengthUnit.split(value);
        Object number = evaluateOrLiteral(length.expression(), scope);
        if (!(number instanceof Double magnitude)) {
            log.warn("Invalid length '{}', using 0", value);
            return 0;
        }
        return length.unit().toCentimetres(magnitude);
    }

    /**
     * {@code on 2pt off 3pt on 1pt off 3pt} to a pixel dash array.
     */
    private String dashPattern(String value, RenderScope scope) {
        String[] words = value.trim().split("\\s+");
        List<String> lengths = new ArrayList<>();
        for (int i = 0; i + 1 < words.length; i += 2) {
            if (!words[i].equals("on") && !words[i].equals("off")) {
                log.warn("Invalid dash pattern '{}', using dashed", value);
                return DASHES.get("dashed");
            }
            String length = words[i + 1];
            LengthUnit.Length parsed = LengthUnit.split(length);
            LengthUnit unit = parsed.expression().equals(length) ? LengthUnit.PT : parsed.unit();
            Object number = evaluateOrLiteral(parsed.expression(), scope);
            double pixels = number instanceof Double magnitude ? unit.toCentimetres(magnitude) * pixelsPerCentimetre : 0;
            lengths.add(SvgFormat.compact(pixels));
        }
        if (lengths.isEmpty()) {
            return NO_DASH;
        }
        return String.join(",", lengths);
    }

    /**
     * Scope transformation declared by these (own, not inherited) options.
     */
    public static Transform transformOf(Map<String, Object> own) {
        double scale = own.get(SCALE) instanceof Double s ? s : 1;
        double x = own.get(XSHIFT) instanceof Double d ? d : 0;
        double y = own.get(YSHIFT) instanceof Double d ? d : 0;
        return new Transform(scale, x, y);
    }
}

package nl.bytesoflife.tikzsvg.renderer.svg;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Arrow tip specifications such as {@code ->}, {@code <->}, {@code -stealth} and {@code |-|},
 * and the {@code <marker>} definitions for the tips actually used.
 */
public class ArrowMarkers {

    private static final String TIP = "(<<|>>|<|>|\\||stealth|latex|Stealth|Latex)?";
    private static final Pattern SPEC = Pattern.compile(TIP + "-" + TIP);

    enum Kind {
        ARROW_END("arrow-end", "M 0 0 L 10 5 L 0 10 z", 9),
        ARROW_START("arrow-start", "M 10 0 L 0 5 L 10 10 z", 1),
        STEALTH_END("stealth-end", "M 0 0 L 10 5 L 0 10 L 3 5 z", 9),
        STEALTH_START("stealth-start", "M 10 0 L 0 5 L 10 10 L 7 5 z", 1),
        BAR("bar", "M 4 0 L 6 0 L 6 10 L 4 10 z", 5);

        private final String id;
        private final String path;
        private final int refX;

        Kind(String id, String path, int refX) {
            this.id = id;
            this.path = path;
            this.refX = refX;
        }

        String getId() {
            return id;
        }
    }

    private final Set<Kind> used = EnumSet.noneOf(Kind.class);

    /** True when {@code key} is an arrow specification with at least one tip. */
    public static boolean isArrowSpec(String key) {
        Matcher matcher = SPEC.matcher(key.trim());
        return matcher.matches() && (matcher.group(1) != null || matcher.group(2) != null);
    }

    /**
     * Marker attributes for a path using {@code spec}; records the tips so their definitions are emitted.
     */
    public Map<String, String> attributesFor(String spec) {
        Map<String, String> attributes = new LinkedHashMap<>();
        Matcher matcher = SPEC.matcher(spec.trim());
        if (!matcher.matches()) {
            return attributes;
        }
        Kind start = kind(matcher.group(1), true);
        Kind end = kind(matcher.group(2), false);
        if (start != null) {
            used.add(start);
            attributes.put("marker-start", "url(#" + start.getId() + ")");
        }
        if (end != null) {
            used.add(end);
            attributes.put("marker-end", "url(#" + end.getId() + ")");
        }
        return attributes;
    }

    private static Kind kind(String tip, boolean start) {
        if (tip == null) {
            return null;
        }
        switch (tip.toLowerCase(Locale.ROOT)) {
            case "|":
                return Kind.BAR;
            case "stealth":
                return start ? Kind.STEALTH_START : Kind.STEALTH_END;
            default:
                // < > << >> latex all draw as a plain triangle pointing away from the path
                return start ? Kind.ARROW_START : Kind.ARROW_END;
        }
    }

    public boolean isEmpty() {
        return used.isEmpty();
    }

    /** {@code <marker>} elements for every tip in use, in a fixed order. */
    public void writeDefinitions(StringBuilder out, String indent) {
        for (Kind kind : used) {
            out.append(indent).append("<marker id=\"").append(kind.id)
                .append("\" viewBox=\"0 0 10 10\" refX=\"").append(kind.refX)
                .append("\" refY=\"5\" markerWidth=\"6\" markerHeight=\"6\" orient=\"auto\">\n");
            out.append(indent).append("  <path d=\"").append(kind.path).append("\" fill=\"context-stroke\"/>\n");
            out.append(indent).append("</marker>\n");
        }
    }
}

package nl.bytesoflife.tikzsvg.renderer.svg;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Named colors and the {@code a!p!b} mixing syntax.
 */
public final class ColorTable {

    private static final Map<String, String> COLORS = new LinkedHashMap<>();

    static {
        COLORS.put("red", "#FF0000");
        COLORS.put("green", "#00FF00");
        COLORS.put("blue", "#0000FF");
        COLORS.put("yellow", "#FFFF00");
        COLORS.put("cyan", "#00FFFF");
        COLORS.put("magenta", "#FF00FF");
        COLORS.put("black", "#000000");
        COLORS.put("white", "#FFFFFF");
        COLORS.put("gray", "#808080");
        COLORS.put("darkgray", "#404040");
        COLORS.put("lightgray", "#C0C0C0");
        COLORS.put("brown", "#A52A2A");
        COLORS.put("lime", "#00FF00");
        COLORS.put("olive", "#808000");
        COLORS.put("orange", "#FFA500");
        COLORS.put("pink", "#FFC0CB");
        COLORS.put("purple", "#800080");
        COLORS.put("teal", "#008080");
        COLORS.put("violet", "#EE82EE");
    }

    private ColorTable() {
    }

    public static boolean isNamed(String name) {
        return COLORS.containsKey(name.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Resolves a name, {@code #RRGGBB} value or mix expression to an upper-case hex color.
     * {@code red!30} is 30% red and 70% white; {@code red!30!blue} is 30% red and 70% blue;
     * longer chains mix from left to right.
     */
    public static Optional<String> resolve(String spec) {
        if (spec == null) {
            return Optional.empty();
        }
        String[] parts = spec.trim().split("!");
        Optional<int[]> current = single(parts[0]);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        int[] rgb = current.get();
        for (int i = 1; i < parts.length; i += 2) {
            double percent;
            try {
                percent = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
            int[] other;
            if (i + 1 < parts.length) {
                Optional<int[]> next = single(parts[i + 1]);
                if (next.isEmpty()) {
                    return Optional.empty();
                }
                other = next.get();
            } else {
                other = new int[]{255, 255, 255};
            }
            rgb = mix(rgb, other, Math.max(0, Math.min(100, percent)) / 100.0);
        }
        return Optional.of(toHex(rgb));
    }

    private static Optional<int[]> single(String name) {
        String trimmed = name.trim();
        String hex = trimmed.startsWith("#") ? trimmed : COLORS.get(trimmed.toLowerCase(Locale.ROOT));
        if (hex == null || !hex.matches("#[0-9A-Fa-f]{6}")) {
            return Optional.empty();
        }
        return Optional.of(new int[]{
            Integer.parseInt(hex.substring(1, 3), 16),
            Integer.parseInt(hex.substring(3, 5), 16),
            Integer.parseInt(hex.substring(5, 7), 16)
        });
    }

    static int[] mix(int[] first, int[] second, double firstWeight) {
        int[] result = new int[3];
        for (int i = 0; i < 3; i++) {
            result[i] = (int) Math.round(first[i] * firstWeight + second[i] * (1 - firstWeight));
        }
        return result;
    }

    private static String toHex(int[] rgb) {
        return String.format(Locale.US, "#%02X%02X%02X", rgb[0], rgb[1], rgb[2]);
    }
}

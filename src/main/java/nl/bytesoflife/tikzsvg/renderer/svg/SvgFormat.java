package nl.bytesoflife.tikzsvg.renderer.svg;

import java.util.Locale;

/**
 * Number and text formatting shared by everything that writes SVG.
 */
public final class SvgFormat {

    private SvgFormat() {
    }

    /** Fixed two decimals, as used for all coordinates in path data. */
    public static String number(double value) {
        String formatted = String.format(Locale.US, "%.2f", value);
        return formatted.equals("-0.00") ? "0.00" : formatted;
    }

    /** Width and height: whole pixels without decimals, others as {@link #number(double)}. */
    public static String dimension(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return number(value);
    }

    /**
     * Compact form for style values: {@code 1.0}, {@code 0.75}, {@code 2.5}.
     */
    public static String compact(double value) {
        if (value == Math.rint(value)) {
            return String.format(Locale.US, "%.1f", value);
        }
        String formatted = String.format(Locale.US, "%.4f", value);
        formatted = formatted.replaceAll("0+$", "");
        return formatted.endsWith(".") ? formatted + "0" : formatted;
    }

    public static String escapeXml(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&':
                    out.append("&amp;");
                    break;
                case '<':
                    out.append("&lt;");
                    break;
                case '>':
                    out.append("&gt;");
                    break;
                case '"':
                    out.append("&quot;");
                    break;
                default:
                    out.append(c);
            }
        }
        return out.toString();
    }
}

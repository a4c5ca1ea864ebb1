package nl.bytesoflife.tikzsvg.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text normalization ahead of macro expansion: strips {@code %} comments and cuts a document into
 * {@code tikzpicture} environments and the text between them (where preamble macros live).
 */
public class TikzPreprocessor {

    private static final Pattern BEGIN = Pattern.compile("\\\\begin\\s*\\{tikzpicture\\}");
    private static final Pattern END = Pattern.compile("\\\\end\\s*\\{tikzpicture\\}");

    /**
     * A slice of the document; {@code diagram} is set for a complete picture environment.
     */
    public record Segment(String text, boolean diagram) {
    }

    public String stripComments(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                out.append(c).append(text.charAt(i + 1));
                i += 2;
            } else if (c == '%') {
                while (i < text.length() && text.charAt(i) != '\n') {
                    i++;
                }
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Splits comment-free text into segments. Text without any picture environment is returned
     * as one diagram segment holding a bare statement list.
     */
    public List<Segment> split(String text) {
        List<Segment> segments = new ArrayList<>();
        Matcher begin = BEGIN.matcher(text);
        Matcher end = END.matcher(text);
        int pos = 0;
        boolean found = false;
        while (begin.find(pos)) {
            if (!end.find(begin.end())) {
                throw ParseException.at("Missing \\end{tikzpicture}", text, begin.start());
            }
            found = true;
            if (begin.start() > pos) {
                segments.add(new Segment(text.substring(pos, begin.start()), false));
            }
            segments.add(new Segment(text.substring(begin.start(), end.end()), true));
            pos = end.end();
        }
        if (!found) {
            segments.add(new Segment(text, true));
            return segments;
        }
        if (pos < text.length()) {
            segments.add(new Segment(text.substring(pos), false));
        }
        return segments;
    }
}

package nl.bytesoflife.tikzsvg.parser;

import nl.bytesoflife.tikzsvg.model.Option;
import nl.bytesoflife.tikzsvg.model.OptionList;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the inside of {@code [...]}: entries separated by top-level commas, each either a flag
 * or {@code key=value} split at the first top-level {@code =}.
 */
public class OptionListParser {

    public OptionList parse(String raw) {
        List<Option> options = new ArrayList<>();
        for (String entry : splitTopLevel(raw, ',')) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int equals = indexOfTopLevel(trimmed, '=');
            if (equals < 0) {
                options.add(Option.flag(normalizeKey(trimmed)));
            } else {
                String key = normalizeKey(trimmed.substring(0, equals));
                String value = stripBraces(trimmed.substring(equals + 1).trim());
                options.add(new Option(key, value));
            }
        }
        return new OptionList(options);
    }

    static String normalizeKey(String key) {
        return key.trim().replaceAll("\\s+", " ");
    }

    /**
     * Removes one pair of braces enclosing the whole value.
     */
    public static String stripBraces(String value) {
        if (value.length() >= 2 && value.charAt(0) == '{' && value.charAt(value.length() - 1) == '}'
            && indexOfClosing(value, 0) == value.length() - 1) {
            return value.substring(1, value.length() - 1).trim();
        }
        return value;
    }

    /**
     * Splits on {@code separator} outside braces and parentheses.
     */
    public static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{' || c == '(') {
                depth++;
            } else if (c == '}' || c == ')') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    public static int indexOfTopLevel(String text, char target) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{' || c == '(') {
                depth++;
            } else if (c == '}' || c == ')') {
                depth--;
            } else if (c == target && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOfClosing(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}

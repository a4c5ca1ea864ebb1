package nl.bytesoflife.tikzsvg.evaluator;

import nl.bytesoflife.tikzsvg.lexer.ControlWords;
import nl.bytesoflife.tikzsvg.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Textual expansion of user macros defined with {@code \def}, {@code \newcommand} and
 * {@code \renewcommand}.
 * <p>
 * The text is processed in a single forward pass. Definitions are recorded at the point they
 * appear and removed from the output, so every invocation uses the definition in effect where it
 * stands. An invocation is replaced in place and the replacement is rescanned; each rescanned
 * region remembers its nesting depth so cyclic definitions fail with
 * {@link ExpansionTooDeepException} instead of looping forever.
 * <p>
 * One expander is used per document: definitions made in the preamble stay visible for every
 * diagram that follows.
 */
public class MacroExpander {

    private static final Logger log = LoggerFactory.getLogger(MacroExpander.class);

    public static final int DEFAULT_MAX_DEPTH = 20;

    private static final Set<String> RESERVED = Set.of("begin", "end", "def", "newcommand", "renewcommand");

    private final int maxDepth;
    private final Map<String, MacroTemplate> macros = new HashMap<>();

    public MacroExpander() {
        this(DEFAULT_MAX_DEPTH);
    }

    public MacroExpander(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public void define(String name, int parameterCount, String body) {
        String key = EvaluationContext.normalize(name);
        if (RESERVED.contains(key)) {
            throw new ParseException("Cannot redefine reserved command \\" + key);
        }
        MacroTemplate previous = macros.put(key, new MacroTemplate(key, parameterCount, body));
        if (previous != null) {
            log.debug("Redefined macro \\{}", key);
        } else {
            log.debug("Defined macro \\{} with {} parameter(s)", key, parameterCount);
        }
    }

    public Optional<MacroTemplate> getMacro(String name) {
        return Optional.ofNullable(macros.get(EvaluationContext.normalize(name)));
    }

    public int getMacroCount() {
        return macros.size();
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Expands every macro invocation in {@code text}, recording definitions as they are met.
     */
    public String expand(String text) {
        StringBuilder buffer = new StringBuilder(text);
        StringBuilder out = new StringBuilder(text.length());
        // each entry: {end offset of a replacement in buffer, nesting depth of that replacement}
        Deque<int[]> regions = new ArrayDeque<>();
        int pos = 0;

        while (pos < buffer.length()) {
            while (!regions.isEmpty() && regions.peek()[0] <= pos) {
                regions.pop();
            }
            char c = buffer.charAt(pos);
            if (c != '\\') {
                out.append(c);
                pos++;
                continue;
            }
            int nameEnd = ControlWords.wordEnd(buffer, pos + 1);
            if (nameEnd == pos + 1) {
                // control symbol such as \\ or \{, copied verbatim with its character
                int end = Math.min(pos + 2, buffer.length());
                out.append(buffer, pos, end);
                pos = end;
                continue;
            }
            String name = buffer.substring(pos + 1, nameEnd);
            switch (name) {
                case "def":
                    pos = parseDef(buffer, nameEnd);
                    continue;
                case "newcommand":
                case "renewcommand":
                    pos = parseNewCommand(buffer, nameEnd, name);
                    continue;
                default:
                    break;
            }
            MacroTemplate macro = macros.get(name);
            if (macro == null) {
                out.append(buffer, pos, nameEnd);
                pos = nameEnd;
                continue;
            }

            int depth = regions.isEmpty() ? 0 : regions.peek()[1];
            if (depth + 1 > maxDepth) {
                throw new ExpansionTooDeepException(name, maxDepth);
            }
            List<String> arguments = new ArrayList<>();
            int invocationEnd = nameEnd;
            for (int i = 0; i < macro.parameterCount(); i++) {
                int open = skipSpaces(buffer, invocationEnd);
                if (open >= buffer.length() || buffer.charAt(open) != '{') {
                    throw ParseException.at("Macro \\" + name + " expects " + macro.parameterCount()
                        + " argument(s) but only " + i + " given", buffer.toString(), pos);
                }
                int close = matchingBrace(buffer, open);
                arguments.add(buffer.substring(open + 1, close));
                invocationEnd = close + 1;
            }

            String replacement = macro.instantiate(arguments);
            buffer.replace(pos, invocationEnd, replacement);
            int delta = replacement.length() - (invocationEnd - pos);
            int replacementEnd = pos + replacement.length();
            for (int[] region : regions) {
                region[0] = region[0] >= invocationEnd ? region[0] + delta : replacementEnd;
            }
            regions.push(new int[]{replacementEnd, depth + 1});
            log.trace("Expanded \\{} at depth {}", name, depth + 1);
        }
        return out.toString();
    }

    /**
     * {@code \def\name#1#2{body}}
     */
    private int parseDef(StringBuilder buffer, int pos) {
        int start = skipSpaces(buffer, pos);
        String name = readMacroName(buffer, start, "\\def");
        int cursor = start + 1 + name.length();
        int parameters = 0;
        while (cursor < buffer.length() && buffer.charAt(cursor) != '{') {
            char c = buffer.charAt(cursor);
            if (c == '#' && cursor + 1 < buffer.length() && Character.isDigit(buffer.charAt(cursor + 1))) {
                int index = buffer.charAt(cursor + 1) - '0';
                if (index != parameters + 1) {
                    throw ParseException.at("Parameters of \\" + name + " must be numbered in order", buffer.toString(), cursor);
                }
                parameters = index;
                cursor += 2;
            } else if (Character.isWhitespace(c)) {
                cursor++;
            } else {
                throw ParseException.at("Delimited parameters are not supported in \\def\\" + name, buffer.toString(), cursor);
            }
        }
        if (cursor >= buffer.length()) {
            throw ParseException.at("Missing body for \\def\\" + name, buffer.toString(), pos);
        }
        int close = matchingBrace(buffer, cursor);
        define(name, parameters, buffer.substring(cursor + 1, close));
        return close + 1;
    }

    /**
     * {@code \newcommand{\name}[n]{body}} or {@code \newcommand\name[n]{body}}, optionally with a
     * default for the first argument which is accepted and ignored.
     */
    private int parseNewCommand(StringBuilder buffer, int pos, String command) {
        int cursor = skipSpaces(buffer, pos);
        String name;
        if (cursor < buffer.length() && buffer.charAt(cursor) == '{') {
            int close = matchingBrace(buffer, cursor);
            int nameStart = skipSpaces(buffer, cursor + 1);
            name = readMacroName(buffer, nameStart, "\\" + command);
            cursor = close + 1;
        } else {
            name = readMacroName(buffer, cursor, "\\" + command);
            cursor = cursor + 1 + name.length();
        }
        int parameters = 0;
        cursor = skipSpaces(buffer, cursor);
        if (cursor < buffer.length() && buffer.charAt(cursor) == '[') {
            int close = buffer.indexOf("]", cursor);
            if (close < 0) {
                throw ParseException.at("Unterminated parameter count for \\" + name, buffer.toString(), cursor);
            }
            String count = buffer.substring(cursor + 1, close).trim();
            try {
                parameters = Integer.parseInt(count);
            } catch (NumberFormatException e) {
                throw ParseException.at("Invalid parameter count '" + count + "' for \\" + name, buffer.toString(), cursor);
            }
            cursor = skipSpaces(buffer, close + 1);
            if (cursor < buffer.length() && buffer.charAt(cursor) == '[') {
                throw ParseException.at("Optional argument defaults are not supported for \\" + name,
                    buffer.toString(), cursor);
            }
        }
        if (cursor >= buffer.length() || buffer.charAt(cursor) != '{') {
            throw ParseException.at("Missing body for \\" + command + "\\" + name, buffer.toString(), cursor);
        }
        int close = matchingBrace(buffer, cursor);
        define(name, parameters, buffer.substring(cursor + 1, close));
        return close + 1;
    }

    private String readMacroName(StringBuilder buffer, int pos, String context) {
        if (pos >= buffer.length() || buffer.charAt(pos) != '\\') {
            throw ParseException.at("Expected macro name after " + context, buffer.toString(), pos);
        }
        int end = ControlWords.wordEnd(buffer, pos + 1);
        if (end == pos + 1) {
            throw ParseException.at("Expected macro name after " + context, buffer.toString(), pos);
        }
        return buffer.substring(pos + 1, end);
    }

    private static int skipSpaces(CharSequence text, int pos) {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static int matchingBrace(StringBuilder buffer, int open) {
        int depth = 0;
        for (int i = open; i < buffer.length(); i++) {
            char c = buffer.charAt(i);
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
        throw ParseException.at("Unbalanced '{'", buffer.toString(), open);
    }
}

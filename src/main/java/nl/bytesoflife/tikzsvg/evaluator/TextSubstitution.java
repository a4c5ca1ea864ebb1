package nl.bytesoflife.tikzsvg.evaluator;

import nl.bytesoflife.tikzsvg.lexer.ControlWords;

import java.util.Optional;

/**
 * Replaces {@code \name} references in free text (labels, coordinate names, option values)
 * with the value bound in the given scope. Unbound names are left untouched.
 */
public final class TextSubstitution {

    private TextSubstitution() {
    }

    public static String substitute(String text, EvaluationContext.Scope scope) {
        return substitute(text, scope, false);
    }

    /**
     * Only substitutes variables whose value is text; numeric variables stay in place
     * so a later arithmetic evaluation can still see them.
     */
    public static String substituteText(String text, EvaluationContext.Scope scope) {
        return substitute(text, scope, true);
    }

    private static String substitute(String text, EvaluationContext.Scope scope, boolean textOnly) {
        if (text == null || text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int pos = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c != '\\') {
                out.append(c);
                pos++;
                continue;
            }
            int start = pos + 1;
            int end = ControlWords.wordEnd(text, start);
            if (end == start) {
                // escaped character such as \\ or \{
                out.append(text, pos, Math.min(end + 1, text.length()));
                pos = Math.min(end + 1, text.length());
                continue;
            }
            Optional<Binding> binding = scope.find(text.substring(start, end));
            if (binding.isPresent() && !(textOnly && binding.get().isNumeric())) {
                out.append(binding.get().asText());
            } else {
                out.append(text, pos, end);
            }
            pos = end;
        }
        return out.toString();
    }
}

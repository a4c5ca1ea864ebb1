package nl.bytesoflife.tikzsvg.evaluator;

import java.util.List;

/**
 * A user macro: a body with placeholders {@code #1} to {@code #9}.
 */
public record MacroTemplate(String name, int parameterCount, String body) {

    public MacroTemplate {
        if (parameterCount < 0 || parameterCount > 9) {
            throw new IllegalArgumentException("Macro \\" + name + " declares " + parameterCount + " parameters, at most 9 allowed");
        }
    }

    public String instantiate(List<String> arguments) {
        if (arguments.size() != parameterCount) {
            throw new IllegalArgumentException("Macro \\" + name + " expects " + parameterCount
                + " arguments, got " + arguments.size());
        }
        if (parameterCount == 0) {
            return body;
        }
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '#' && i + 1 < body.length()) {
                char next = body.charAt(i + 1);
                if (next >= '1' && next <= '9' && next - '0' <= parameterCount) {
                    out.append(arguments.get(next - '1'));
                    i++;
                    continue;
                }
                if (next == '#') {
                    out.append('#');
                    i++;
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }
}

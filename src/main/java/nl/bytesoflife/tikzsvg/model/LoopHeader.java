package nl.bytesoflife.tikzsvg.model;

import java.util.List;

/**
 * Everything of a {@code \foreach} except its body: shared by statement loops and
 * loops inside a path.
 *
 * @param variables   loop variable names without backslash, one or more
 * @param values      values to iterate
 * @param evaluations {@code evaluate=} clauses in source order
 * @param count       {@code count=} clause or {@code null}
 */
public record LoopHeader(List<String> variables, Values values, List<EvaluateBinding> evaluations, CountBinding count) {

    public LoopHeader {
        variables = List.copyOf(variables);
        evaluations = List.copyOf(evaluations);
        if (variables.isEmpty()) {
            throw new IllegalArgumentException("A loop needs at least one variable");
        }
    }

    public sealed interface Values permits ExplicitList, Range {
    }

    /** {@code {a, b/c, d}}: raw items, tuples still joined with {@code /}. */
    public record ExplicitList(List<String> items) implements Values {
        public ExplicitList {
            items = List.copyOf(items);
        }
    }

    /** {@code {a,...,b}} or, with a second value, {@code {a,second,...,b}}. */
    public record Range(String start, String second, String end) implements Values {
    }

    /**
     * {@code evaluate=\x as \y using expr}; {@code target} equals {@code source} and
     * {@code expression} is {@code null} for the short form {@code evaluate=\x}.
     */
    public record EvaluateBinding(String source, String target, String expression) {
    }

    /** {@code count=\c from n}. */
    public record CountBinding(String variable, String from) {
    }
}

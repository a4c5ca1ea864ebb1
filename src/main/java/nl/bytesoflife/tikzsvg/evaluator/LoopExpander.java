package nl.bytesoflife.tikzsvg.evaluator;

import nl.bytesoflife.tikzsvg.model.LoopHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs the iterations of a {@code \foreach}.
 * <p>
 * Each iteration gets its own child scope of the caller's scope, holding the loop variables,
 * the {@code count} variable and the {@code evaluate} results. The scope is released when the
 * iteration body returns, so nothing leaks into the next iteration or out of the loop.
 */
public class LoopExpander {

    private static final Logger log = LoggerFactory.getLogger(LoopExpander.class);

    private static final double EPSILON = 1e-9;

    private final ExpressionEvaluator evaluator;

    public LoopExpander(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Calls {@code body} once per value tuple, in order.
     *
     * @return number of iterations run
     */
    public int forEach(LoopHeader header, EvaluationContext.Scope parent, Consumer<EvaluationContext.Scope> body) {
        List<List<Binding>> tuples = values(header, parent);
        log.debug("Loop over {} runs {} iteration(s)", header.variables(), tuples.size());

        int from = 1;
        if (header.count() != null && header.count().from() != null) {
            from = (int) evaluator.evaluate(header.count().from(), parent);
        }

        for (int i = 0; i < tuples.size(); i++) {
            EvaluationContext.Scope scope = parent.child();
            try {
                List<Binding> tuple = tuples.get(i);
                for (int v = 0; v < header.variables().size(); v++) {
                    scope.define(header.variables().get(v), tuple.get(v));
                }
                if (header.count() != null) {
                    scope.defineNumber(header.count().variable(), from + i);
                }
                for (LoopHeader.EvaluateBinding evaluation : header.evaluations()) {
                    String expression = evaluation.expression() != null
                        ? evaluation.expression()
                        : "\\" + EvaluationContext.normalize(evaluation.source());
                    scope.defineNumber(evaluation.target(), evaluator.evaluate(expression, scope));
                }
                body.accept(scope);
            } finally {
                scope.release();
            }
        }
        return tuples.size();
    }

    /**
     * The value tuples the loop iterates over, one binding per loop variable.
     *
     * @throws ArityMismatchException when a tuple does not match the number of variables
     */
    public List<List<Binding>> values(LoopHeader header, EvaluationContext.Scope parent) {
        int arity = header.variables().size();
        LoopHeader.Values values = header.values();
        if (values instanceof LoopHeader.Range range) {
            if (arity != 1) {
                throw new ArityMismatchException(range.start() + ",...," + range.end(), arity, 1);
            }
            List<List<Binding>> result = new ArrayList<>();
            for (Binding binding : expandRange(range, parent)) {
                result.add(List.of(binding));
            }
            return result;
        }

        LoopHeader.ExplicitList list = (LoopHeader.ExplicitList) values;
        List<List<Binding>> result = new ArrayList<>(list.items().size());
        for (String item : list.items()) {
            List<String> parts = arity == 1 ? List.of(item) : splitTuple(item);
            if (parts.size() != arity) {
                throw new ArityMismatchException(item, arity, parts.size());
            }
            List<Binding> tuple = new ArrayList<>(arity);
            for (String part : parts) {
                tuple.add(bindValue(part, parent));
            }
            result.add(tuple);
        }
        return result;
    }

    private List<Binding> expandRange(LoopHeader.Range range, EvaluationContext.Scope scope) {
        if (isLetter(range.start()) && isLetter(range.end()) && (range.second() == null || isLetter(range.second()))) {
            return letterRange(range);
        }
        double start = evaluator.evaluate(range.start(), scope);
        double end = evaluator.evaluate(range.end(), scope);
        double step;
        if (range.second() != null) {
            step = evaluator.evaluate(range.second(), scope) - start;
        } else {
            step = end >= start ? 1 : -1;
        }

        List<Binding> result = new ArrayList<>();
        if (Math.abs(step) < EPSILON) {
            result.add(Binding.number(start));
            return result;
        }
        double span = (end - start) / step;
        if (span < -EPSILON) {
            return result;
        }
        long count = (long) Math.floor(span + EPSILON) + 1;
        for (long i = 0; i < count; i++) {
            result.add(Binding.number(clean(start + i * step)));
        }
        return result;
    }

    private static List<Binding> letterRange(LoopHeader.Range range) {
        char start = range.start().trim().charAt(0);
        char end = range.end().trim().charAt(0);
        int step = range.second() != null ? range.second().trim().charAt(0) - start : (end >= start ? 1 : -1);
        List<Binding> result = new ArrayList<>();
        if (step == 0) {
            result.add(Binding.text(String.valueOf(start)));
            return result;
        }
        for (int c = start; step > 0 ? c <= end : c >= end; c += step) {
            result.add(Binding.text(String.valueOf((char) c)));
        }
        return result;
    }

    private static boolean isLetter(String value) {
        String trimmed = value.trim();
        return trimmed.length() == 1 && Character.isLetter(trimmed.charAt(0));
    }

    /** Snaps values such as 0.30000000000000004 produced by repeated steps. */
    private static double clean(double value) {
        double rounded = Math.rint(value * 1e9) / 1e9;
        return rounded == 0 ? 0 : rounded;
    }

    private Binding bindValue(String raw, EvaluationContext.Scope scope) {
        String value = raw.trim();
        if (value.startsWith("{") && value.endsWith("}")) {
            return Binding.text(value.substring(1, value.length() - 1));
        }
        try {
            return Binding.number(evaluator.evaluate(value, scope));
        } catch (EvaluationException e) {
            return Binding.text(TextSubstitution.substitute(value, scope));
        }
    }

    static List<String> splitTuple(String item) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < item.length(); i++) {
            char c = item.charAt(i);
            if (c == '(' || c == '{') {
                depth++;
            } else if (c == ')' || c == '}') {
                depth--;
            } else if (c == '/' && depth == 0) {
                parts.add(item.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(item.substring(start).trim());
        return parts;
    }
}

package nl.bytesoflife.tikzsvg.evaluator;

import nl.bytesoflife.tikzsvg.lexer.ControlWords;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates the arithmetic used inside coordinates, loop bounds and option values.
 * <p>
 * Grammar: {@code + - * /}, right-associative {@code ^}, unary minus, parentheses,
 * function calls, the constants {@code pi} and {@code e}, and variables written {@code \name}.
 * Trigonometric functions work in degrees. The evaluator itself is stateless and
 * can be shared; variables are looked up in the scope passed to {@link #evaluate}.
 */
public class ExpressionEvaluator {

    public double evaluate(String expression, EvaluationContext.Scope scope) {
        if (expression == null || expression.isBlank()) {
            throw new EvaluationException("Empty expression", String.valueOf(expression));
        }
        Parser parser = new Parser(expression, scope);
        double value = parser.parseExpression();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw new EvaluationException("Unexpected '" + parser.peek() + "' at position " + parser.pos, expression);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new EvaluationException("Result is not a finite number", expression);
        }
        return value;
    }

    /**
     * Convenience variant that returns {@code fallback} instead of throwing.
     */
    public double evaluateOr(String expression, EvaluationContext.Scope scope, double fallback) {
        try {
            return evaluate(expression, scope);
        } catch (EvaluationException e) {
            return fallback;
        }
    }

    private static final class Parser {
        private final String input;
        private final EvaluationContext.Scope scope;
        private int pos;

        private Parser(String input, EvaluationContext.Scope scope) {
            this.input = input;
            this.scope = scope;
        }

        double parseExpression() {
            double value = parseTerm();
            while (true) {
                skipWhitespace();
                if (match('+')) {
                    value += parseTerm();
                } else if (match('-')) {
                    value -= parseTerm();
                } else {
                    return value;
                }
            }
        }

        private double parseTerm() {
            double value = parseUnary();
            while (true) {
                skipWhitespace();
                if (match('*')) {
                    value *= parseUnary();
                } else if (match('/')) {
                    value /= parseUnary();
                } else {
                    return value;
                }
            }
        }

        private double parseUnary() {
            skipWhitespace();
            if (match('-')) {
                return -parseUnary();
            }
            if (match('+')) {
                return parseUnary();
            }
            return parsePower();
        }

        private double parsePower() {
            double base = parsePrimary();
            skipWhitespace();
            if (match('^')) {
                // right-associative, and binds tighter than unary minus on the left
                return Math.pow(base, parseUnary());
            }
            return base;
        }

        private double parsePrimary() {
            skipWhitespace();
            if (atEnd()) {
                throw error("Unexpected end of expression");
            }
            char c = peek();
            if (c == '(') {
                pos++;
                double value = parseExpression();
                skipWhitespace();
                expect(')');
                return value;
            }
            if (Character.isDigit(c) || c == '.') {
                return parseNumber();
            }
            if (c == '\\') {
                return parseVariable();
            }
            if (Character.isLetter(c)) {
                return parseIdentifier();
            }
            throw error("Unexpected '" + c + "' at position " + pos);
        }

        private double parseNumber() {
            int start = pos;
            while (!atEnd() && Character.isDigit(peek())) {
                pos++;
            }
            if (!atEnd() && peek() == '.') {
                pos++;
                while (!atEnd() && Character.isDigit(peek())) {
                    pos++;
                }
            }
            if (!atEnd() && (peek() == 'e' || peek() == 'E') && exponentFollows()) {
                pos++;
                if (peek() == '+' || peek() == '-') {
                    pos++;
                }
                while (!atEnd() && Character.isDigit(peek())) {
                    pos++;
                }
            }
            String text = input.substring(start, pos);
            if (text.equals(".")) {
                throw error("Malformed number at position " + start);
            }
            return Double.parseDouble(text);
        }

        private boolean exponentFollows() {
            int next = pos + 1;
            if (next < input.length() && (input.charAt(next) == '+' || input.charAt(next) == '-')) {
                next++;
            }
            return next < input.length() && Character.isDigit(input.charAt(next));
        }

        private double parseVariable() {
            int start = ++pos;
            pos = ControlWords.wordEnd(input, start);
            if (pos == start) {
                throw error("Expected variable name after '\\' at position " + start);
            }
            String name = input.substring(start, pos);
            Binding binding = scope.lookup(name);
            if (!binding.isNumeric()) {
                throw error("Variable \\" + name + " holds text '" + binding.text() + "', not a number");
            }
            return binding.number();
        }

        private double parseIdentifier() {
            int start = pos;
            while (!atEnd() && (Character.isLetterOrDigit(peek()))) {
                pos++;
            }
            String name = input.substring(start, pos);
            skipWhitespace();
            if (match('(')) {
                List<Double> args = new ArrayList<>();
                skipWhitespace();
                if (!match(')')) {
                    args.add(parseExpression());
                    skipWhitespace();
                    while (match(',')) {
                        args.add(parseExpression());
                        skipWhitespace();
                    }
                    expect(')');
                }
                return MathFunctions.apply(name, args, input);
            }
            switch (name) {
                case "pi":
                    return Math.PI;
                case "e":
                    return Math.E;
                default:
                    throw error("Unknown identifier '" + name + "'");
            }
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        private boolean match(char c) {
            if (!atEnd() && peek() == c) {
                pos++;
                return true;
            }
            return false;
        }

        private void expect(char c) {
            if (!match(c)) {
                throw error("Expected '" + c + "' at position " + pos);
            }
        }

        boolean atEnd() {
            return pos >= input.length();
        }

        char peek() {
            return input.charAt(pos);
        }

        private EvaluationException error(String message) {
            return new EvaluationException(message, input);
        }
    }
}

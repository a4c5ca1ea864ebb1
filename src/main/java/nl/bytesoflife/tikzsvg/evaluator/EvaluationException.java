package nl.bytesoflife.tikzsvg.evaluator;

import nl.bytesoflife.tikzsvg.ConversionException;

/**
 * Raised when an arithmetic expression cannot be evaluated: bad syntax, an undefined variable,
 * an unknown function or a non-finite result.
 */
public class EvaluationException extends ConversionException {

    private final String expression;

    public EvaluationException(String message, String expression) {
        super(message + " in '" + expression + "'");
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}

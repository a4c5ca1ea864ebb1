package nl.bytesoflife.tikzsvg.evaluator;

import java.util.List;

/**
 * Built-in functions of the expression language. Angles are in degrees.
 */
final class MathFunctions {

    private MathFunctions() {
    }

    static double apply(String name, List<Double> args, String expression) {
        switch (name) {
            case "sqrt":
                return Math.sqrt(single(name, args, expression));
            case "sin":
                return Math.sin(Math.toRadians(single(name, args, expression)));
            case "cos":
                return Math.cos(Math.toRadians(single(name, args, expression)));
            case "tan":
                return Math.tan(Math.toRadians(single(name, args, expression)));
            case "asin":
                return Math.toDegrees(Math.asin(single(name, args, expression)));
            case "acos":
                return Math.toDegrees(Math.acos(single(name, args, expression)));
            case "atan":
                return Math.toDegrees(Math.atan(single(name, args, expression)));
            case "atan2":
                checkArity(name, args, 2, expression);
                return Math.toDegrees(Math.atan2(args.get(0), args.get(1)));
            case "abs":
                return Math.abs(single(name, args, expression));
            case "exp":
                return Math.exp(single(name, args, expression));
            case "ln":
                return Math.log(single(name, args, expression));
            case "log":
                return Math.log10(single(name, args, expression));
            case "floor":
                return Math.floor(single(name, args, expression));
            case "ceil":
                return Math.ceil(single(name, args, expression));
            case "round":
                return Math.floor(single(name, args, expression) + 0.5);
            case "int":
            case "trunc":
                return (double) (long) single(name, args, expression);
            case "deg":
                return Math.toDegrees(single(name, args, expression));
            case "rad":
                return Math.toRadians(single(name, args, expression));
            case "pow":
                checkArity(name, args, 2, expression);
                return Math.pow(args.get(0), args.get(1));
            case "mod":
                checkArity(name, args, 2, expression);
                return args.get(0) % args.get(1);
            case "min":
                return extreme(name, args, expression, true);
            case "max":
                return extreme(name, args, expression, false);
            default:
                throw new EvaluationException("Unknown function '" + name + "'", expression);
        }
    }

    private static double single(String name, List<Double> args, String expression) {
        checkArity(name, args, 1, expression);
        return args.get(0);
    }

    private static double extreme(String name, List<Double> args, String expression, boolean min) {
        if (args.isEmpty()) {
            throw new EvaluationException(name + "() needs at least one argument", expression);
        }
        double result = args.get(0);
        for (double value : args) {
            result = min ? Math.min(result, value) : Math.max(result, value);
        }
        return result;
    }

    private static void checkArity(String name, List<Double> args, int expected, String expression) {
        if (args.size() != expected) {
            throw new EvaluationException(name + "() takes " + expected + " argument(s), got " + args.size(), expression);
        }
    }
}

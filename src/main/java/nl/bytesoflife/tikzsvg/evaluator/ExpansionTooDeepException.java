package nl.bytesoflife.tikzsvg.evaluator;

import nl.bytesoflife.tikzsvg.ConversionException;

/**
 * Thrown when macro expansion nests deeper than the configured limit, usually because
 * macros refer to each other in a cycle.
 */
public class ExpansionTooDeepException extends ConversionException {

    private final String macroName;
    private final int maxDepth;

    public ExpansionTooDeepException(String macroName, int maxDepth) {
        super("Macro expansion of \\" + macroName + " exceeds maximum depth " + maxDepth);
        this.macroName = macroName;
        this.maxDepth = maxDepth;
    }

    public String getMacroName() {
        return macroName;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}

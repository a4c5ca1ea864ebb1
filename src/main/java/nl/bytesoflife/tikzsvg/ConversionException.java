package nl.bytesoflife.tikzsvg;

/**
 * Base type for every failure that aborts the conversion of a diagram.
 * Carries the source location when one is known (line and column are 1-based, 0 means unknown).
 */
public class ConversionException extends RuntimeException {

    private final int line;
    private final int column;

    public ConversionException(String message) {
        this(message, 0, 0);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
        this.line = 0;
        this.column = 0;
    }

    public ConversionException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasLocation() {
        return line > 0;
    }

    @Override
    public String getMessage() {
        if (!hasLocation()) {
            return super.getMessage();
        }
        return super.getMessage() + " (line " + line + ", column " + column + ")";
    }
}

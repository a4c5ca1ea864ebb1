package nl.bytesoflife.tikzsvg.lexer;

/**
 * A lexical token with its source span. {@code start} and {@code end} are offsets into the
 * lexed text; line and column are 1-based.
 */
public record Token(TokenType type, String text, int start, int end, int line, int column) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean is(TokenType expected, String expectedText) {
        return type == expected && text.equals(expectedText);
    }

    @Override
    public String toString() {
        return type + "('" + text + "') at " + line + ":" + column;
    }
}

package nl.bytesoflife.tikzsvg.lexer;

/**
 * Characters that make up a control word such as {@code \draw} or {@code \my@macro}. Every stage
 * that scans {@code \name} references uses this class so they agree on where a name ends.
 */
public final class ControlWords {

    static final String WORD_CLASS = "[A-Za-z@]";

    private ControlWords() {
    }

    public static boolean isWordChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '@';
    }

    /**
     * @return the index just past the control word starting at {@code pos}, or {@code pos} when
     * there is none
     */
    public static int wordEnd(CharSequence text, int pos) {
        int end = pos;
        while (end < text.length() && isWordChar(text.charAt(end))) {
            end++;
        }
        return end;
    }
}

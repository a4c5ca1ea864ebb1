package nl.bytesoflife.tikzsvg.lexer;

public enum TokenType {
    /** {@code \draw}, {@code \i}; text holds the name without backslash. */
    COMMAND,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    LPAREN,
    RPAREN,
    SEMICOLON,
    COMMA,
    EQUALS,
    COLON,
    WORD,
    NUMBER,
    /** Path connectors ({@code --}, {@code ..}, {@code |-}, {@code -|}, {@code ++}) and single punctuation. */
    OPERATOR,
    EOF
}

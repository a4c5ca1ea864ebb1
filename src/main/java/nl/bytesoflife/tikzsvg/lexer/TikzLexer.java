package nl.bytesoflife.tikzsvg.lexer;

import nl.bytesoflife.tikzsvg.parser.ParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits macro-expanded picture text into tokens. Whitespace is dropped; every token keeps
 * its offsets so the parser can slice raw source for option lists, coordinates and node text.
 */
public class TikzLexer {

    private static final Pattern COMMAND_PATTERN = Pattern.compile("\\\\(" + ControlWords.WORD_CLASS + "+|.)", Pattern.DOTALL);
    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\d+(?:\\.\\d*)?|\\.\\d+");
    private static final Pattern WORD_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_']*");
    private static final String[] CONNECTORS = {"--", "..", "|-", "-|", "++"};

    public List<Token> tokenize(String content) {
        List<Token> tokens = new ArrayList<>();
        Matcher command = COMMAND_PATTERN.matcher(content);
        Matcher number = NUMBER_PATTERN.matcher(content);
        Matcher word = WORD_PATTERN.matcher(content);
        int pos = 0;
        int line = 1;
        int lineStart = 0;

        while (pos < content.length()) {
            char c = content.charAt(pos);
            if (c == '\n') {
                line++;
                lineStart = pos + 1;
                pos++;
                continue;
            }
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            int column = pos - lineStart + 1;

            if (c == '\\') {
                command.region(pos, content.length());
                if (!command.lookingAt()) {
                    throw new ParseException("Dangling '\\' at end of input", line, column);
                }
                tokens.add(new Token(TokenType.COMMAND, command.group(1), pos, command.end(), line, column));
                pos = command.end();
                continue;
            }

            TokenType single = singleCharType(c);
            if (single != null) {
                tokens.add(new Token(single, String.valueOf(c), pos, pos + 1, line, column));
                pos++;
                continue;
            }

            if (Character.isDigit(c) || (c == '.' && pos + 1 < content.length() && Character.isDigit(content.charAt(pos + 1)))) {
                number.region(pos, content.length());
                if (number.lookingAt()) {
                    tokens.add(new Token(TokenType.NUMBER, number.group(), pos, number.end(), line, column));
                    pos = number.end();
                    continue;
                }
            }

            if (Character.isLetter(c) || c == '_') {
                word.region(pos, content.length());
                if (word.lookingAt()) {
                    tokens.add(new Token(TokenType.WORD, word.group(), pos, word.end(), line, column));
                    pos = word.end();
                    continue;
                }
            }

            String connector = connectorAt(content, pos);
            String text = connector != null ? connector : String.valueOf(c);
            tokens.add(new Token(TokenType.OPERATOR, text, pos, pos + text.length(), line, column));
            pos += text.length();
        }

        tokens.add(new Token(TokenType.EOF, "", content.length(), content.length(), line, content.length() - lineStart + 1));
        return tokens;
    }

    private static TokenType singleCharType(char c) {
        switch (c) {
            case '{':
                return TokenType.LBRACE;
            case '}':
                return TokenType.RBRACE;
            case '[':
                return TokenType.LBRACKET;
            case ']':
                return TokenType.RBRACKET;
            case '(':
                return TokenType.LPAREN;
            case ')':
                return TokenType.RPAREN;
            case ';':
                return TokenType.SEMICOLON;
            case ',':
                return TokenType.COMMA;
            case '=':
                return TokenType.EQUALS;
            case ':':
                return TokenType.COLON;
            default:
                return null;
        }
    }

    private static String connectorAt(String content, int pos) {
        for (String connector : CONNECTORS) {
            if (content.startsWith(connector, pos)) {
                return connector;
            }
        }
        return null;
    }
}

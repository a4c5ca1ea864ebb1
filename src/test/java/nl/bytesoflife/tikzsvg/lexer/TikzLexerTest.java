package nl.bytesoflife.tikzsvg.lexer;

import nl.bytesoflife.tikzsvg.parser.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TikzLexerTest {

    private final TikzLexer lexer = new TikzLexer();

    private List<TokenType> types(String input) {
        return lexer.tokenize(input).stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void tokenizesADrawStatement() {
        List<Token> tokens = lexer.tokenize("\\draw[red] (0,0) -- (1,2);");

        assertEquals(TokenType.COMMAND, tokens.get(0).type());
        assertEquals("draw", tokens.get(0).text());
        assertEquals(List.of(
            TokenType.COMMAND, TokenType.LBRACKET, TokenType.WORD, TokenType.RBRACKET,
            TokenType.LPAREN, TokenType.NUMBER, TokenType.COMMA, TokenType.NUMBER, TokenType.RPAREN,
            TokenType.OPERATOR,
            TokenType.LPAREN, TokenType.NUMBER, TokenType.COMMA, TokenType.NUMBER, TokenType.RPAREN,
            TokenType.SEMICOLON, TokenType.EOF), types("\\draw[red] (0,0) -- (1,2);"));
    }

    @Test
    void recognizesPathConnectors() {
        List<String> operators = lexer.tokenize("-- .. |- -| ++ + /").stream()
            .filter(t -> t.is(TokenType.OPERATOR))
            .map(Token::text)
            .collect(Collectors.toList());
        assertEquals(List.of("--", "..", "|-", "-|", "++", "+", "/"), operators);
    }

    @Test
    void commandsKeepNameWithoutBackslash() {
        List<Token> tokens = lexer.tokenize("\\foreach \\i \\\\");
        assertEquals("foreach", tokens.get(0).text());
        assertEquals("i", tokens.get(1).text());
        assertEquals("\\", tokens.get(2).text());
    }

    @Test
    void tracksLinesAndColumns() {
        List<Token> tokens = lexer.tokenize("\\draw\n  (0,0);");
        Token paren = tokens.get(1);
        assertEquals(TokenType.LPAREN, paren.type());
        assertEquals(2, paren.line());
        assertEquals(3, paren.column());
    }

    @Test
    void offsetsAllowSlicingRawSource() {
        String input = "[thick, color=red!50]";
        List<Token> tokens = lexer.tokenize(input);
        Token open = tokens.get(0);
        Token close = tokens.get(tokens.size() - 2);
        assertEquals("thick, color=red!50", input.substring(open.end(), close.start()));
    }

    @Test
    void numbersAndWords() {
        List<Token> tokens = lexer.tokenize("1.5 .25 cycle node_1");
        assertEquals("1.5", tokens.get(0).text());
        assertEquals(".25", tokens.get(1).text());
        assertTrue(tokens.get(2).is(TokenType.WORD, "cycle"));
        assertTrue(tokens.get(3).is(TokenType.WORD, "node_1"));
    }

    @Test
    void danglingBackslashFails() {
        assertThrows(ParseException.class, () -> lexer.tokenize("\\draw \\"));
    }

    @Test
    void emptyInputHasOnlyEof() {
        assertEquals(List.of(TokenType.EOF), types("  \n "));
    }

    @Test
    void controlWordsIncludeAtSign() {
        String input = "\\my@macro{1}";
        Token command = lexer.tokenize(input).get(0);
        assertEquals("my@macro", command.text());
        assertEquals(ControlWords.wordEnd(input, 1), 1 + command.text().length());
    }
}

package nl.bytesoflife.tikzsvg.evaluator;

import nl.bytesoflife.tikzsvg.parser.ParseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MacroExpanderTest {

    @Test
    void simpleDefinitionIsReplaced() {
        MacroExpander expander = new MacroExpander();
        String result = expander.expand("\\def\\len{2}\\draw (0,0) -- (\\len,0);");
        assertEquals("\\draw (0,0) -- (2,0);", result);
    }

    @Test
    void redefinitionAppliesFromThatPointOnly() {
        MacroExpander expander = new MacroExpander();
        String result = expander.expand("\\def\\v{1}A=\\v;\\def\\v{2}B=\\v;");
        assertEquals("A=1;B=2;", result);
    }

    @Test
    void parametricNewcommand() {
        MacroExpander expander = new MacroExpander();
        String result = expander.expand("\\newcommand{\\f}[2]{A=#1 B=#2}\\f{1}{2}");
        assertEquals("A=1 B=2", result);
    }

    @Test
    void newcommandWithoutBracesAndRenewcommand() {
        MacroExpander expander = new MacroExpander();
        String result = expander.expand("\\newcommand\\r{1}\\r,\\renewcommand{\\r}{5}\\r");
        assertEquals("1,5", result);
    }

    @Test
    void defWithParameters() {
        MacroExpander expander = new MacroExpander();
        assertEquals("(3,4)", expander.expand("\\def\\pt#1#2{(#1,#2)}\\pt{3}{4}"));
        assertEquals(2, expander.getMacro("pt").orElseThrow().parameterCount());
    }

    @Test
    void argumentsMayContainBraces() {
        MacroExpander expander = new MacroExpander();
        assertEquals("[{a,b}]", expander.expand("\\def\\wrap#1{[#1]}\\wrap{{a,b}}"));
    }

    @Test
    void nestedMacrosAreRescanned() {
        MacroExpander expander = new MacroExpander();
        String result = expander.expand("\\def\\a{1}\\def\\b{\\a+\\a}\\b");
        assertEquals("1+1", result);
    }

    @Test
    void matchingIsWordBoundarySafe() {
        MacroExpander expander = new MacroExpander();
        String result = expander.expand("\\def\\dr{X}\\draw \\dr");
        assertEquals("\\draw X", result);
    }

    @Test
    void reservedWordsCannotBeDefined() {
        MacroExpander expander = new MacroExpander();
        assertThrows(ParseException.class, () -> expander.expand("\\def\\begin{oops}"));
        assertEquals("\\begin{tikzpicture}\\end{tikzpicture}",
            expander.expand("\\begin{tikzpicture}\\end{tikzpicture}"));
    }

    @Test
    void mutualRecursionFailsWithinTheBound() {
        MacroExpander expander = new MacroExpander();
        ExpansionTooDeepException e = assertThrows(ExpansionTooDeepException.class,
            () -> expander.expand("\\def\\a{\\b}\\def\\b{\\a}\\a"));
        assertTrue(e.getMacroName().equals("a") || e.getMacroName().equals("b"));
        assertEquals(20, e.getMaxDepth());
    }

    @Test
    void selfRecursionFails() {
        MacroExpander expander = new MacroExpander(5);
        ExpansionTooDeepException e = assertThrows(ExpansionTooDeepException.class,
            () -> expander.expand("\\def\\x{x\\x}\\x"));
        assertEquals("x", e.getMacroName());
    }

    @Test
    void chainAtTheDepthBoundSucceeds() {
        MacroExpander expander = new MacroExpander();
        StringBuilder source = new StringBuilder("\\def\\ma{done}");
        for (char c = 'b'; c <= 't'; c++) {
            source.append("\\def\\m").append(c).append("{\\m").append((char) (c - 1)).append('}');
        }
        source.append("\\mt");
        assertEquals("done", expander.expand(source.toString()));
    }

    @Test
    void missingArgumentIsASyntaxError() {
        MacroExpander expander = new MacroExpander();
        ParseException e = assertThrows(ParseException.class,
            () -> expander.expand("\\newcommand{\\f}[2]{#1#2}\n\\f{1} rest"));
        assertTrue(e.hasLocation());
        assertEquals(2, e.getLine());
    }

    @Test
    void controlSymbolsAreCopied() {
        MacroExpander expander = new MacroExpander();
        assertEquals("a\\\\b\\%", expander.expand("a\\\\b\\%"));
    }

    @Test
    void unknownCommandsPassThrough() {
        MacroExpander expander = new MacroExpander();
        assertEquals("\\foreach \\i in {1,2}", expander.expand("\\foreach \\i in {1,2}"));
        assertEquals(0, expander.getMacroCount());
    }

    @Test
    void optionalArgumentDefaultIsRejected() {
        MacroExpander expander = new MacroExpander();
        ParseException e = assertThrows(ParseException.class,
            () -> expander.expand("\\newcommand{\\f}[2][d]{#1/#2}\\f{x}"));
        assertTrue(e.getMessage().contains("\\f"), e.getMessage());
        assertTrue(expander.getMacro("f").isEmpty());
    }

    @Test
    void atSignIsPartOfTheMacroName() {
        MacroExpander expander = new MacroExpander();
        assertEquals("(2) \\my", expander.expand("\\def\\my@len{2}(\\my@len) \\my"));
    }
}

package nl.bytesoflife.tikzsvg;

import nl.bytesoflife.tikzsvg.evaluator.ExpansionTooDeepException;
import nl.bytesoflife.tikzsvg.parser.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TikzSvgConverterTest {

    private final TikzSvgConverter converter = new TikzSvgConverter();

    @Test
    void convertsAPicture() {
        String svg = converter.convert("""
                \\begin{tikzpicture}
                  \\draw[red] (0,0) -- (1,0);
                \\end{tikzpicture}
                """);
        assertTrue(svg.startsWith("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"500\" height=\"500\""));
        assertTrue(svg.contains("<path d=\"M 250.00 250.00 L 278.35 250.00\" style=\"stroke: #FF0000;"));
        assertTrue(svg.endsWith("</svg>\n"));
    }

    @Test
    void convertsBareStatements() {
        assertTrue(converter.convert("\\draw (0,0) circle (1);").contains("A 28.35 28.35"));
    }

    @Test
    void everyPictureOfADocument() {
        String document = """
                \\documentclass{article}
                \\begin{document}
                \\begin{tikzpicture}
                  \\draw (0,0) -- (1,0);
                \\end{tikzpicture}
                Some text.
                \\begin{tikzpicture}
                  \\fill (0,0) rectangle (1,1);
                \\end{tikzpicture}
                \\end{document}
                """;
        List<String> pictures = converter.convertDocument(document);
        assertEquals(2, pictures.size());
        assertTrue(pictures.get(0).contains("fill: none"));
        assertTrue(pictures.get(1).contains("stroke: none"));
        assertEquals(pictures.get(0), converter.convert(document));
    }

    @Test
    void preambleMacrosApplyToLaterPictures() {
        List<String> pictures = converter.convertDocument("""
                \\newcommand{\\side}{2}
                \\def\\col{blue}
                \\begin{tikzpicture}
                  \\draw[\\col] (0,0) -- (\\side,0);
                  \\coordinate (A) at (1,1);
                \\end{tikzpicture}
                \\begin{tikzpicture}
                  \\draw (0,0) -- (\\side,\\side) -- (A);
                \\end{tikzpicture}
                """);
        assertTrue(pictures.get(0).contains("d=\"M 250.00 250.00 L 306.70 250.00\" style=\"stroke: #0000FF;"));
        // named coordinates belong to one picture
        assertTrue(pictures.get(1).contains("d=\"M 250.00 250.00 L 306.70 193.30 L 250.00 250.00\""));
    }

    @Test
    void nothingCarriesOverBetweenDocuments() {
        converter.convert("\\def\\w{3} \\begin{tikzpicture} \\draw (0,0) -- (\\w,0); \\end{tikzpicture}");
        String second = converter.convert("\\begin{tikzpicture} \\draw (0,0) -- (\\w,0); \\end{tikzpicture}");
        assertTrue(second.contains("d=\"M 250.00 250.00 L 250.00 250.00\""), second);
    }

    @Test
    void repeatedConversionIsStable() {
        String source = "\\foreach \\i in {1,2,3} { \\draw (0,0) -- (\\i,\\i); \\node at (\\i,0) {\\i}; }";
        assertEquals(converter.convert(source), converter.convert(source));
    }

    @Test
    void commentsAreIgnored() {
        String svg = converter.convert("""
                \\begin{tikzpicture}
                  % \\draw (5,5) -- (6,6);
                  \\draw (0,0) -- (1,0); % trailing
                  \\node at (0,0) {100\\% done};
                \\end{tikzpicture}
                """);
        assertEquals(1, svg.split("<path", -1).length - 1);
        assertTrue(svg.contains(">100% done</text>"));
    }

    @Test
    void reportsMissingPictures() {
        ConversionException e = assertThrows(ConversionException.class, () -> converter.convert("  % nothing here\n"));
        assertEquals("No tikzpicture found", e.getMessage());
        assertTrue(converter.convertDocument("").isEmpty());
    }

    @Test
    void parseErrorsCarryTheLine() {
        ParseException e = assertThrows(ParseException.class, () -> converter.convert("""
                \\begin{tikzpicture}
                  \\draw (0,0) -- ;
                \\end{tikzpicture}
                """));
        assertTrue(e.hasLocation());
        assertEquals(2, e.getLine());
    }

    @Test
    void unterminatedPictureFails() {
        assertThrows(ParseException.class, () -> converter.convert("\\begin{tikzpicture} \\draw (0,0) -- (1,1);"));
    }

    @Test
    void runawayMacrosAreBounded() {
        converter.setMaxMacroDepth(5);
        ExpansionTooDeepException e = assertThrows(ExpansionTooDeepException.class,
            () -> converter.convert("\\def\\loop{\\loop} \\begin{tikzpicture} \\draw (0,0) -- (\\loop,0); \\end{tikzpicture}"));
        assertEquals(5, e.getMaxDepth());
    }

    @Test
    void sizeMovesTheOrigin() {
        String svg = converter.setWidth(800).setHeight(600).convert("\\draw (0,0) -- (1,0);");
        assertTrue(svg.contains("width=\"800\" height=\"600\" viewBox=\"0 0 800 600\""));
        assertTrue(svg.contains("d=\"M 400.00 300.00 L 428.35 300.00\""));
    }

    @Test
    void scaleIsPixelsPerCentimetre() {
        assertTrue(converter.setScale(10).convert("\\draw (0,0) -- (1,0);").contains("L 260.00 250.00"));
    }

    @Test
    void fitToContent() {
        String svg = converter.setFitToContent(5).convert("\\draw (0,0) rectangle (1,1);");
        assertTrue(svg.contains("viewBox=\"245.00 216.65 38.35 38.35\""), svg);
    }

    @Test
    void rejectsInvalidOptions() {
        assertThrows(IllegalArgumentException.class, () -> converter.setWidth(0));
        assertThrows(IllegalArgumentException.class, () -> converter.setScale(-1));
        assertThrows(IllegalArgumentException.class, () -> converter.setMaxMacroDepth(0));
    }
}

package nl.bytesoflife.tikzsvg.renderer.svg;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ColorTableTest {

    static Stream<Arguments> colors() {
        return Stream.of(
            Arguments.of("red", "#FF0000"),
            Arguments.of("Blue", "#0000FF"),
            Arguments.of(" orange ", "#FFA500"),
            Arguments.of("#12ab9F", "#12AB9F"),
            Arguments.of("red!25", "#FFBFBF"),
            Arguments.of("red!50!blue", "#800080"),
            Arguments.of("black!0", "#FFFFFF"),
            Arguments.of("black!100", "#000000"),
            Arguments.of("blue!150", "#0000FF"),
            Arguments.of("white!50!black!50", "#C0C0C0")
        );
    }

    @ParameterizedTest
    @MethodSource("colors")
    void resolves(String spec, String expected) {
        assertEquals(Optional.of(expected), ColorTable.resolve(spec));
    }

    @Test
    void rejectsUnknownColors() {
        assertTrue(ColorTable.resolve("chartreuse").isEmpty());
        assertTrue(ColorTable.resolve("red!x").isEmpty());
        assertTrue(ColorTable.resolve("red!50!nothing").isEmpty());
        assertTrue(ColorTable.resolve("#12345").isEmpty());
        assertTrue(ColorTable.resolve(null).isEmpty());
    }

    @Test
    void knowsNames() {
        assertTrue(ColorTable.isNamed("gray"));
        assertFalse(ColorTable.isNamed("thick"));
    }
}

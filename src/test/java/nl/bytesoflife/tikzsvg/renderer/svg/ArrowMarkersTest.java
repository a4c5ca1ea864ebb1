package nl.bytesoflife.tikzsvg.renderer.svg;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArrowMarkersTest {

    @Test
    void recognisesArrowSpecs() {
        assertTrue(ArrowMarkers.isArrowSpec("->"));
        assertTrue(ArrowMarkers.isArrowSpec("<-"));
        assertTrue(ArrowMarkers.isArrowSpec("<->"));
        assertTrue(ArrowMarkers.isArrowSpec("|-|"));
        assertTrue(ArrowMarkers.isArrowSpec("-stealth"));
        assertFalse(ArrowMarkers.isArrowSpec("-"));
        assertFalse(ArrowMarkers.isArrowSpec("red"));
        assertFalse(ArrowMarkers.isArrowSpec("very thick"));
    }

    @Test
    void attributesReferenceTheMarkers() {
        ArrowMarkers markers = new ArrowMarkers();
        assertTrue(markers.isEmpty());

        Map<String, String> both = markers.attributesFor("<->");
        assertEquals("url(#arrow-start)", both.get("marker-start"));
        assertEquals("url(#arrow-end)", both.get("marker-end"));

        Map<String, String> end = markers.attributesFor("-stealth");
        assertEquals(Map.of("marker-end", "url(#stealth-end)"), end);
        assertFalse(markers.isEmpty());
    }

    @Test
    void writesOnlyUsedDefinitions() {
        ArrowMarkers markers = new ArrowMarkers();
        markers.attributesFor("|->");
        StringBuilder out = new StringBuilder();
        markers.writeDefinitions(out, "");

        String defs = out.toString();
        assertTrue(defs.contains("<marker id=\"arrow-end\""));
        assertTrue(defs.contains("<marker id=\"bar\""));
        assertFalse(defs.contains("stealth"));
        assertTrue(defs.contains("orient=\"auto\""));
        assertTrue(defs.indexOf("arrow-end") < defs.indexOf("\"bar\""));
    }

    @Test
    void ignoresMalformedSpecs() {
        assertTrue(new ArrowMarkers().attributesFor("red").isEmpty());
    }
}

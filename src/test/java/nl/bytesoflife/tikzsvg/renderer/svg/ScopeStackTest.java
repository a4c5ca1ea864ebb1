package nl.bytesoflife.tikzsvg.renderer.svg;

import nl.bytesoflife.tikzsvg.evaluator.EvaluationContext;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScopeStackTest {

    private final LayerManager layers = new LayerManager();
    private final RenderScope root = new RenderScope(new EvaluationContext().root(), Map.of(), Transform.identity());
    private final ScopeStack stack = new ScopeStack(layers, root);

    @Test
    void pictureFrameCannotBePopped() {
        assertEquals(1, stack.depth());
        assertThrows(IllegalStateException.class, stack::pop);
    }

    @Test
    void framesWithoutAttributesWriteIntoTheirParent() {
        stack.push(ScopeStack.Kind.SCOPE, root, Map.of());
        assertSame(layers.root(LayerManager.MAIN), stack.target());
    }

    @Test
    void groupsAreCreatedOnFirstUse() {
        stack.push(ScopeStack.Kind.SCOPE, root, Map.of("style", "stroke: #FF0000"));
        assertTrue(layers.root(LayerManager.MAIN).isEmpty());

        SvgGroup group = stack.target();
        assertSame(group, stack.target());
        assertEquals("stroke: #FF0000", group.getAttributes().get("style"));
        assertFalse(layers.root(LayerManager.MAIN).isEmpty());
    }

    @Test
    void popClosesClipsOpenedInsideTheFrame() {
        stack.push(ScopeStack.Kind.SCOPE, root, Map.of());
        stack.push(ScopeStack.Kind.CLIP, root, Map.of("clip-path", "url(#clip1)"));
        stack.push(ScopeStack.Kind.CLIP, root, Map.of("clip-path", "url(#clip2)"));
        assertEquals(4, stack.depth());

        stack.pop();
        assertEquals(1, stack.depth());
    }

    @Test
    void layerFramesRouteToTheirLayer() {
        layers.declare("background");
        stack.pushLayer(root, "background");
        assertEquals("background", stack.currentLayer());
        assertSame(layers.root("background"), stack.target());

        stack.pop();
        assertEquals(LayerManager.MAIN, stack.currentLayer());
    }
}

package nl.bytesoflife.tikzsvg.renderer.svg;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stack of open scopes during traversal.
 * <p>
 * Each frame carries the {@link RenderScope} in effect and the attributes of the group it opens
 * in the output. Groups are created per layer on the first element drawn inside the frame, so a
 * scope that draws nothing emits nothing. A clip frame stays open until the frame that contains it
 * is popped; nested clips each get their own group and therefore intersect.
 */
public class ScopeStack {

    public enum Kind {
        PICTURE,
        SCOPE,
        ITERATION,
        LAYER,
        CLIP
    }

    private static final class Frame {
        private final Kind kind;
        private final RenderScope scope;
        private final Map<String, String> attributes;
        private final String layer;
        private final Frame parent;
        private final Map<String, SvgGroup> groups = new HashMap<>();

        private Frame(Kind kind, RenderScope scope, Map<String, String> attributes, String layer, Frame parent) {
            this.kind = kind;
            this.scope = scope;
            this.attributes = attributes;
            this.layer = layer;
            this.parent = parent;
        }
    }

    private final LayerManager layers;
    private final Deque<Frame> frames = new ArrayDeque<>();

    public ScopeStack(LayerManager layers, RenderScope root) {
        this.layers = layers;
        frames.push(new Frame(Kind.PICTURE, root, Map.of(), LayerManager.MAIN, null));
    }

    public RenderScope current() {
        return frames.peek().scope;
    }

    public String currentLayer() {
        return frames.peek().layer;
    }

    public int depth() {
        return frames.size();
    }

    /**
     * Opens a frame; with empty {@code attributes} no group is written for it.
     */
    public void push(Kind kind, RenderScope scope, Map<String, String> attributes) {
        push(kind, scope, attributes, currentLayer());
    }

    public void pushLayer(RenderScope scope, String layer) {
        push(Kind.LAYER, scope, Map.of(), layer);
    }

    private void push(Kind kind, RenderScope scope, Map<String, String> attributes, String layer) {
        frames.push(new Frame(kind, scope, new LinkedHashMap<>(attributes), layer, frames.peek()));
    }

    /**
     * Closes the innermost non-clip frame together with the clips opened inside it.
     */
    public void pop() {
        while (frames.size() > 1 && frames.peek().kind == Kind.CLIP) {
            frames.pop();
        }
        if (frames.size() <= 1) {
            throw new IllegalStateException("Cannot pop the picture frame");
        }
        frames.pop();
    }

    /** Group that elements drawn now belong to. */
    public SvgGroup target() {
        Frame top = frames.peek();
        return target(top, top.layer);
    }

    private SvgGroup target(Frame frame, String layer) {
        if (frame.parent == null) {
            return layers.root(layer);
        }
        if (frame.attributes.isEmpty()) {
            return target(frame.parent, layer);
        }
        SvgGroup group = frame.groups.get(layer);
        if (group == null) {
            group = new SvgGroup(frame.attributes);
            target(frame.parent, layer).addGroup(group);
            frame.groups.put(layer, group);
        }
        return group;
    }
}

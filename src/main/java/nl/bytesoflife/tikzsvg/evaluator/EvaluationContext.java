package nl.bytesoflife.tikzsvg.evaluator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Arena of variable scopes. Every scope is a frame with an index and a parent index; lookups walk
 * the parent chain. Child scopes are created for picture scopes, loop iterations and macro-like
 * constructs and must be released in reverse order of creation.
 */
public class EvaluationContext {

    public static final int ROOT = 0;

    private final List<Frame> frames = new ArrayList<>();

    public EvaluationContext() {
        frames.add(new Frame(-1));
    }

    public Scope root() {
        return new Scope(this, ROOT);
    }

    int createChild(int parent) {
        checkLive(parent);
        frames.add(new Frame(parent));
        return frames.size() - 1;
    }

    void release(int index) {
        if (index == ROOT) {
            throw new IllegalStateException("The root scope cannot be released");
        }
        if (index != frames.size() - 1) {
            throw new IllegalStateException("Scope " + index + " released out of order, innermost is "
                + (frames.size() - 1));
        }
        frames.remove(index);
    }

    void define(int index, String name, Binding value) {
        checkLive(index);
        frames.get(index).variables.put(normalize(name), value);
    }

    Optional<Binding> find(int index, String name) {
        checkLive(index);
        String key = normalize(name);
        int current = index;
        while (current >= 0) {
            Frame frame = frames.get(current);
            Binding binding = frame.variables.get(key);
            if (binding != null) {
                return Optional.of(binding);
            }
            current = frame.parent;
        }
        return Optional.empty();
    }

    /** Number of live scopes, the root included. */
    public int depth() {
        return frames.size();
    }

    private void checkLive(int index) {
        if (index < 0 || index >= frames.size()) {
            throw new IllegalStateException("Scope " + index + " is not live");
        }
    }

    static String normalize(String name) {
        String trimmed = name.trim();
        return trimmed.startsWith("\\") ? trimmed.substring(1) : trimmed;
    }

    private static final class Frame {
        private final int parent;
        private final Map<String, Binding> variables = new HashMap<>();

        private Frame(int parent) {
            this.parent = parent;
        }
    }

    /**
     * Handle to one frame of the arena.
     */
    public record Scope(EvaluationContext context, int index) {

        public Scope child() {
            return new Scope(context, context.createChild(index));
        }

        public void release() {
            context.release(index);
        }

        public void define(String name, Binding value) {
            context.define(index, name, value);
        }

        public void defineNumber(String name, double value) {
            define(name, Binding.number(value));
        }

        public Optional<Binding> find(String name) {
            return context.find(index, name);
        }

        /**
         * Looks up a variable through the parent chain.
         *
         * @throws EvaluationException when the variable is not bound in this scope or any ancestor
         */
        public Binding lookup(String name) {
            return find(name).orElseThrow(() ->
                new EvaluationException("Undefined variable \\" + normalize(name), name));
        }
    }
}

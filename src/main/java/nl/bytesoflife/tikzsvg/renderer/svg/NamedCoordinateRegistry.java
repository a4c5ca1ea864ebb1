package nl.bytesoflife.tikzsvg.renderer.svg;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Picture-wide table of named positions, written by {@code \coordinate}, named nodes and inline
 * coordinates. One registry per conversion; later writes replace earlier ones.
 */
public class NamedCoordinateRegistry {

    private final Map<String, Point> positions = new LinkedHashMap<>();

    public void store(String name, Point position) {
        positions.put(name, position);
    }

    public Optional<Point> lookup(String name) {
        return Optional.ofNullable(positions.get(name));
    }

    public boolean contains(String name) {
        return positions.containsKey(name);
    }

    public Set<String> names() {
        return positions.keySet();
    }

    public int size() {
        return positions.size();
    }
}

package nl.bytesoflife.tikzsvg.model;

import java.util.List;

public record Path(List<PathElement> elements) {

    public Path {
        elements = List.copyOf(elements);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }
}

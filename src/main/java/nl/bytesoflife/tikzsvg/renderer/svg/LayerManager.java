package nl.bytesoflife.tikzsvg.renderer.svg;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared layers, their paint order and one root group per layer.
 * <p>
 * The {@link #MAIN} layer always exists. Without an explicit order, {@code main} paints first and
 * the other layers follow in declaration order. With {@code \pgfsetlayers} the listed order is
 * used and declared layers missing from it are appended.
 */
public class LayerManager {

    private static final Logger log = LoggerFactory.getLogger(LayerManager.class);

    public static final String MAIN = "main";

    private final List<String> declared = new ArrayList<>(List.of(MAIN));
    private final Map<String, SvgGroup> roots = new LinkedHashMap<>();
    private List<String> order;

    public void declare(String name) {
        if (!declared.contains(name)) {
            declared.add(name);
            log.debug("Declared layer '{}'", name);
        }
    }

    public boolean isDeclared(String name) {
        return declared.contains(name);
    }

    public void setOrder(List<String> layers) {
        for (String layer : layers) {
            if (!declared.contains(layer)) {
                log.warn("Layer '{}' used in layer order without declaration", layer);
                declare(layer);
            }
        }
        order = List.copyOf(layers);
    }

    /**
     * Layer name to use for a {@code pgfonlayer} block; undeclared names are declared implicitly.
     */
    public String enter(String name) {
        if (!declared.contains(name)) {
            log.warn("Layer '{}' used without declaration, declaring it", name);
            declare(name);
        }
        return name;
    }

    public SvgGroup root(String layer) {
        return roots.computeIfAbsent(layer, name -> new SvgGroup().setAttribute("data-layer", name));
    }

    /** Bottom to top. */
    public List<String> paintOrder() {
        List<String> result = new ArrayList<>();
        if (order != null) {
            result.addAll(order);
        }
        for (String layer : declared) {
            if (!result.contains(layer)) {
                result.add(layer);
            }
        }
        return result;
    }

    /** True when something was drawn on a layer other than {@code main}. */
    public boolean hasSecondaryContent() {
        return roots.entrySet().stream().anyMatch(e -> !e.getKey().equals(MAIN) && !e.getValue().isEmpty());
    }

    /**
     * Writes the layer contents in paint order. Layers are wrapped in {@code data-layer} groups
     * only when a layer other than {@code main} has content.
     */
    public void write(StringBuilder out, String indent) {
        boolean wrap = hasSecondaryContent();
        for (String layer : paintOrder()) {
            SvgGroup root = roots.get(layer);
            if (root == null || root.isEmpty()) {
                continue;
            }
            log.debug("Layer '{}' holds {} element(s)", layer, root.getElementCount());
            root.write(out, indent, wrap);
        }
    }
}

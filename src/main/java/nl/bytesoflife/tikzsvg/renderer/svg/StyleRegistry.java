package nl.bytesoflife.tikzsvg.renderer.svg;

import nl.bytesoflife.tikzsvg.model.OptionList;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Named styles from {@code \tikzset} and {@code name/.style} options, picture-wide.
 */
public class StyleRegistry {

    public static final String EVERY_NODE = "every node";

    private final Map<String, OptionList> styles = new HashMap<>();

    public void define(String name, OptionList options) {
        styles.put(name.trim(), options);
    }

    public Optional<OptionList> get(String name) {
        return Optional.ofNullable(styles.get(name));
    }

    public boolean contains(String name) {
        return styles.containsKey(name);
    }
}

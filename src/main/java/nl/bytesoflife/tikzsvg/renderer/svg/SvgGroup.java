package nl.bytesoflife.tikzsvg.renderer.svg;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@code <g>} element under construction: attributes plus an ordered mix of finished
 * single-line elements and nested groups.
 */
public class SvgGroup {

    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<Object> children = new ArrayList<>();

    public SvgGroup() {
    }

    public SvgGroup(Map<String, String> attributes) {
        this.attributes.putAll(attributes);
    }

    public SvgGroup setAttribute(String name, String value) {
        attributes.put(name, value);
        return this;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public void addElement(String element) {
        children.add(element);
    }

    public void addGroup(SvgGroup group) {
        children.add(group);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public int getElementCount() {
        int count = 0;
        for (Object child : children) {
            count += child instanceof SvgGroup group ? group.getElementCount() : 1;
        }
        return count;
    }

    /**
     * Writes the group with its children. With {@code wrap} unset only the children are
     * written, at the given indent.
     */
    public void write(StringBuilder out, String indent, boolean wrap) {
        String childIndent = indent;
        if (wrap) {
            out.append(indent).append("<g");
            appendAttributes(out, attributes);
            out.append(">\n");
            childIndent = indent + "  ";
        }
        for (Object child : children) {
            if (child instanceof SvgGroup group) {
                group.write(out, childIndent, true);
            } else {
                out.append(childIndent).append(child).append('\n');
            }
        }
        if (wrap) {
            out.append(indent).append("</g>\n");
        }
    }

    static void appendAttributes(StringBuilder out, Map<String, String> attributes) {
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            out.append(' ').append(attribute.getKey()).append("=\"")
                .append(SvgFormat.escapeXml(attribute.getValue())).append('"');
        }
    }
}

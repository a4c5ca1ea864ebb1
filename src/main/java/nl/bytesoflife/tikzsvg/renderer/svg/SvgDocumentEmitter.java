package nl.bytesoflife.tikzsvg.renderer.svg;

import nl.bytesoflife.tikzsvg.evaluator.EvaluationContext;
import nl.bytesoflife.tikzsvg.evaluator.ExpressionEvaluator;
import nl.bytesoflife.tikzsvg.evaluator.LoopExpander;
import nl.bytesoflife.tikzsvg.evaluator.TextSubstitution;
import nl.bytesoflife.tikzsvg.model.DrawCommand;
import nl.bytesoflife.tikzsvg.model.NodeSpec;
import nl.bytesoflife.tikzsvg.model.Picture;
import nl.bytesoflife.tikzsvg.model.Statement;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks a picture and writes the SVG document.
 * <p>
 * An emitter holds the state of exactly one conversion (variables, named coordinates, styles,
 * layers, markers) and is not reusable; create a new one per picture.
 */
public class SvgDocumentEmitter implements Statement.Visitor<Void> {

    private static final Logger log = LoggerFactory.getLogger(SvgDocumentEmitter.class);

    private static final String SVG_NAMESPACE = "http://www.w3.org/2000/svg";

    private final SvgOptions options;
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
    private final EvaluationContext context = new EvaluationContext();
    private final NamedCoordinateRegistry registry = new NamedCoordinateRegistry();
    private final StyleRegistry styles = new StyleRegistry();
    private final StyleConverter styleConverter = new StyleConverter();
    private final ArrowMarkers markers = new ArrowMarkers();
    private final LayerManager layers = new LayerManager();
    private final CoordinateResolver resolver;
    private final LoopExpander loopExpander;
    private final PathRenderer pathRenderer;
    private final OptionProcessor optionProcessor;
    private final LabelRenderer labels;

    private final List<String> clipPaths = new ArrayList<>();
    private final Envelope bounds = new Envelope();
    private ScopeStack stack;
    private int statementCount;

    public SvgDocumentEmitter(SvgOptions options) {
        this.options = options;
        CoordinateTransformer transformer = new CoordinateTransformer(options);
        this.resolver = new CoordinateResolver(transformer, evaluator, registry, options.getAnchorDistance());
        this.loopExpander = new LoopExpander(evaluator);
        this.pathRenderer = new PathRenderer(resolver, loopExpander);
        this.optionProcessor = new OptionProcessor(evaluator, styles, options.getScale(), options.getMaxMacroDepth());
        this.labels = new LabelRenderer(resolver, styleConverter, options.getAnchorDistance());
    }

    public String emit(Picture picture) {
        if (stack != null) {
            throw new IllegalStateException("An emitter converts a single picture");
        }
        RenderScope root = new RenderScope(context.root(), Map.of(), Transform.identity());
        Map<String, Object> own = optionProcessor.process(picture.options(), root);
        root = root.withStyle(own).withTransform(OptionProcessor.transformOf(own));
        stack = new ScopeStack(layers, root);

        visitAll(picture.statements());
        log.debug("Rendered {} statement(s), {} named coordinate(s)", statementCount, registry.size());
        return writeDocument();
    }

    public NamedCoordinateRegistry getRegistry() {
        return registry;
    }

    public Envelope getBounds() {
        return bounds;
    }

    private void visitAll(List<Statement> statements) {
        for (Statement statement : statements) {
            statementCount++;
            statement.accept(this);
        }
    }

    @Override
    public Void visitDraw(Statement.DrawStatement statement) {
        RenderScope scope = stack.current();
        Map<String, Object> own = optionProcessor.process(statement.options(), scope);
        RenderScope pathScope = scope.withStyle(OptionProcessor.merge(scope.style(), own))
            .withTransform(OptionProcessor.transformOf(own));

        PathRenderer.RenderedPath rendered = pathRenderer.render(statement.path(), pathScope, this::layoutNode);
        PathData data = rendered.data();
        if (statement.command() == DrawCommand.CLIP) {
            clip(data, scope);
        } else if (data.hasDrawing()) {
            drawPath(data, pathScope.style(), statement.command());
        }
        for (PathRenderer.PlacedNode placed : rendered.nodes()) {
            addLabel(placed.label());
        }
        return null;
    }

    private void drawPath(PathData data, Map<String, Object> style, DrawCommand command) {
        boolean stroke = styleConverter.strokes(style, command);
        if (!stroke && !styleConverter.fills(style, command)) {
            return;
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("d", data.toSvg());
        attributes.put("style", styleConverter.pathStyle(style, command));
        if (stroke && style.get(OptionProcessor.ARROWS) instanceof String arrows) {
            attributes.putAll(markers.attributesFor(arrows));
        }
        StringBuilder element = new StringBuilder("<path");
        SvgGroup.appendAttributes(element, attributes);
        element.append("/>");
        stack.target().addElement(element.toString());
        bounds.expandToInclude(data.getEnvelope());
    }

    private void clip(PathData data, RenderScope scope) {
        if (!data.hasDrawing()) {
            log.warn("Ignoring \\clip without an area");
            return;
        }
        String id = "clip" + (clipPaths.size() + 1);
        clipPaths.add("<clipPath id=\"" + id + "\"><path d=\"" + data.toSvg() + "\"/></clipPath>");
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("clip-path", "url(#" + id + ")");
        stack.push(ScopeStack.Kind.CLIP, scope, attributes);
        log.debug("Clipping to {}", id);
    }

    private LabelRenderer.Label layoutNode(NodeSpec node, Point position, RenderScope scope) {
        Map<String, Object> everyNode = styles.get(StyleRegistry.EVERY_NODE)
            .map(o -> optionProcessor.process(o, scope))
            .orElse(Map.of());
        Map<String, Object> own = optionProcessor.process(node.options(), scope);
        Map<String, Object> style = OptionProcessor.merge(OptionProcessor.merge(scope.style(), everyNode), own);
        return labels.render(node.text(), position, style, scope);
    }

    private void addLabel(LabelRenderer.Label label) {
        if (label != null) {
            stack.target().addElement(label.element());
            bounds.expandToInclude(label.bounds());
        }
    }

    @Override
    public Void visitNode(Statement.NodeStatement statement) {
        RenderScope scope = stack.current();
        Point position = statement.position() == null
            ? resolver.getTransformer().toSvg(scope.transform(), 0, 0)
            : resolver.resolve(statement.position(), null, scope);
        NodeSpec node = statement.node();
        if (node.name() != null) {
            resolver.store(TextSubstitution.substitute(node.name(), scope.variables()).trim(), position);
        }
        addLabel(layoutNode(node, position, scope));
        return null;
    }

    @Override
    public Void visitCoordinate(Statement.CoordinateDefinition statement) {
        RenderScope scope = stack.current();
        Point position = statement.position() == null
            ? resolver.getTransformer().toSvg(scope.transform(), 0, 0)
            : resolver.resolve(statement.position(), null, scope);
        resolver.store(TextSubstitution.substitute(statement.name(), scope.variables()).trim(), position);
        return null;
    }

    @Override
    public Void visitScope(Statement.ScopeBlock statement) {
        RenderScope parent = stack.current();
        EvaluationContext.Scope variables = parent.variables().child();
        try {
            RenderScope inner = parent.withVariables(variables);
            Map<String, Object> own = optionProcessor.process(statement.options(), inner);
            inner = inner.withStyle(OptionProcessor.merge(parent.style(), own))
                .withTransform(OptionProcessor.transformOf(own));

            Map<String, String> attributes = new LinkedHashMap<>();
            String groupStyle = styleConverter.groupStyle(own);
            if (!groupStyle.isEmpty()) {
                attributes.put("style", groupStyle);
            }
            stack.push(ScopeStack.Kind.SCOPE, inner, attributes);
            try {
                visitAll(statement.body());
            } finally {
                stack.pop();
            }
        } finally {
            variables.release();
        }
        return null;
    }

    @Override
    public Void visitForeach(Statement.ForeachLoop statement) {
        RenderScope parent = stack.current();
        int iterations = loopExpander.forEach(statement.header(), parent.variables(), iteration -> {
            stack.push(ScopeStack.Kind.ITERATION, parent.withVariables(iteration), Map.of());
            try {
                visitAll(statement.body());
            } finally {
                stack.pop();
            }
        });
        log.trace("Loop over {} ran {} iteration(s)", statement.header().variables(), iterations);
        return null;
    }

    @Override
    public Void visitMacro(Statement.MacroDefinition statement) {
        EvaluationContext.Scope variables = stack.current().variables();
        double value = evaluator.evaluate(statement.expression(), variables);
        if (statement.truncate()) {
            value = value < 0 ? Math.ceil(value) : Math.floor(value);
        }
        variables.defineNumber(statement.name(), value);
        log.trace("Set \\{} = {}", statement.name(), value);
        return null;
    }

    @Override
    public Void visitLayerDeclaration(Statement.LayerDeclaration statement) {
        layers.declare(statement.name());
        return null;
    }

    @Override
    public Void visitLayerOrder(Statement.LayerOrder statement) {
        layers.setOrder(statement.layers());
        return null;
    }

    @Override
    public Void visitLayerBlock(Statement.LayerBlock statement) {
        String layer = layers.enter(statement.name());
        stack.pushLayer(stack.current(), layer);
        try {
            visitAll(statement.body());
        } finally {
            stack.pop();
        }
        return null;
    }

    @Override
    public Void visitStyle(Statement.StyleDefinition statement) {
        styles.define(statement.name(), statement.options());
        return null;
    }

    private String writeDocument() {
        double width = options.getWidth();
        double height = options.getHeight();
        String viewBox = "0 0 " + SvgFormat.dimension(width) + " " + SvgFormat.dimension(height);
        if (options.isFitToContent() && !bounds.isNull()) {
            double margin = options.getMargin();
            width = bounds.getWidth() + 2 * margin;
            height = bounds.getHeight() + 2 * margin;
            viewBox = SvgFormat.number(bounds.getMinX() - margin) + " " + SvgFormat.number(bounds.getMinY() - margin)
                + " " + SvgFormat.number(width) + " " + SvgFormat.number(height);
        }

        StringBuilder out = new StringBuilder();
        out.append("<svg xmlns=\"").append(SVG_NAMESPACE)
            .append("\" width=\"").append(SvgFormat.dimension(width))
            .append("\" height=\"").append(SvgFormat.dimension(height))
            .append("\" viewBox=\"").append(viewBox).append("\">\n");
        if (!markers.isEmpty() || !clipPaths.isEmpty()) {
            out.append("  <defs>\n");
            markers.writeDefinitions(out, "    ");
            for (String clipPath : clipPaths) {
                out.append("    ").append(clipPath).append('\n');
            }
            out.append("  </defs>\n");
        }
        layers.write(out, "  ");
        out.append("</svg>\n");
        return out.toString();
    }
}

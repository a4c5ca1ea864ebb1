package nl.bytesoflife.tikzsvg.renderer.svg;

import nl.bytesoflife.tikzsvg.evaluator.LoopExpander;
import nl.bytesoflife.tikzsvg.evaluator.TextSubstitution;
import nl.bytesoflife.tikzsvg.model.Coordinate;
import nl.bytesoflife.tikzsvg.model.NodeSpec;
import nl.bytesoflife.tikzsvg.model.Option;
import nl.bytesoflife.tikzsvg.model.Path;
import nl.bytesoflife.tikzsvg.model.PathElement;
import nl.bytesoflife.tikzsvg.model.SegmentOperation;
import nl.bytesoflife.tikzsvg.model.ShapeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a path into SVG path data, threading the pen position through the segments.
 * <p>
 * The pen is the base for relative coordinates and the centre of circles and arcs. Shapes that
 * leave the SVG current point somewhere else than the pen (circle, ellipse, rectangle, grid) mark
 * the pen as detached, so the next connected segment starts with a move back to the pen.
 */
public class PathRenderer {

    private static final Logger log = LoggerFactory.getLogger(PathRenderer.class);

    private final CoordinateResolver resolver;
    private final LoopExpander loopExpander;

    public PathRenderer(CoordinateResolver resolver, LoopExpander loopExpander) {
        this.resolver = resolver;
        this.loopExpander = loopExpander;
    }

    /**
     * Lays out a node where the path places it. Called while the scope of the node, including
     * the variables of an inline loop iteration, is still live.
     */
    @FunctionalInterface
    public interface NodeLayout {
        /**
         * @return the finished label, or {@code null} when the node shows nothing
         */
        LabelRenderer.Label layout(NodeSpec node, Point position, RenderScope scope);
    }

    /**
     * Node attached to a path, with its label already laid out.
     */
    public record PlacedNode(NodeSpec node, Point position, LabelRenderer.Label label) {
    }

    public record RenderedPath(PathData data, List<PlacedNode> nodes) {
    }

    public RenderedPath render(Path path, RenderScope scope, NodeLayout layout) {
        PathState state = new PathState(layout);
        renderElements(path.elements(), state, scope);
        return new RenderedPath(state.data, state.nodes);
    }

    private void renderElements(List<PathElement> elements, PathState state, RenderScope scope) {
        for (PathElement element : elements) {
            element.accept(new PathElement.Visitor<Void>() {
                @Override
                public Void visitSegment(PathElement.Segment segment) {
                    renderSegment(segment, state, scope);
                    return null;
                }

                @Override
                public Void visitInlineNode(PathElement.InlineNode node) {
                    placeNode(node.node(), state, scope);
                    return null;
                }

                @Override
                public Void visitInlineCoordinate(PathElement.InlineCoordinate coordinate) {
                    if (state.pen == null) {
                        throw new NoCurrentPositionException("coordinate (" + coordinate.name() + ")");
                    }
                    resolver.store(TextSubstitution.substitute(coordinate.name(), scope.variables()).trim(), state.pen);
                    return null;
                }

                @Override
                public Void visitInlineForeach(PathElement.InlineForeach loop) {
                    loopExpander.forEach(loop.header(), scope.variables(),
                        iteration -> renderElements(loop.body(), state, scope.withVariables(iteration)));
                    return null;
                }
            });
        }
    }

    private void renderSegment(PathElement.Segment segment, PathState state, RenderScope scope) {
        SegmentOperation operation = segment.operation();
        switch (operation) {
            case MOVETO: {
                Point target = resolver.resolve(segment.destination(), state.pen, scope);
                state.data.add(new PathCommand.MoveTo(target));
                state.subpathStart = target;
                state.current = target;
                state.detached = false;
                state.movePen(segment.destination(), target);
                state.markSegment(target, target);
                break;
            }
            case LINETO: {
                Point from = connect(state, "line");
                Point target = resolver.resolve(segment.destination(), state.pen, scope);
                state.data.add(new PathCommand.LineTo(target));
                state.finish(segment.destination(), from, target);
                break;
            }
            case HORIZONTAL_THEN_VERTICAL:
            case VERTICAL_THEN_HORIZONTAL: {
                Point from = connectAtPen(state, operation == SegmentOperation.HORIZONTAL_THEN_VERTICAL ? "-|" : "|-");
                Point target = resolver.resolve(segment.destination(), state.pen, scope);
                Point corner = operation == SegmentOperation.HORIZONTAL_THEN_VERTICAL
                    ? new Point(target.x(), from.y())
                    : new Point(from.x(), target.y());
                state.data.add(new PathCommand.LineTo(corner));
                state.data.add(new PathCommand.LineTo(target));
                state.finish(segment.destination(), from, target);
                break;
            }
            case CURVETO:
                renderCurve(segment, state, scope);
                break;
            case RECTANGLE: {
                Point from = connectAtPen(state, "rectangle");
                Point corner = resolver.resolve(segment.destination(), state.pen, scope);
                state.data.add(new PathCommand.LineTo(new Point(corner.x(), from.y())));
                state.data.add(new PathCommand.LineTo(corner));
                state.data.add(new PathCommand.LineTo(new Point(from.x(), corner.y())));
                state.data.add(new PathCommand.LineTo(from));
                state.current = from;
                state.markSegment(from, corner);
                state.movePen(segment.destination(), corner);
                state.detached = true;
                break;
            }
            case GRID:
                renderGrid(segment, state, scope);
                break;
            case CIRCLE:
            case ELLIPSE:
                renderEllipse((ShapeSpec.Radii) segment.shape(), state, scope, operation == SegmentOperation.CIRCLE ? "circle" : "ellipse");
                break;
            case ARC:
                renderArc((ShapeSpec.Arc) segment.shape(), state, scope);
                break;
            case CLOSE: {
                if (state.subpathStart == null) {
                    throw new NoCurrentPositionException("cycle");
                }
                Point from = state.current;
                if (state.current != null) {
                    state.data.add(new PathCommand.LineTo(state.subpathStart));
                }
                state.data.add(new PathCommand.Close());
                state.pen = state.subpathStart;
                state.current = state.subpathStart;
                state.detached = false;
                state.markSegment(from != null ? from : state.subpathStart, state.subpathStart);
                break;
            }
            default:
                throw new IllegalStateException("Unhandled path operation " + operation);
        }
    }

    private void renderCurve(PathElement.Segment segment, PathState state, RenderScope scope) {
        Point from = connect(state, "curve");
        Point start = state.pen;
        Point target = segment.destination() == null
            ? state.subpathStart
            : resolver.resolve(segment.destination(), start, scope);
        List<Coordinate> controls = segment.controls();
        if (controls.size() == 1) {
            Point control = resolver.resolve(controls.get(0), start, scope);
            state.data.add(new PathCommand.QuadTo(control, target));
        } else if (controls.size() == 2) {
            Point control1 = resolver.resolve(controls.get(0), start, scope);
            Point control2 = resolver.resolve(controls.get(1), target, scope);
            state.data.add(new PathCommand.CubicTo(control1, control2, target));
        } else {
            throw new IllegalStateException("Curve needs one or two control points, got " + controls.size());
        }
        if (segment.destination() == null) {
            state.current = target;
            state.markSegment(from, target);
        } else {
            state.finish(segment.destination(), from, target);
        }
    }

    private void renderEllipse(ShapeSpec.Radii radii, PathState state, RenderScope scope, String construct) {
        if (state.pen == null) {
            throw new NoCurrentPositionException(construct);
        }
        Point center = state.pen;
        double rx = Math.abs(resolver.evalLength(radii.xRadius(), scope));
        double ry = Math.abs(resolver.evalLength(radii.yRadius(), scope));
        Point left = new Point(center.x() - rx, center.y());
        Point right = new Point(center.x() + rx, center.y());
        state.data.add(new PathCommand.MoveTo(left));
        state.data.add(new PathCommand.ArcTo(rx, ry, true, false, right));
        state.data.add(new PathCommand.ArcTo(rx, ry, true, false, left));
        state.data.includeEllipse(center, rx, ry);
        state.current = left;
        state.detached = true;
    }

    /**
     * The pen lies on the ellipse at the start angle; the centre follows from it. Angles grow
     * counter-clockwise, which is sweep flag 0 once y points down.
     */
    private void renderArc(ShapeSpec.Arc arc, PathState state, RenderScope scope) {
        Point from = connectAtPen(state, "arc");
        double start = resolver.evalValue(arc.startAngle(), scope);
        double end = arc.endAngle() != null
            ? resolver.evalValue(arc.endAngle(), scope)
            : start + resolver.evalValue(arc.deltaAngle(), scope);
        double rx = Math.abs(resolver.evalLength(arc.xRadius(), scope));
        double ry = Math.abs(resolver.evalLength(arc.yRadius(), scope));

        double startRad = Math.toRadians(start);
        Point center = new Point(from.x() - rx * Math.cos(startRad), from.y() + ry * Math.sin(startRad));
        double span = end - start;
        int pieces = Math.abs(span) < 360 ? 1 : (int) Math.ceil(Math.abs(span) / 180 - 1e-9);
        Point target = from;
        for (int i = 1; i <= pieces; i++) {
            double angle = Math.toRadians(start + span * i / pieces);
            target = new Point(center.x() + rx * Math.cos(angle), center.y() - ry * Math.sin(angle));
            double pieceSpan = span / pieces;
            state.data.add(new PathCommand.ArcTo(rx, ry, Math.abs(pieceSpan) > 180, pieceSpan <= 0, target));
        }
        state.data.includeEllipse(center, rx, ry);
        state.markSegment(from, target);
        state.current = target;
        state.pen = target;
    }

    private void renderGrid(PathElement.Segment segment, PathState state, RenderScope scope) {
        Point from = connectAtPen(state, "grid");
        Point corner = resolver.resolve(segment.destination(), state.pen, scope);
        ShapeSpec.Grid grid = segment.shape() instanceof ShapeSpec.Grid g ? g : ShapeSpec.Grid.unit();
        double xStep = Math.abs(resolver.evalLength(grid.xStep(), scope));
        double yStep = Math.abs(resolver.evalLength(grid.yStep(), scope));
        double minX = Math.min(from.x(), corner.x());
        double maxX = Math.max(from.x(), corner.x());
        double minY = Math.min(from.y(), corner.y());
        double maxY = Math.max(from.y(), corner.y());
        if (xStep > 0) {
            for (double x = minX; x <= maxX + 1e-6; x += xStep) {
                state.data.add(new PathCommand.MoveTo(new Point(x, minY)));
                state.data.add(new PathCommand.LineTo(new Point(x, maxY)));
            }
        } else {
            log.warn("Ignoring vertical grid lines with zero step");
        }
        if (yStep > 0) {
            for (double y = minY; y <= maxY + 1e-6; y += yStep) {
                state.data.add(new PathCommand.MoveTo(new Point(minX, y)));
                state.data.add(new PathCommand.LineTo(new Point(maxX, y)));
            }
        } else {
            log.warn("Ignoring horizontal grid lines with zero step");
        }
        state.current = null;
        state.markSegment(from, corner);
        state.movePen(segment.destination(), corner);
        state.detached = true;
    }

    private void placeNode(NodeSpec node, PathState state, RenderScope scope) {
        Double fraction = placementFraction(node, scope);
        Point position;
        if (fraction != null && state.segmentStart != null) {
            position = state.segmentStart.interpolate(state.segmentEnd, fraction);
        } else if (state.pen != null) {
            position = state.pen;
        } else {
            position = resolver.getTransformer().toSvg(scope.transform(), 0, 0);
        }
        if (node.name() != null) {
            resolver.store(TextSubstitution.substitute(node.name(), scope.variables()).trim(), position);
        }
        state.nodes.add(new PlacedNode(node, position, state.layout.layout(node, position, scope)));
    }

    private Double placementFraction(NodeSpec node, RenderScope scope) {
        Double fraction = null;
        for (Option option : node.options().options()) {
            switch (option.key()) {
                case "midway":
                    fraction = 0.5;
                    break;
                case "near start":
                    fraction = 0.25;
                    break;
                case "near end":
                    fraction = 0.75;
                    break;
                case "very near start":
                    fraction = 0.125;
                    break;
                case "very near end":
                    fraction = 0.875;
                    break;
                case "at start":
                    fraction = 0.0;
                    break;
                case "at end":
                    fraction = 1.0;
                    break;
                case "pos":
                    if (!option.isFlag()) {
                        fraction = resolver.evalValue(option.value(), scope);
                    }
                    break;
                default:
                    break;
            }
        }
        return fraction;
    }

    /**
     * Start point of a segment that continues from the SVG current point.
     */
    private Point connect(PathState state, String construct) {
        if (state.pen == null) {
            throw new NoCurrentPositionException(construct);
        }
        if (state.detached) {
            state.data.add(new PathCommand.MoveTo(state.pen));
            state.subpathStart = state.pen;
            state.current = state.pen;
            state.detached = false;
        }
        return state.current != null ? state.current : state.pen;
    }

    /**
     * Start point of a segment that is defined relative to the pen.
     */
    private Point connectAtPen(PathState state, String construct) {
        if (state.pen == null) {
            throw new NoCurrentPositionException(construct);
        }
        if (state.detached || state.current == null || !state.current.sameAs(state.pen)) {
            state.data.add(new PathCommand.MoveTo(state.pen));
            if (state.detached || state.current == null) {
                state.subpathStart = state.pen;
            }
            state.current = state.pen;
            state.detached = false;
        }
        return state.pen;
    }

    private static final class PathState {
        private final NodeLayout layout;
        private final PathData data = new PathData();
        private final List<PlacedNode> nodes = new ArrayList<>();
        private Point pen;
        private Point current;
        private Point subpathStart;
        private Point segmentStart;
        private Point segmentEnd;
        private boolean detached;

        private PathState(NodeLayout layout) {
            this.layout = layout;
        }

        private void movePen(Coordinate destination, Point target) {
            if (!(destination instanceof Coordinate.Relative relative) || relative.persistent()) {
                pen = target;
            } else if (pen == null) {
                pen = target;
            }
        }

        private void markSegment(Point start, Point end) {
            segmentStart = start;
            segmentEnd = end;
        }

        private void finish(Coordinate destination, Point from, Point target) {
            current = target;
            markSegment(from, target);
            movePen(destination, target);
        }
    }
}

package nl.bytesoflife.tikzsvg.model;

import java.util.List;

/**
 * One element of a path in source order.
 */
public sealed interface PathElement permits PathElement.Segment, PathElement.InlineNode,
    PathElement.InlineCoordinate, PathElement.InlineForeach {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitSegment(Segment segment);

        R visitInlineNode(InlineNode node);

        R visitInlineCoordinate(InlineCoordinate coordinate);

        R visitInlineForeach(InlineForeach loop);
    }

    /**
     * A drawing operation. {@code destination} is {@code null} for operations centred on the pen
     * (circle, ellipse, arc, close); for a curve ending in {@code cycle} it is {@code null} as well.
     */
    record Segment(SegmentOperation operation, Coordinate destination, List<Coordinate> controls, ShapeSpec shape)
        implements PathElement {

        public Segment {
            controls = controls == null ? List.of() : List.copyOf(controls);
        }

        public static Segment to(SegmentOperation operation, Coordinate destination) {
            return new Segment(operation, destination, List.of(), null);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSegment(this);
        }
    }

    /** {@code node[...] {text}} placed at the pen, or along the previous segment with {@code midway}/{@code pos=}. */
    record InlineNode(NodeSpec node) implements PathElement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInlineNode(this);
        }
    }

    /** {@code coordinate (name)} recording the pen position. */
    record InlineCoordinate(String name) implements PathElement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInlineCoordinate(this);
        }
    }

    /** {@code \foreach ... { path fragment }} inside a path. */
    record InlineForeach(LoopHeader header, List<PathElement> body) implements PathElement {
        public InlineForeach {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInlineForeach(this);
        }
    }
}

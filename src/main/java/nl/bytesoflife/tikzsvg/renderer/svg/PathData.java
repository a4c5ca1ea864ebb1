package nl.bytesoflife.tikzsvg.renderer.svg;

import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered path commands plus the envelope of everything they touch. Control points are included,
 * so the envelope always contains the curve.
 */
public class PathData {

    private final List<PathCommand> commands = new ArrayList<>();
    private final Envelope envelope = new Envelope();

    public void add(PathCommand command) {
        commands.add(command);
        if (command instanceof PathCommand.QuadTo quad) {
            include(quad.control());
        } else if (command instanceof PathCommand.CubicTo cubic) {
            include(cubic.control1());
            include(cubic.control2());
        }
        if (command.end() != null) {
            include(command.end());
        }
    }

    /** Widens the envelope to an ellipse drawn by arc commands. */
    public void includeEllipse(Point center, double rx, double ry) {
        envelope.expandToInclude(center.x() - rx, center.y() - ry);
        envelope.expandToInclude(center.x() + rx, center.y() + ry);
    }

    private void include(Point point) {
        envelope.expandToInclude(point.x(), point.y());
    }

    public List<PathCommand> getCommands() {
        return Collections.unmodifiableList(commands);
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }

    /** True when the path contains something other than moves. */
    public boolean hasDrawing() {
        return commands.stream().anyMatch(c -> !(c instanceof PathCommand.MoveTo));
    }

    public long count(Class<? extends PathCommand> type) {
        return commands.stream().filter(type::isInstance).count();
    }

    public Envelope getEnvelope() {
        return envelope;
    }

    public String toSvg() {
        return commands.stream().map(PathCommand::toSvg).collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return toSvg();
    }
}

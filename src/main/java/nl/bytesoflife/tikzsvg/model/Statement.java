package nl.bytesoflife.tikzsvg.model;

import java.util.List;

/**
 * Statements of a picture body.
 */
public sealed interface Statement permits Statement.DrawStatement, Statement.NodeStatement,
    Statement.CoordinateDefinition, Statement.ScopeBlock, Statement.ForeachLoop, Statement.MacroDefinition,
    Statement.LayerDeclaration, Statement.LayerOrder, Statement.LayerBlock, Statement.StyleDefinition {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitDraw(DrawStatement statement);

        R visitNode(NodeStatement statement);

        R visitCoordinate(CoordinateDefinition statement);

        R visitScope(ScopeBlock statement);

        R visitForeach(ForeachLoop statement);

        R visitMacro(MacroDefinition statement);

        R visitLayerDeclaration(LayerDeclaration statement);

        R visitLayerOrder(LayerOrder statement);

        R visitLayerBlock(LayerBlock statement);

        R visitStyle(StyleDefinition statement);
    }

    /** {@code \draw}, {@code \fill}, {@code \filldraw}, {@code \clip} and {@code \path}. */
    record DrawStatement(DrawCommand command, OptionList options, Path path) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDraw(this);
        }
    }

    /** {@code \node[...] (name) at (pos) {text};} with {@code position} {@code null} when there is no {@code at}. */
    record NodeStatement(NodeSpec node, Coordinate position) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNode(this);
        }
    }

    record CoordinateDefinition(String name, Coordinate position) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCoordinate(this);
        }
    }

    record ScopeBlock(OptionList options, List<Statement> body) implements Statement {
        public ScopeBlock {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitScope(this);
        }
    }

    record ForeachLoop(LoopHeader header, List<Statement> body) implements Statement {
        public ForeachLoop {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitForeach(this);
        }
    }

    /**
     * {@code \pgfmathsetmacro{\name}{expr}}, or {@code \pgfmathtruncatemacro} when {@code truncate} is set.
     * Evaluated into the current scope when visited.
     */
    record MacroDefinition(String name, String expression, boolean truncate) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMacro(this);
        }
    }

    record LayerDeclaration(String name) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLayerDeclaration(this);
        }
    }

    /** {@code \pgfsetlayers{background,main}}: bottom to top. */
    record LayerOrder(List<String> layers) implements Statement {
        public LayerOrder {
            layers = List.copyOf(layers);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLayerOrder(this);
        }
    }

    record LayerBlock(String name, List<Statement> body) implements Statement {
        public LayerBlock {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLayerBlock(this);
        }
    }

    /** {@code \tikzset{name/.style={...}}} or {@code name/.style} inside picture and scope options. */
    record StyleDefinition(String name, OptionList options) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStyle(this);
        }
    }
}

package nl.bytesoflife.tikzsvg.model;

import java.util.List;

/**
 * Root of the syntax tree for one {@code tikzpicture}.
 */
public record Picture(OptionList options, List<Statement> statements) {

    public Picture {
        statements = List.copyOf(statements);
    }
}

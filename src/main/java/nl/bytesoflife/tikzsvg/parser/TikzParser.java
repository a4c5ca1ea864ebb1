package nl.bytesoflife.tikzsvg.parser;

import nl.bytesoflife.tikzsvg.lexer.TikzLexer;
import nl.bytesoflife.tikzsvg.lexer.Token;
import nl.bytesoflife.tikzsvg.lexer.TokenType;
import nl.bytesoflife.tikzsvg.model.Coordinate;
import nl.bytesoflife.tikzsvg.model.DrawCommand;
import nl.bytesoflife.tikzsvg.model.LoopHeader;
import nl.bytesoflife.tikzsvg.model.NodeSpec;
import nl.bytesoflife.tikzsvg.model.Option;
import nl.bytesoflife.tikzsvg.model.OptionList;
import nl.bytesoflife.tikzsvg.model.Path;
import nl.bytesoflife.tikzsvg.model.PathElement;
import nl.bytesoflife.tikzsvg.model.Picture;
import nl.bytesoflife.tikzsvg.model.SegmentOperation;
import nl.bytesoflife.tikzsvg.model.ShapeSpec;
import nl.bytesoflife.tikzsvg.model.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser turning macro-expanded picture text into a {@link Picture}.
 * <p>
 * Accepts either a full {@code \begin{tikzpicture} ... \end{tikzpicture}} environment or a bare
 * list of statements. Option lists, coordinates and node text are sliced from the raw source
 * between their delimiters and handed to {@link OptionListParser} and {@link CoordinateParser}.
 */
public class TikzParser {

    private static final Logger log = LoggerFactory.getLogger(TikzParser.class);

    private final TikzLexer lexer = new TikzLexer();
    private final OptionListParser optionParser = new OptionListParser();
    private final CoordinateParser coordinateParser = new CoordinateParser();

    private String source;
    private List<Token> tokens;
    private int index;

    public Picture parse(String text) {
        this.source = text;
        this.tokens = lexer.tokenize(text);
        this.index = 0;

        OptionList options = OptionList.empty();
        List<Statement> statements;
        if (peek().is(TokenType.COMMAND, "begin")) {
            Token begin = advance();
            String environment = readBraced().trim();
            if (!environment.equals("tikzpicture")) {
                throw error("Expected \\begin{tikzpicture} but found \\begin{" + environment + "}", begin);
            }
            if (peek().is(TokenType.LBRACKET)) {
                options = parseOptions();
            }
            statements = parseStatements("tikzpicture");
            expectEnd("tikzpicture");
        } else {
            statements = parseStatements(null);
        }
        if (!peek().is(TokenType.EOF)) {
            throw error("Unexpected content after end of picture: '" + peek().text() + "'", peek());
        }
        log.debug("Parsed picture with {} top-level statement(s)", statements.size());
        return new Picture(options, statements);
    }

    // ---------------------------------------------------------------- statements

    private List<Statement> parseStatements(String environment) {
        List<Statement> statements = new ArrayList<>();
        while (true) {
            Token token = peek();
            if (token.is(TokenType.EOF)) {
                if (environment != null) {
                    throw error("Missing \\end{" + environment + "}", token);
                }
                return statements;
            }
            if (environment != null && token.is(TokenType.COMMAND, "end")) {
                return statements;
            }
            statements.addAll(parseStatement());
        }
    }

    private List<Statement> parseBlockBody() {
        Token open = expect(TokenType.LBRACE, "'{'");
        List<Statement> statements = new ArrayList<>();
        while (!peek().is(TokenType.RBRACE)) {
            if (peek().is(TokenType.EOF)) {
                throw error("Missing '}' for block", open);
            }
            statements.addAll(parseStatement());
        }
        advance();
        return statements;
    }

    private List<Statement> parseStatement() {
        Token token = peek();
        if (token.is(TokenType.SEMICOLON)) {
            advance();
            return List.of();
        }
        if (!token.is(TokenType.COMMAND)) {
            throw error("Unexpected '" + token.text() + "', expected a command", token);
        }
        advance();
        switch (token.text()) {
            case "draw":
                return List.of(parseDraw(DrawCommand.DRAW));
            case "fill":
                return List.of(parseDraw(DrawCommand.FILL));
            case "filldraw":
                return List.of(parseDraw(DrawCommand.FILLDRAW));
            case "clip":
                return List.of(parseDraw(DrawCommand.CLIP));
            case "path":
                return List.of(parseDraw(DrawCommand.PATH));
            case "node":
                return List.of(parseNodeStatement());
            case "coordinate":
                return List.of(parseCoordinateStatement());
            case "begin":
                return List.of(parseEnvironment(token));
            case "foreach":
                return List.of(parseForeach());
            case "pgfmathsetmacro":
                return List.of(parseMathMacro(false));
            case "pgfmathtruncatemacro":
                return List.of(parseMathMacro(true));
            case "pgfdeclarelayer":
                return List.of(new Statement.LayerDeclaration(readBraced().trim()));
            case "pgfsetlayers":
                return List.of(parseLayerOrder());
            case "tikzset":
                return parseTikzset();
            case "tikzstyle":
                return List.of(parseTikzstyle());
            case "end":
                throw error("Unexpected \\end", token);
            default:
                throw error("Unsupported command \\" + token.text(), token);
        }
    }

    private Statement parseDraw(DrawCommand command) {
        List<Option> options = new ArrayList<>();
        if (peek().is(TokenType.LBRACKET)) {
            options.addAll(parseOptions().options());
        }
        List<PathElement> elements = parsePathElements(TokenType.SEMICOLON, options);
        expect(TokenType.SEMICOLON, "';'");
        return new Statement.DrawStatement(command, new OptionList(options), new Path(elements));
    }

    private Statement parseNodeStatement() {
        NodeParts parts = parseNodeParts(true);
        expect(TokenType.SEMICOLON, "';' after node");
        return new Statement.NodeStatement(parts.spec, parts.position);
    }

    private Statement parseCoordinateStatement() {
        if (peek().is(TokenType.LBRACKET)) {
            parseOptions();
        }
        Token open = expect(TokenType.LPAREN, "'(' with coordinate name");
        String name = readRawUntilClosing(open, TokenType.LPAREN, TokenType.RPAREN).trim();
        Coordinate position = null;
        if (peek().is(TokenType.WORD, "at")) {
            advance();
            position = parseAnyCoordinate();
        }
        expect(TokenType.SEMICOLON, "';' after coordinate");
        return new Statement.CoordinateDefinition(name, position);
    }

    private Statement parseEnvironment(Token begin) {
        String environment = readBraced().trim();
        switch (environment) {
            case "scope": {
                OptionList options = peek().is(TokenType.LBRACKET) ? parseOptions() : OptionList.empty();
                List<Statement> body = parseStatements("scope");
                expectEnd("scope");
                return new Statement.ScopeBlock(options, body);
            }
            case "pgfonlayer": {
                String layer = readBraced().trim();
                List<Statement> body = parseStatements("pgfonlayer");
                expectEnd("pgfonlayer");
                return new Statement.LayerBlock(layer, body);
            }
            case "tikzpicture":
                throw error("Nested tikzpicture environments are not supported", begin);
            default:
                throw error("Unsupported environment '" + environment + "'", begin);
        }
    }

    private Statement parseForeach() {
        LoopHeader header = parseLoopHeader();
        List<Statement> body = peek().is(TokenType.LBRACE) ? parseBlockBody() : parseStatement();
        return new Statement.ForeachLoop(header, body);
    }

    private Statement parseMathMacro(boolean truncate) {
        String name;
        if (peek().is(TokenType.LBRACE)) {
            name = readBraced().trim();
        } else {
            Token command = expect(TokenType.COMMAND, "macro name");
            name = command.text();
        }
        String expression = readBraced().trim();
        return new Statement.MacroDefinition(stripBackslash(name), expression, truncate);
    }

    private Statement parseLayerOrder() {
        List<String> layers = new ArrayList<>();
        for (String layer : OptionListParser.splitTopLevel(readBraced(), ',')) {
            if (!layer.isBlank()) {
                layers.add(layer.trim());
            }
        }
        return new Statement.LayerOrder(layers);
    }

    private List<Statement> parseTikzset() {
        List<Statement> styles = new ArrayList<>();
        for (Option option : optionParser.parse(readBraced()).options()) {
            Statement style = styleDefinition(option);
            if (style != null) {
                styles.add(style);
            } else {
                log.warn("Ignoring \\tikzset key '{}'", option.key());
            }
        }
        return styles;
    }

    /** Legacy {@code \tikzstyle{name}=[options]}. */
    private Statement parseTikzstyle() {
        String name = readBraced().trim();
        expect(TokenType.EQUALS, "'=' after \\tikzstyle name");
        return new Statement.StyleDefinition(name, parseOptions());
    }

    /**
     * Turns {@code name/.style={...}} into a style definition, or returns {@code null} for other options.
     */
    private Statement.StyleDefinition styleDefinition(Option option) {
        if (option.isFlag() || !option.key().endsWith("/.style")) {
            return null;
        }
        String name = option.key().substring(0, option.key().length() - "/.style".length()).trim();
        return new Statement.StyleDefinition(name, optionParser.parse(option.value()));
    }

    // ---------------------------------------------------------------- nodes

    private static final class NodeParts {
        private NodeSpec spec;
        private Coordinate position;
    }

    private NodeParts parseNodeParts(boolean allowAt) {
        List<Option> options = new ArrayList<>();
        String name = null;
        Coordinate position = null;
        while (!peek().is(TokenType.LBRACE)) {
            Token token = peek();
            if (token.is(TokenType.LBRACKET)) {
                options.addAll(parseOptions().options());
            } else if (token.is(TokenType.LPAREN)) {
                advance();
                name = readRawUntilClosing(token, TokenType.LPAREN, TokenType.RPAREN).trim();
            } else if (allowAt && token.is(TokenType.WORD, "at")) {
                advance();
                position = parseAnyCoordinate();
            } else {
                throw error("Expected node text in braces but found '" + token.text() + "'", token);
            }
        }
        NodeParts parts = new NodeParts();
        parts.spec = new NodeSpec(new OptionList(options), name, readBraced());
        parts.position = position;
        return parts;
    }

    // ---------------------------------------------------------------- paths

    /**
     * Parses path elements until {@code terminator}, which is left unconsumed. Option lists found
     * in the middle of the path are appended to {@code extraOptions}.
     */
    private List<PathElement> parsePathElements(TokenType terminator, List<Option> extraOptions) {
        List<PathElement> elements = new ArrayList<>();
        SegmentOperation pending = null;
        ShapeSpec pendingShape = null;
        Token pendingToken = null;
        List<PathElement> deferredNodes = new ArrayList<>();

        while (!peek().is(terminator)) {
            Token token = peek();
            if (token.is(TokenType.EOF)) {
                throw error("Unexpected end of input inside path", token);
            }

            if (token.is(TokenType.LPAREN) || token.is(TokenType.OPERATOR, "++") || token.is(TokenType.OPERATOR, "+")) {
                Coordinate coordinate = parseAnyCoordinate();
                SegmentOperation operation = pending != null ? pending : SegmentOperation.MOVETO;
                elements.add(new PathElement.Segment(operation, coordinate, List.of(), pendingShape));
                elements.addAll(deferredNodes);
                deferredNodes.clear();
                pending = null;
                pendingShape = null;
                continue;
            }

            if (pending != null && !token.is(TokenType.WORD, "node") && !token.is(TokenType.WORD, "cycle")) {
                throw error("Expected a coordinate after '" + pendingToken.text() + "'", token);
            }

            if (token.is(TokenType.OPERATOR)) {
                advance();
                switch (token.text()) {
                    case "--":
                        pending = SegmentOperation.LINETO;
                        break;
                    case "-|":
                        pending = SegmentOperation.HORIZONTAL_THEN_VERTICAL;
                        break;
                    case "|-":
                        pending = SegmentOperation.VERTICAL_THEN_HORIZONTAL;
                        break;
                    case "..":
                        elements.addAll(parseCurve(token));
                        break;
                    default:
                        throw error("Unexpected '" + token.text() + "' in path", token);
                }
                pendingToken = token;
                continue;
            }

            if (token.is(TokenType.WORD)) {
                advance();
                switch (token.text()) {
                    case "cycle":
                        elements.add(new PathElement.Segment(SegmentOperation.CLOSE, null, List.of(), null));
                        elements.addAll(deferredNodes);
                        deferredNodes.clear();
                        pending = null;
                        break;
                    case "to":
                        if (peek().is(TokenType.LBRACKET)) {
                            OptionList ignored = parseOptions();
                            log.debug("Ignoring 'to' options {}", ignored);
                        }
                        pending = SegmentOperation.LINETO;
                        pendingToken = token;
                        break;
                    case "rectangle":
                        pending = SegmentOperation.RECTANGLE;
                        pendingToken = token;
                        break;
                    case "grid":
                        pendingShape = parseGridSpec();
                        pending = SegmentOperation.GRID;
                        pendingToken = token;
                        break;
                    case "circle":
                        elements.add(new PathElement.Segment(SegmentOperation.CIRCLE, null, List.of(), parseRadii(token, true)));
                        break;
                    case "ellipse":
                        elements.add(new PathElement.Segment(SegmentOperation.ELLIPSE, null, List.of(), parseRadii(token, false)));
                        break;
                    case "arc":
                        elements.add(new PathElement.Segment(SegmentOperation.ARC, null, List.of(), parseArc(token)));
                        break;
                    case "node": {
                        NodeSpec node = parseNodeParts(false).spec;
                        if (pending != null) {
                            deferredNodes.add(new PathElement.InlineNode(withDefaultPlacement(node)));
                        } else {
                            elements.add(new PathElement.InlineNode(node));
                        }
                        break;
                    }
                    case "coordinate": {
                        if (peek().is(TokenType.LBRACKET)) {
                            parseOptions();
                        }
                        Token open = expect(TokenType.LPAREN, "'(' with coordinate name");
                        elements.add(new PathElement.InlineCoordinate(
                            readRawUntilClosing(open, TokenType.LPAREN, TokenType.RPAREN).trim()));
                        break;
                    }
                    default:
                        throw error("Unsupported path operation '" + token.text() + "'", token);
                }
                continue;
            }

            if (token.is(TokenType.COMMAND, "foreach")) {
                advance();
                LoopHeader header = parseLoopHeader();
                Token open = expect(TokenType.LBRACE, "'{' with path fragment");
                List<PathElement> body = parsePathElements(TokenType.RBRACE, extraOptions);
                if (peek().is(TokenType.EOF)) {
                    throw error("Missing '}' for path fragment", open);
                }
                advance();
                elements.add(new PathElement.InlineForeach(header, body));
                continue;
            }

            if (token.is(TokenType.LBRACKET)) {
                extraOptions.addAll(parseOptions().options());
                continue;
            }

            throw error("Unexpected '" + token.text() + "' in path", token);
        }

        if (pending != null) {
            throw error("Path ends after '" + pendingToken.text() + "' without a coordinate", peek());
        }
        elements.addAll(deferredNodes);
        return elements;
    }

    /**
     * {@code .. controls (c1) [and (c2)] .. (destination)}, the opening {@code ..} already consumed.
     */
    private List<PathElement> parseCurve(Token start) {
        if (!peek().is(TokenType.WORD, "controls")) {
            throw error("Expected 'controls' after '..'", peek());
        }
        advance();
        List<Coordinate> controls = new ArrayList<>();
        controls.add(parseAnyCoordinate());
        if (peek().is(TokenType.WORD, "and")) {
            advance();
            controls.add(parseAnyCoordinate());
        }
        expect(TokenType.OPERATOR, "..", "'..' after curve controls");
        if (peek().is(TokenType.WORD, "cycle")) {
            advance();
            return List.of(
                new PathElement.Segment(SegmentOperation.CURVETO, null, controls, null),
                new PathElement.Segment(SegmentOperation.CLOSE, null, List.of(), null));
        }
        if (!(peek().is(TokenType.LPAREN) || peek().is(TokenType.OPERATOR, "++") || peek().is(TokenType.OPERATOR, "+"))) {
            throw error("Expected curve destination after '..'", start);
        }
        return List.of(new PathElement.Segment(SegmentOperation.CURVETO, parseAnyCoordinate(), controls, null));
    }

    private ShapeSpec.Radii parseRadii(Token keyword, boolean circle) {
        String xRadius = null;
        String yRadius = null;
        if (peek().is(TokenType.LBRACKET)) {
            OptionList options = parseOptions();
            String radius = options.get("radius").orElse(null);
            xRadius = options.get("x radius").orElse(radius);
            yRadius = options.get("y radius").orElse(radius);
        }
        if (peek().is(TokenType.LPAREN)) {
            Token open = advance();
            String raw = readRawUntilClosing(open, TokenType.LPAREN, TokenType.RPAREN).trim();
            String[] radii = raw.split("\\s+and\\s+");
            xRadius = radii[0].trim();
            yRadius = radii.length > 1 ? radii[1].trim() : xRadius;
        }
        if (xRadius == null || yRadius == null) {
            throw error("Missing radius for " + (circle ? "circle" : "ellipse"), keyword);
        }
        return new ShapeSpec.Radii(xRadius, yRadius);
    }

    private ShapeSpec.Arc parseArc(Token keyword) {
        if (peek().is(TokenType.LBRACKET)) {
            OptionList options = parseOptions();
            String radius = options.get("radius").orElse(null);
            String start = options.get("start angle").orElse(null);
            String end = options.get("end angle").orElse(null);
            String delta = options.get("delta angle").orElse(null);
            String xRadius = options.get("x radius").orElse(radius);
            String yRadius = options.get("y radius").orElse(radius);
            if (start == null && end != null && delta != null) {
                start = "(" + end + ")-(" + delta + ")";
                end = null;
            }
            if (start == null || (end == null && delta == null) || xRadius == null || yRadius == null) {
                throw error("Arc needs a start angle, an end or delta angle and a radius", keyword);
            }
            return new ShapeSpec.Arc(start, end, end == null ? delta : null, xRadius, yRadius);
        }
        Token open = expect(TokenType.LPAREN, "'(' or '[' after arc");
        String raw = readRawUntilClosing(open, TokenType.LPAREN, TokenType.RPAREN);
        List<String> parts = OptionListParser.splitTopLevel(raw, ':');
        if (parts.size() != 3) {
            throw error("Arc must be written (start:end:radius)", keyword);
        }
        String[] radii = parts.get(2).trim().split("\\s+and\\s+");
        String xRadius = radii[0].trim();
        String yRadius = radii.length > 1 ? radii[1].trim() : xRadius;
        return new ShapeSpec.Arc(parts.get(0).trim(), parts.get(1).trim(), null, xRadius, yRadius);
    }

    private ShapeSpec.Grid parseGridSpec() {
        if (!peek().is(TokenType.LBRACKET)) {
            return ShapeSpec.Grid.unit();
        }
        OptionList options = parseOptions();
        String step = options.get("step").orElse("1");
        if (step.startsWith("(")) {
            Coordinate stepCoordinate = coordinateParser.parse(step.substring(1, step.length() - 1));
            if (stepCoordinate instanceof Coordinate.Cartesian cartesian) {
                return new ShapeSpec.Grid(cartesian.x(), cartesian.y());
            }
            throw new ParseException("Grid step must be a number or (x,y): " + step);
        }
        return new ShapeSpec.Grid(options.get("xstep").orElse(step), options.get("ystep").orElse(step));
    }

    private NodeSpec withDefaultPlacement(NodeSpec node) {
        for (Option option : node.options().options()) {
            String key = option.key();
            if (key.equals("pos") || key.equals("midway") || key.startsWith("near") || key.startsWith("at ")
                || key.equals("very near start") || key.equals("very near end")) {
                return node;
            }
        }
        List<Option> options = new ArrayList<>(node.options().options());
        options.add(Option.flag("midway"));
        return new NodeSpec(new OptionList(options), node.name(), node.text());
    }

    // ---------------------------------------------------------------- coordinates

    private Coordinate parseAnyCoordinate() {
        Token token = peek();
        if (token.is(TokenType.OPERATOR, "++") || token.is(TokenType.OPERATOR, "+")) {
            advance();
            boolean persistent = token.text().equals("++");
            Token open = expect(TokenType.LPAREN, "'(' after '" + token.text() + "'");
            Coordinate delta = parseCoordinateText(open);
            if (delta instanceof Coordinate.Named) {
                throw error("Relative coordinates need an offset, not a name", token);
            }
            return new Coordinate.Relative(delta, persistent);
        }
        Token open = expect(TokenType.LPAREN, "'(' with coordinate");
        return parseCoordinateText(open);
    }

    private Coordinate parseCoordinateText(Token open) {
        String raw = readRawUntilClosing(open, TokenType.LPAREN, TokenType.RPAREN);
        try {
            return coordinateParser.parse(raw);
        } catch (ParseException e) {
            throw error(e.getMessage(), open);
        }
    }

    // ---------------------------------------------------------------- loops

    private LoopHeader parseLoopHeader() {
        List<String> variables = new ArrayList<>();
        variables.add(expect(TokenType.COMMAND, "loop variable").text());
        while (peek().is(TokenType.OPERATOR, "/")) {
            advance();
            variables.add(expect(TokenType.COMMAND, "loop variable after '/'").text());
        }

        List<LoopHeader.EvaluateBinding> evaluations = new ArrayList<>();
        LoopHeader.CountBinding count = null;
        if (peek().is(TokenType.LBRACKET)) {
            Token bracket = peek();
            for (Option option : parseOptions().options()) {
                if (option.key().equals("evaluate") && !option.isFlag()) {
                    evaluations.add(parseEvaluate(option.value(), bracket));
                } else if (option.key().equals("count") && !option.isFlag()) {
                    count = parseCount(option.value(), bracket);
                } else {
                    throw error("Unsupported \\foreach option '" + option + "'", bracket);
                }
            }
        }

        Token in = peek();
        if (!in.is(TokenType.WORD, "in")) {
            throw error("Expected 'in' after loop variables", in);
        }
        advance();
        if (!peek().is(TokenType.LBRACE)) {
            throw error("Expected '{' with loop values", peek());
        }
        Token open = peek();
        String raw = readBraced();
        return new LoopHeader(variables, parseLoopValues(raw, open), evaluations, count);
    }

    private LoopHeader.Values parseLoopValues(String raw, Token at) {
        List<String> items = new ArrayList<>();
        for (String item : OptionListParser.splitTopLevel(raw, ',')) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        int dots = items.indexOf("...");
        if (dots < 0) {
            return new LoopHeader.ExplicitList(items);
        }
        if (dots == 1 && items.size() == 3) {
            return new LoopHeader.Range(items.get(0), null, items.get(2));
        }
        if (dots == 2 && items.size() == 4) {
            return new LoopHeader.Range(items.get(0), items.get(1), items.get(3));
        }
        throw error("Unsupported loop range {" + raw.trim() + "}", at);
    }

    private LoopHeader.EvaluateBinding parseEvaluate(String value, Token at) {
        String text = value.trim();
        String expression = null;
        int using = text.indexOf(" using ");
        if (using >= 0) {
            expression = OptionListParser.stripBraces(text.substring(using + " using ".length()).trim());
            text = text.substring(0, using).trim();
        }
        String[] names = text.split("\\s+as\\s+");
        String source = stripBackslash(names[0].trim());
        String target = names.length > 1 ? stripBackslash(names[1].trim()) : source;
        if (source.isEmpty() || target.isEmpty()) {
            throw error("Malformed evaluate clause '" + value + "'", at);
        }
        return new LoopHeader.EvaluateBinding(source, target, expression);
    }

    private LoopHeader.CountBinding parseCount(String value, Token at) {
        String[] parts = value.trim().split("\\s+from\\s+");
        String variable = stripBackslash(parts[0].trim());
        if (variable.isEmpty()) {
            throw error("Malformed count clause '" + value + "'", at);
        }
        return new LoopHeader.CountBinding(variable, parts.length > 1 ? parts[1].trim() : null);
    }

    // ---------------------------------------------------------------- token helpers

    private OptionList parseOptions() {
        Token open = expect(TokenType.LBRACKET, "'['");
        return optionParser.parse(readRawUntilClosing(open, TokenType.LBRACKET, TokenType.RBRACKET));
    }

    private String readBraced() {
        Token open = expect(TokenType.LBRACE, "'{'");
        return readRawUntilClosing(open, TokenType.LBRACE, TokenType.RBRACE);
    }

    /**
     * Consumes tokens up to the delimiter matching {@code open} (already consumed) and returns the
     * raw source between them. Delimiters inside braces are ignored for brackets and parentheses.
     */
    private String readRawUntilClosing(Token open, TokenType openType, TokenType closeType) {
        int depth = 1;
        int braces = 0;
        boolean trackBraces = openType != TokenType.LBRACE;
        while (true) {
            Token token = peek();
            if (token.is(TokenType.EOF)) {
                throw error("Unbalanced '" + open.text() + "'", open);
            }
            advance();
            if (trackBraces && token.is(TokenType.LBRACE)) {
                braces++;
            } else if (trackBraces && token.is(TokenType.RBRACE)) {
                braces--;
            } else if (braces == 0 && token.is(openType)) {
                depth++;
            } else if (braces == 0 && token.is(closeType)) {
                depth--;
                if (depth == 0) {
                    return source.substring(open.end(), token.start());
                }
            }
        }
    }

    private void expectEnd(String environment) {
        Token end = expect(TokenType.COMMAND, "end", "\\end{" + environment + "}");
        String name = readBraced().trim();
        if (!name.equals(environment)) {
            throw error("Expected \\end{" + environment + "} but found \\end{" + name + "}", end);
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (!token.is(TokenType.EOF)) {
            index++;
        }
        return token;
    }

    private Token expect(TokenType type, String description) {
        Token token = peek();
        if (!token.is(type)) {
            throw error("Expected " + description + " but found '" + token.text() + "'", token);
        }
        return advance();
    }

    private Token expect(TokenType type, String text, String description) {
        Token token = peek();
        if (!token.is(type, text)) {
            throw error("Expected " + description + " but found '" + token.text() + "'", token);
        }
        return advance();
    }

    private static String stripBackslash(String name) {
        return name.startsWith("\\") ? name.substring(1) : name;
    }

    private static ParseException error(String message, Token token) {
        return new ParseException(message, token.line(), token.column());
    }
}

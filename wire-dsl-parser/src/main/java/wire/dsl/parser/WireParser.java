package wire.dsl.parser;

import wire.dsl.parser.WireAst.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Recursive-descent parser for the wire language.
///
/// Grammar (EBNF):
/// ```
/// project    = "project" STRING "{" { tokensDecl | mocksDecl | colorsDecl | define | screen } "}" EOF
/// define     = "define" ( "Component" STRING "{" ( layout | component ) "}"
///                       | "Layout" STRING "{" layout "}" )
/// tokensDecl = "tokens" IDENT ":" IDENT
/// mocksDecl  = "mocks" "{" { IDENT ":" STRING } "}"
/// colorsDecl = "colors" "{" { IDENT ":" ( HEX | IDENT ) } "}"
/// screen     = "screen" IDENT [ params ] "{" layout "}"
/// layout     = "layout" IDENT [ params ] "{" { layout | component | cell } "}"
/// cell       = "cell" { property } "{" { layout | component } "}"
/// component  = "component" IDENT { property }
/// params     = "(" [ property { "," property } ] ")"
/// property   = WORD ":" ( STRING | NUMBER | WORD )
/// ```
/// `cell` is accepted only directly inside `layout grid`. Parsing stops at the
/// first violation with a [WireSyntaxException].
public final class WireParser {

    private static final Logger LOG = Logger.getLogger(WireParser.class.getName());

    private final String source;
    private final List<Token> tokens;
    private int pos;

    private WireParser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    /// Parses wire source text into an AST.
    /// @param source the complete text of a `.wire` file
    /// @return the project node
    /// @throws NullPointerException if source is null
    /// @throws WireSyntaxException on the first grammar violation
    public static Project parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        LOG.fine(() -> "Parsing wire source (" + source.length() + " chars)");
        final var parser = new WireParser(source, WireLexer.tokenize(source));
        final var project = parser.parseProject();
        LOG.fine(() -> "Parsed project '" + project.name() + "' with " + project.screens().size() + " screen(s)");
        return project;
    }

    private Project parseProject() {
        final Token start = expect(TokenType.PROJECT);
        final Token name = expect(TokenType.STRING);
        expect(TokenType.LBRACE);

        final var tokenDecls = new ArrayList<Property>();
        final var mocks = new ArrayList<Property>();
        final var colors = new ArrayList<Property>();
        final var components = new ArrayList<ComponentDefinition>();
        final var layouts = new ArrayList<LayoutDefinition>();
        final var screens = new ArrayList<Screen>();

        while (!check(TokenType.RBRACE)) {
            final Token current = peek();
            switch (current.type()) {
                case TOKENS -> tokenDecls.add(parseTokensDecl());
                case MOCKS -> mocks.addAll(parseMocksDecl());
                case COLORS -> colors.addAll(parseColorsDecl());
                case DEFINE -> parseDefinition(components, layouts);
                case SCREEN -> screens.add(parseScreen());
                default -> throw unexpected(current, "'tokens', 'mocks', 'colors', 'define', 'screen' or '}'");
            }
        }

        final Token end = peek();
        if (screens.isEmpty()) {
            throw error("A project must declare at least one screen", end);
        }
        advance();
        if (!check(TokenType.EOF)) {
            throw unexpected(peek(), "end of input");
        }
        return new Project(name.value(), tokenDecls, mocks, colors, components, layouts, screens,
            SourceRange.span(start.range(), end.range()));
    }

    /// One key per statement: `tokens density: compact`.
    private Property parseTokensDecl() {
        final Token start = expect(TokenType.TOKENS);
        final Token key = expectWord("token name");
        expect(TokenType.COLON);
        final Token value = expectWord("token value");
        final Token next = peek();
        if (next.type() == TokenType.COMMA || (next.type().isWord() && peekAt(1).type() == TokenType.COLON)) {
            throw error("A 'tokens' declaration takes exactly one key; write a separate 'tokens' statement for each key", next);
        }
        return new Property(key.value(), new Identifier(value.value()), SourceRange.span(start.range(), value.range()));
    }

    private List<Property> parseMocksDecl() {
        expect(TokenType.MOCKS);
        expect(TokenType.LBRACE);
        final var entries = new ArrayList<Property>();
        while (!check(TokenType.RBRACE)) {
            final Token key = expectWord("mock name");
            expect(TokenType.COLON);
            final Token value = expect(TokenType.STRING);
            entries.add(new Property(key.value(), new Text(value.value()), SourceRange.span(key.range(), value.range())));
        }
        expect(TokenType.RBRACE);
        return entries;
    }

    private List<Property> parseColorsDecl() {
        expect(TokenType.COLORS);
        expect(TokenType.LBRACE);
        final var entries = new ArrayList<Property>();
        while (!check(TokenType.RBRACE)) {
            final Token key = expectWord("color name");
            expect(TokenType.COLON);
            final Token value = peek();
            final PropertyValue color;
            if (value.type() == TokenType.HEX_COLOR) {
                color = new HexColor(value.value());
            } else if (value.type().isWord()) {
                color = new Identifier(value.value());
            } else {
                throw unexpected(value, "hex color or color name");
            }
            advance();
            entries.add(new Property(key.value(), color, SourceRange.span(key.range(), value.range())));
        }
        expect(TokenType.RBRACE);
        return entries;
    }

    private void parseDefinition(List<ComponentDefinition> components, List<LayoutDefinition> layouts) {
        final Token start = expect(TokenType.DEFINE);
        final Token kind = peek();
        final boolean isComponent = kind.type() == TokenType.IDENTIFIER && "Component".equals(kind.value());
        if (!isComponent && !(kind.type() == TokenType.IDENTIFIER && "Layout".equals(kind.value()))) {
            throw unexpected(kind, "'Component' or 'Layout'");
        }
        advance();
        final Token name = expect(TokenType.STRING);
        if (name.value().isBlank()) {
            throw error("A definition name must not be blank", name);
        }
        expect(TokenType.LBRACE);

        final Token bodyStart = peek();
        final CellChild body;
        if (bodyStart.type() == TokenType.LAYOUT) {
            body = parseLayout();
        } else if (isComponent && bodyStart.type() == TokenType.COMPONENT) {
            body = parseComponent();
        } else {
            throw unexpected(bodyStart, isComponent ? "'layout' or 'component'" : "'layout'");
        }
        if (!check(TokenType.RBRACE)) {
            throw error("A definition holds exactly one " + (isComponent ? "layout or component" : "layout")
                + "; expected '}' but found " + peek().describe(), peek());
        }
        final Token end = advance();
        final SourceRange range = SourceRange.span(start.range(), end.range());
        if (isComponent) {
            components.add(new ComponentDefinition(name.value(), body, range));
        } else {
            layouts.add(new LayoutDefinition(name.value(), (Layout) body, range));
        }
        LOG.finer(() -> "Parsed definition " + kind.value() + " " + name.value());
    }

    private Screen parseScreen() {
        final Token start = expect(TokenType.SCREEN);
        final Token name = expect(TokenType.IDENTIFIER);
        final List<Property> params = check(TokenType.LPAREN) ? parseParamList() : List.of();
        expect(TokenType.LBRACE);
        if (!check(TokenType.LAYOUT)) {
            throw error("A screen must contain exactly one root layout; expected 'layout' but found " + peek().describe(), peek());
        }
        final Layout root = parseLayout();
        if (!check(TokenType.RBRACE)) {
            throw error("A screen must contain exactly one root layout; expected '}' but found " + peek().describe(), peek());
        }
        final Token end = advance();
        LOG.finer(() -> "Parsed screen " + name.value());
        return new Screen(name.value(), params, root, SourceRange.span(start.range(), end.range()));
    }

    private Layout parseLayout() {
        final Token start = expect(TokenType.LAYOUT);
        final Token type = expectWord("layout type");
        final List<Property> params = check(TokenType.LPAREN) ? parseParamList() : List.of();
        expect(TokenType.LBRACE);

        final boolean isGrid = "grid".equals(type.value());
        final var children = new ArrayList<LayoutChild>();
        while (!check(TokenType.RBRACE)) {
            final Token current = peek();
            switch (current.type()) {
                case LAYOUT -> children.add(parseLayout());
                case COMPONENT -> children.add(parseComponent());
                case CELL -> {
                    if (!isGrid) {
                        throw error("'cell' is only allowed directly inside a grid layout", current);
                    }
                    children.add(parseCell());
                }
                default -> throw unexpected(current, "'layout', 'component'" + (isGrid ? ", 'cell'" : "") + " or '}'");
            }
        }
        final Token end = advance();
        return new Layout(type.value(), params, children, SourceRange.span(start.range(), end.range()));
    }

    private Cell parseCell() {
        final Token start = expect(TokenType.CELL);
        final var props = new ArrayList<Property>();
        while (!check(TokenType.LBRACE)) {
            if (!peek().type().isWord()) {
                throw unexpected(peek(), "cell property or '{'");
            }
            props.add(parseProperty());
        }
        expect(TokenType.LBRACE);

        final var children = new ArrayList<CellChild>();
        while (!check(TokenType.RBRACE)) {
            final Token current = peek();
            switch (current.type()) {
                case LAYOUT -> children.add(parseLayout());
                case COMPONENT -> children.add(parseComponent());
                case CELL -> throw error("'cell' cannot be nested inside another cell", current);
                default -> throw unexpected(current, "'layout', 'component' or '}'");
            }
        }
        final Token end = advance();
        return new Cell(props, children, SourceRange.span(start.range(), end.range()));
    }

    private Component parseComponent() {
        final Token start = expect(TokenType.COMPONENT);
        final Token type = expectWord("component type");
        final var props = new ArrayList<Property>();
        SourceRange last = type.range();
        while (peek().type().isWord() && peekAt(1).type() == TokenType.COLON) {
            final Property property = parseProperty();
            props.add(property);
            last = property.range();
        }
        return new Component(type.value(), props, SourceRange.span(start.range(), last));
    }

    private List<Property> parseParamList() {
        expect(TokenType.LPAREN);
        final var params = new ArrayList<Property>();
        if (check(TokenType.RPAREN)) {
            advance();
            return params;
        }
        params.add(parseProperty());
        while (check(TokenType.COMMA)) {
            advance();
            params.add(parseProperty());
        }
        expect(TokenType.RPAREN);
        return params;
    }

    private Property parseProperty() {
        final Token key = expectWord("property name");
        expect(TokenType.COLON);
        final Token value = peek();
        final PropertyValue parsed;
        if (value.type() == TokenType.STRING) {
            parsed = new Text(value.value());
        } else if (value.type() == TokenType.NUMBER) {
            final double number = Double.parseDouble(value.value());
            if (Double.isInfinite(number)) {
                throw error("Number literal out of range", value);
            }
            parsed = new WireAst.Number(number);
        } else if (value.type().isWord()) {
            parsed = new Identifier(value.value());
        } else {
            throw unexpected(value, "string, number or identifier value for '" + key.value() + "'");
        }
        advance();
        return new Property(key.value(), parsed, SourceRange.span(key.range(), value.range()));
    }

    // ---------------------------------------------------------------- token cursor

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        final int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        final Token token = tokens.get(pos);
        if (token.type() != TokenType.EOF) {
            pos++;
        }
        return token;
    }

    private Token expect(TokenType type) {
        final Token token = peek();
        if (token.type() != type) {
            throw unexpected(token, type.display());
        }
        return advance();
    }

    private Token expectWord(String what) {
        final Token token = peek();
        if (!token.type().isWord()) {
            throw unexpected(token, what);
        }
        return advance();
    }

    private WireSyntaxException unexpected(Token found, String expected) {
        return error("Expected " + expected + " but found " + found.describe(), found);
    }

    private WireSyntaxException error(String reason, Token at) {
        return new WireSyntaxException(reason, source, at.line(), at.column());
    }
}

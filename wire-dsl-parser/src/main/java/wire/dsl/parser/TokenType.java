package wire.dsl.parser;

/// Lexical categories of the wire language.
enum TokenType {
    PROJECT("'project'"),
    SCREEN("'screen'"),
    LAYOUT("'layout'"),
    COMPONENT("'component'"),
    TOKENS("'tokens'"),
    MOCKS("'mocks'"),
    COLORS("'colors'"),
    DEFINE("'define'"),
    CELL("'cell'"),
    LBRACE("'{'"),
    RBRACE("'}'"),
    LPAREN("'('"),
    RPAREN("')'"),
    COLON("':'"),
    COMMA("','"),
    STRING("string literal"),
    NUMBER("number"),
    HEX_COLOR("hex color"),
    IDENTIFIER("identifier"),
    EOF("end of input");

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    /// Human-readable name used in "expected ..." messages.
    String display() {
        return display;
    }

    /// Maps a scanned word to its keyword type, or IDENTIFIER.
    static TokenType keywordOrIdentifier(String word) {
        return switch (word) {
            case "project" -> PROJECT;
            case "screen" -> SCREEN;
            case "layout" -> LAYOUT;
            case "component" -> COMPONENT;
            case "tokens" -> TOKENS;
            case "mocks" -> MOCKS;
            case "colors" -> COLORS;
            case "define" -> DEFINE;
            case "cell" -> CELL;
            default -> IDENTIFIER;
        };
    }

    /// Keywords and identifiers; these may also serve as property keys and bare values.
    boolean isWord() {
        return this == IDENTIFIER || ordinal() <= CELL.ordinal();
    }
}

package wire.dsl.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Converts wire source text into a token list terminated by EOF.
/// Whitespace, `// line` comments and `/* block */` comments are skipped.
final class WireLexer {

    private static final Logger LOG = Logger.getLogger(WireLexer.class.getName());

    private final String source;
    private int pos;
    private int line = 1;
    private int column = 1;

    private WireLexer(String source) {
        this.source = source;
    }

    /// Tokenizes the whole input.
    /// @throws WireSyntaxException on an unrecognized character, an unterminated
    ///         string or block comment, or a malformed hex color
    static List<Token> tokenize(String source) {
        final var lexer = new WireLexer(source);
        final var tokens = lexer.scanAll();
        LOG.finer(() -> "Scanned " + tokens.size() + " tokens");
        return tokens;
    }

    private List<Token> scanAll() {
        final var tokens = new ArrayList<Token>();
        while (true) {
            skipTrivia();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", "", new SourceRange(line, column, line, column)));
                return tokens;
            }
            tokens.add(scanToken());
        }
    }

    private void skipTrivia() {
        while (pos < source.length()) {
            final char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peek(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advance();
                }
            } else if (c == '/' && peek(1) == '*') {
                final int startLine = line;
                final int startColumn = column;
                advance();
                advance();
                while (!(peek(0) == '*' && peek(1) == '/')) {
                    if (pos >= source.length()) {
                        throw error("Unterminated block comment", startLine, startColumn);
                    }
                    advance();
                }
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    private Token scanToken() {
        final int startPos = pos;
        final int startLine = line;
        final int startColumn = column;
        final char c = source.charAt(pos);

        final TokenType punctuation = switch (c) {
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case ':' -> TokenType.COLON;
            case ',' -> TokenType.COMMA;
            default -> null;
        };
        if (punctuation != null) {
            advance();
            return token(punctuation, startPos, startLine, startColumn, String.valueOf(c));
        }

        if (c == '"') {
            return scanString(startPos, startLine, startColumn);
        }

        if (isDigit(c)) {
            while (isDigit(peek(0))) {
                advance();
            }
            if (peek(0) == '.' && isDigit(peek(1))) {
                advance();
                while (isDigit(peek(0))) {
                    advance();
                }
            }
            final String text = source.substring(startPos, pos);
            return token(TokenType.NUMBER, startPos, startLine, startColumn, text);
        }

        if (c == '#') {
            advance();
            int digits = 0;
            while (isHexDigit(peek(0))) {
                advance();
                digits++;
            }
            if (digits != 6 || isIdentifierPart(peek(0))) {
                throw error("Hex color must be '#' followed by exactly six hex digits", startLine, startColumn);
            }
            final String text = source.substring(startPos, pos);
            return token(TokenType.HEX_COLOR, startPos, startLine, startColumn, text);
        }

        if (isIdentifierStart(c)) {
            while (isIdentifierPart(peek(0))) {
                advance();
            }
            final String word = source.substring(startPos, pos);
            return token(TokenType.keywordOrIdentifier(word), startPos, startLine, startColumn, word);
        }

        throw error("Unexpected character '" + c + "'", startLine, startColumn);
    }

    private Token scanString(int startPos, int startLine, int startColumn) {
        advance(); // opening quote
        final var value = new StringBuilder();
        while (true) {
            if (pos >= source.length() || source.charAt(pos) == '\n') {
                throw error("Unterminated string literal", startLine, startColumn);
            }
            final char c = source.charAt(pos);
            if (c == '"') {
                advance();
                break;
            }
            if (c == '\\') {
                advance();
                if (pos >= source.length()) {
                    throw error("Unterminated string literal", startLine, startColumn);
                }
                final char escaped = source.charAt(pos);
                value.append(switch (escaped) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    case 'r' -> '\r';
                    default -> escaped;
                });
                advance();
                continue;
            }
            value.append(c);
            advance();
        }
        return token(TokenType.STRING, startPos, startLine, startColumn, value.toString());
    }

    private Token token(TokenType type, int startPos, int startLine, int startColumn, String value) {
        final String text = source.substring(startPos, pos);
        return new Token(type, text, value, new SourceRange(startLine, startColumn, line, column));
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private char peek(int offset) {
        final int index = pos + offset;
        return index < source.length() ? source.charAt(index) : 0;
    }

    private WireSyntaxException error(String reason, int atLine, int atColumn) {
        return new WireSyntaxException(reason, source, atLine, atColumn);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}

package wire.dsl.parser;

/// A lexical token. `text` is the raw source slice; `value` is the decoded
/// payload (unquoted, unescaped string content for STRING, otherwise the text).
record Token(TokenType type, String text, String value, SourceRange range) {

    int line() {
        return range.startLine();
    }

    int column() {
        return range.startColumn();
    }

    /// Quoted form used in "found ..." messages.
    String describe() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}

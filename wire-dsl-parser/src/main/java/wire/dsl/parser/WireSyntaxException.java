package wire.dsl.parser;

/// Thrown when wire source text violates the grammar. Parsing is fail-fast:
/// the first violation aborts the parse and no partial AST is produced.
public class WireSyntaxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;
    private final String reason;

    /// Creates a syntax error at a 1-based line and column.
    /// @param reason what was expected and what was found
    /// @param source the full source text, used to quote the offending character
    public WireSyntaxException(String reason, String source, int line, int column) {
        super(formatMessage(reason, source, line, column));
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    /// Returns the 1-based line of the offending token.
    public int line() {
        return line;
    }

    /// Returns the 1-based column of the offending token.
    public int column() {
        return column;
    }

    /// Returns the bare description without location decoration.
    public String reason() {
        return reason;
    }

    private static String formatMessage(String reason, String source, int line, int column) {
        final var sb = new StringBuilder();
        sb.append(reason);
        sb.append(" at line ").append(line).append(", column ").append(column);
        final char near = charAt(source, line, column);
        if (near != 0) {
            sb.append(" (near '").append(near).append("')");
        }
        return sb.toString();
    }

    private static char charAt(String source, int line, int column) {
        if (source == null) {
            return 0;
        }
        int currentLine = 1;
        int offset = 0;
        while (currentLine < line && offset < source.length()) {
            if (source.charAt(offset) == '\n') {
                currentLine++;
            }
            offset++;
        }
        final int index = offset + column - 1;
        if (currentLine != line || index >= source.length()) {
            return 0;
        }
        final char c = source.charAt(index);
        return c == '\n' || c == '\r' ? 0 : c;
    }
}

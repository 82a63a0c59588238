package wire.dsl.parser;

/// A region of source text. Lines and columns are 1-based; the end position
/// is exclusive, i.e. it names the column just after the last character.
public record SourceRange(int startLine, int startColumn, int endLine, int endColumn) {

    public SourceRange {
        if (startLine < 1 || startColumn < 1 || endLine < startLine) {
            throw new IllegalArgumentException("invalid source range " + startLine + ":" + startColumn
                + "-" + endLine + ":" + endColumn);
        }
    }

    /// Range covering everything from the start of `first` to the end of `last`.
    public static SourceRange span(SourceRange first, SourceRange last) {
        return new SourceRange(first.startLine, first.startColumn, last.endLine, last.endColumn);
    }

    /// True when the given 1-based position falls inside this range.
    public boolean contains(int line, int column) {
        if (line < startLine || line > endLine) {
            return false;
        }
        if (line == startLine && column < startColumn) {
            return false;
        }
        return line != endLine || column < endColumn;
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}

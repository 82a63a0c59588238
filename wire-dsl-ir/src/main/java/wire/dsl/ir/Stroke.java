package wire.dsl.ir;

/// Outline weight applied by renderers.
public enum Stroke {
    THIN,
    NORMAL,
    THICK;

    public String token() {
        return DesignTokens.tokenOf(this);
    }
}

package wire.dsl.ir;

/// Base font scale applied by renderers.
public enum FontSize {
    SM,
    BASE,
    LG;

    public String token() {
        return DesignTokens.tokenOf(this);
    }
}

package wire.dsl.ir;

/// Corner rounding applied by renderers.
public enum Radius {
    NONE,
    SM,
    MD,
    LG,
    FULL;

    public String token() {
        return DesignTokens.tokenOf(this);
    }
}

package wire.dsl.ir;

/// How tightly controls are packed; drives default component heights.
public enum Density {
    COMPACT,
    NORMAL,
    COMFORTABLE;

    public String token() {
        return DesignTokens.tokenOf(this);
    }
}

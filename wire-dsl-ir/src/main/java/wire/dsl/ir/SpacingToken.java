package wire.dsl.ir;

/// Symbolic spacing step and its pixel size.
public enum SpacingToken {
    NONE(0),
    XS(4),
    SM(8),
    MD(16),
    LG(24),
    XL(32);

    private final int pixels;

    SpacingToken(int pixels) {
        this.pixels = pixels;
    }

    public int pixels() {
        return pixels;
    }

    public String token() {
        return DesignTokens.tokenOf(this);
    }
}

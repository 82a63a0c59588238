package wire.dsl.ir;

/// Values of the `justify` style property.
public enum Justify {
    START,
    CENTER,
    END;

    public String token() {
        return DesignTokens.tokenOf(this);
    }
}

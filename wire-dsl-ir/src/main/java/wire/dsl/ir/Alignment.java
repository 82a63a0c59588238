package wire.dsl.ir;

/// Values of the `align` style property of a horizontal stack.
/// `JUSTIFY` shares the row equally between the children; the others keep
/// each child's intrinsic width and place the group inside the row.
public enum Alignment {
    LEFT,
    CENTER,
    RIGHT,
    JUSTIFY;

    public String token() {
        return DesignTokens.tokenOf(this);
    }
}

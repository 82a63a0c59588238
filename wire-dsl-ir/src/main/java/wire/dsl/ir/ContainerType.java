package wire.dsl.ir;

/// The five layout containers. Each has its own positioning algorithm.
public enum ContainerType {
    STACK,
    GRID,
    SPLIT,
    PANEL,
    CARD;

    public String token() {
        return DesignTokens.tokenOf(this);
    }
}

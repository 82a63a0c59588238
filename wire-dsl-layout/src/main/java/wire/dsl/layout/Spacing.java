package wire.dsl.layout;

import wire.dsl.ir.DesignTokens;
import wire.dsl.ir.IrStyle;
import wire.dsl.ir.SpacingToken;

/// Resolves the spacing tokens of a node's style to pixels. An unset padding
/// or gap takes the project-wide `spacing` token.
final class Spacing {

    private final SpacingToken fallback;

    Spacing(DesignTokens tokens) {
        this.fallback = tokens.spacing();
    }

    int padding(IrStyle style) {
        return style.paddingToken().orElse(fallback).pixels();
    }

    int gap(IrStyle style) {
        return style.gapToken().orElse(fallback).pixels();
    }
}

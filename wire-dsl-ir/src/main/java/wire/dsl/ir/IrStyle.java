package wire.dsl.ir;

import java.util.Objects;
import java.util.Optional;

/// Spacing and alignment shared by every container type. Each field may be
/// unset (null); the layout engine resolves an unset padding or gap to the
/// project `spacing` token. Generated containers always carry a padding,
/// `none` unless declared. An unset `align` lays a horizontal stack out as
/// [Alignment#JUSTIFY].
public record IrStyle(SpacingToken padding, SpacingToken gap, Alignment align, Justify justify) {

    /// Style of a component, or of a hand-built container with nothing declared.
    public static final IrStyle EMPTY = new IrStyle(null, null, null, null);

    public Optional<SpacingToken> paddingToken() {
        return Optional.ofNullable(padding);
    }

    public Optional<SpacingToken> gapToken() {
        return Optional.ofNullable(gap);
    }

    public Optional<Alignment> alignment() {
        return Optional.ofNullable(align);
    }

    public Optional<Justify> justification() {
        return Optional.ofNullable(justify);
    }

    public IrStyle withPadding(SpacingToken value) {
        return new IrStyle(Objects.requireNonNull(value, "value must not be null"), gap, align, justify);
    }

    public IrStyle withGap(SpacingToken value) {
        return new IrStyle(padding, Objects.requireNonNull(value, "value must not be null"), align, justify);
    }

    public IrStyle withAlign(Alignment value) {
        return new IrStyle(padding, gap, Objects.requireNonNull(value, "value must not be null"), justify);
    }

    public IrStyle withJustify(Justify value) {
        return new IrStyle(padding, gap, align, Objects.requireNonNull(value, "value must not be null"));
    }
}

package wire.dsl.ir;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/// The five project-wide design tokens. Always fully populated: generation
/// starts from [#DEFAULTS] and each declared token overwrites exactly one key.
public record DesignTokens(Density density, SpacingToken spacing, Radius radius, Stroke stroke, FontSize font) {

    public static final DesignTokens DEFAULTS =
        new DesignTokens(Density.NORMAL, SpacingToken.MD, Radius.MD, Stroke.NORMAL, FontSize.BASE);

    public DesignTokens {
        Objects.requireNonNull(density, "density must not be null");
        Objects.requireNonNull(spacing, "spacing must not be null");
        Objects.requireNonNull(radius, "radius must not be null");
        Objects.requireNonNull(stroke, "stroke must not be null");
        Objects.requireNonNull(font, "font must not be null");
    }

    public DesignTokens withDensity(Density value) {
        return new DesignTokens(value, spacing, radius, stroke, font);
    }

    public DesignTokens withSpacing(SpacingToken value) {
        return new DesignTokens(density, value, radius, stroke, font);
    }

    public DesignTokens withRadius(Radius value) {
        return new DesignTokens(density, spacing, value, stroke, font);
    }

    public DesignTokens withStroke(Stroke value) {
        return new DesignTokens(density, spacing, radius, value, font);
    }

    public DesignTokens withFont(FontSize value) {
        return new DesignTokens(density, spacing, radius, stroke, value);
    }

    /// Lower-case source spelling of an enum constant.
    static String tokenOf(Enum<?> constant) {
        return constant.name().toLowerCase(Locale.ROOT);
    }

    /// Resolves a source spelling (exact, lower-case) to its constant.
    public static <E extends Enum<E>> Optional<E> parse(Class<E> type, String token) {
        Objects.requireNonNull(token, "token must not be null");
        for (final E constant : type.getEnumConstants()) {
            if (tokenOf(constant).equals(token)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }

    /// Comma-separated list of accepted spellings, for error messages.
    static <E extends Enum<E>> String accepted(Class<E> type) {
        final var sb = new StringBuilder();
        for (final E constant : type.getEnumConstants()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(tokenOf(constant));
        }
        return sb.toString();
    }
}

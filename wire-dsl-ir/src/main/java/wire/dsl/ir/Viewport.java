package wire.dsl.ir;

/// Pixel size a screen is laid out against.
public record Viewport(int width, int height) {

    /// Used when a screen names neither a device nor explicit dimensions.
    public static final Viewport DEFAULT = DevicePreset.DESKTOP.viewport();

    public Viewport {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("viewport must be positive, got " + width + "x" + height);
        }
    }
}

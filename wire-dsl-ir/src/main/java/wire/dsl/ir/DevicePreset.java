package wire.dsl.ir;

import java.util.Locale;
import java.util.Optional;

/// Named viewports selectable with `screen Name(device: mobile)`.
public enum DevicePreset {
    MOBILE(375, 812),
    TABLET(768, 1024),
    DESKTOP(1280, 720),
    PRINT(794, 1123),
    A4(794, 1123);

    private final int width;
    private final int height;

    DevicePreset(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public Viewport viewport() {
        return new Viewport(width, height);
    }

    /// Case-insensitive lookup by preset name.
    public static Optional<DevicePreset> named(String name) {
        for (final var preset : values()) {
            if (preset.name().equals(name.toUpperCase(Locale.ROOT))) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }
}

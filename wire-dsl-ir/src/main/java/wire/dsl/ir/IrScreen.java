package wire.dsl.ir;

import java.util.Objects;

/// A screen: its sanitized id, display name, viewport and the id of its root node.
public record IrScreen(String id, String name, Viewport viewport, String root) {
    public IrScreen {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(viewport, "viewport must not be null");
        Objects.requireNonNull(root, "root must not be null");
    }
}

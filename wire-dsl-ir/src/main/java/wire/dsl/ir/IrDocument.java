package wire.dsl.ir;

import java.util.Objects;

/// Versioned IR document handed from the generator to the layout engine and
/// to downstream renderers.
public record IrDocument(String irVersion, IrProject project) {
    public IrDocument {
        Objects.requireNonNull(irVersion, "irVersion must not be null");
        Objects.requireNonNull(project, "project must not be null");
    }
}

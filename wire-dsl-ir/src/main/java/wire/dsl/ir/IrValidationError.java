package wire.dsl.ir;

import java.util.Objects;

/// One schema violation: where in the IR document, and what is wrong there.
public record IrValidationError(String path, String message) {
    public IrValidationError {
        Objects.requireNonNull(path, "path must not be null");
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("Error message cannot be null or empty");
        }
    }

    @Override
    public String toString() {
        return path + ": " + message;
    }
}

package wire.dsl.ir;

import java.util.List;

/// Thrown when a generated (or hand-built) IR document breaks the schema.
/// Carries every violation found, in document order.
public class WireValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<IrValidationError> errors;

    public WireValidationException(List<IrValidationError> errors) {
        super(format(errors));
        this.errors = List.copyOf(errors);
    }

    /// All violations; never empty.
    public List<IrValidationError> errors() {
        return errors;
    }

    /// Path of the first violation.
    public String path() {
        return errors.get(0).path();
    }

    /// Description of the first violation, without its path.
    public String reason() {
        return errors.get(0).message();
    }

    private static String format(List<IrValidationError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("errors must not be empty");
        }
        final var first = errors.get(0).toString();
        return errors.size() == 1 ? first : first + " (and " + (errors.size() - 1) + " more)";
    }
}

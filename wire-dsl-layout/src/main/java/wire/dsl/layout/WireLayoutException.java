package wire.dsl.layout;

/// Thrown when an IR document cannot be laid out: a reference names no node,
/// or references loop back on themselves.
public class WireLayoutException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String nodeId;

    public WireLayoutException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    /// The id that could not be resolved or that closes a cycle.
    public String nodeId() {
        return nodeId;
    }
}

package wire.dsl.ir;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// The project body of an [IrDocument]. `nodes` is keyed by node id and keeps
/// generation order.
public record IrProject(String id, String name, DesignTokens tokens, Map<String, String> mocks,
                        Map<String, String> colors, List<IrScreen> screens, Map<String, IrNode> nodes) {
    public IrProject {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(tokens, "tokens must not be null");
        mocks = IrNode.orderedCopy(mocks);
        colors = IrNode.orderedCopy(colors);
        screens = List.copyOf(screens);
        nodes = IrNode.orderedCopy(nodes);
    }

    public Optional<IrNode> node(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }
}

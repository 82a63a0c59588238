package wire.dsl.layout;

import com.fasterxml.jackson.databind.node.ObjectNode;
import wire.dsl.ir.IrJson;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Node id to absolute [Box] for every node reachable from every screen root.
/// Parents precede their children; screens follow one another in IR order.
public record LayoutResult(Map<String, Box> boxes) {

    public LayoutResult {
        Objects.requireNonNull(boxes, "boxes must not be null");
        boxes = Collections.unmodifiableMap(new LinkedHashMap<>(boxes));
    }

    public Optional<Box> box(String nodeId) {
        return Optional.ofNullable(boxes.get(nodeId));
    }

    /// The box of a node that is known to be laid out.
    /// @throws IllegalArgumentException if the id has no box
    public Box get(String nodeId) {
        final Box box = boxes.get(nodeId);
        if (box == null) {
            throw new IllegalArgumentException("No layout for node '" + nodeId + "'");
        }
        return box;
    }

    public int size() {
        return boxes.size();
    }

    /// `{"node_1": {"x":0,"y":0,"width":1280,"height":720}, ...}`
    public ObjectNode toJson() {
        final ObjectNode json = IrJson.mapper().createObjectNode();
        boxes.forEach((id, box) -> {
            final ObjectNode entry = json.putObject(id);
            entry.put("x", box.x());
            entry.put("y", box.y());
            entry.put("width", box.width());
            entry.put("height", box.height());
        });
        return json;
    }

    public String toJsonString() {
        return IrJson.write(toJson());
    }
}

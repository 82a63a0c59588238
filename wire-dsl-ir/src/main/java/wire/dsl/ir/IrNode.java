package wire.dsl.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Entry of the flat `nodes` dictionary. A node is either a [Container] that
/// refers to its children by id, or a leaf [Component].
public sealed interface IrNode permits IrNode.Container, IrNode.Component {

    /// Value of [IrNode.Container#meta()] `source` for nodes built from a grid cell.
    String CELL_SOURCE = "cell";

    String id();

    /// `"container"` or `"component"`; the tag used in JSON.
    String kind();

    IrStyle style();

    Map<String, String> meta();

    /// A layout node. Params hold everything except the style keys
    /// (`padding`, `gap`, `align`, `justify`).
    record Container(String id, ContainerType containerType, Map<String, IrValue> params,
                     List<String> children, IrStyle style, Map<String, String> meta) implements IrNode {
        public Container {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(containerType, "containerType must not be null");
            params = orderedCopy(params);
            children = List.copyOf(children);
            Objects.requireNonNull(style, "style must not be null");
            meta = orderedCopy(meta);
        }

        @Override
        public String kind() {
            return "container";
        }

        public Optional<IrValue> param(String key) {
            return Optional.ofNullable(params.get(key));
        }

        public boolean isCell() {
            return CELL_SOURCE.equals(meta.get("source"));
        }
    }

    /// A leaf widget such as `Button` or `Table`. The type name is open-ended.
    record Component(String id, String componentType, Map<String, IrValue> props,
                     IrStyle style, Map<String, String> meta) implements IrNode {
        public Component {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(componentType, "componentType must not be null");
            props = orderedCopy(props);
            Objects.requireNonNull(style, "style must not be null");
            meta = orderedCopy(meta);
        }

        @Override
        public String kind() {
            return "component";
        }

        public Optional<IrValue> prop(String key) {
            return Optional.ofNullable(props.get(key));
        }
    }

    /// Unmodifiable copy that keeps declaration order.
    static <V> Map<String, V> orderedCopy(Map<String, V> source) {
        Objects.requireNonNull(source, "map must not be null");
        final var copy = new LinkedHashMap<String, V>();
        source.forEach((key, value) -> copy.put(
            Objects.requireNonNull(key, "key must not be null"),
            Objects.requireNonNull(value, "value for '" + key + "' must not be null")));
        return Collections.unmodifiableMap(copy);
    }
}

package wire.dsl.ir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;

/// JSON rendering of an [IrDocument] for renderers and other tools:
///
/// ```
/// {"irVersion":"1.0","project":{"id":..,"name":..,"tokens":{..},"mocks":{..},"colors":{..},
///   "screens":[{"id":..,"name":..,"viewport":{"width":..,"height":..},"root":{"ref":..}}],
///   "nodes":{"node_1":{"id":"node_1","kind":"container","containerType":"stack",
///            "params":{..},"children":[{"ref":..}],"style":{..},"meta":{..}}}}}
/// ```
/// Unset style fields are omitted. Integral numbers are written as JSON integers.
public final class IrJson {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private IrJson() {
    }

    public static ObjectNode toJson(IrDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        final ObjectNode root = MAPPER.createObjectNode();
        root.put("irVersion", document.irVersion());
        root.set("project", project(document.project()));
        return root;
    }

    /// Pretty-printed JSON text.
    public static String toJsonString(IrDocument document) {
        return write(toJson(document));
    }

    /// Shared by the layout module for its own JSON output.
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String write(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write JSON", e);
        }
    }

    private static ObjectNode project(IrProject project) {
        final ObjectNode json = MAPPER.createObjectNode();
        json.put("id", project.id());
        json.put("name", project.name());

        final ObjectNode tokens = json.putObject("tokens");
        tokens.put("density", project.tokens().density().token());
        tokens.put("spacing", project.tokens().spacing().token());
        tokens.put("radius", project.tokens().radius().token());
        tokens.put("stroke", project.tokens().stroke().token());
        tokens.put("font", project.tokens().font().token());

        final ObjectNode mocks = json.putObject("mocks");
        project.mocks().forEach(mocks::put);
        final ObjectNode colors = json.putObject("colors");
        project.colors().forEach(colors::put);

        final var screens = json.putArray("screens");
        for (final IrScreen screen : project.screens()) {
            final ObjectNode entry = screens.addObject();
            entry.put("id", screen.id());
            entry.put("name", screen.name());
            final ObjectNode viewport = entry.putObject("viewport");
            viewport.put("width", screen.viewport().width());
            viewport.put("height", screen.viewport().height());
            entry.putObject("root").put("ref", screen.root());
        }

        final ObjectNode nodes = json.putObject("nodes");
        project.nodes().forEach((id, node) -> nodes.set(id, node(node)));
        return json;
    }

    private static ObjectNode node(IrNode node) {
        final ObjectNode json = MAPPER.createObjectNode();
        json.put("id", node.id());
        json.put("kind", node.kind());
        if (node instanceof IrNode.Container container) {
            json.put("containerType", container.containerType().token());
            values(json.putObject("params"), container.params());
            final var children = json.putArray("children");
            container.children().forEach(ref -> children.addObject().put("ref", ref));
        } else if (node instanceof IrNode.Component component) {
            json.put("componentType", component.componentType());
            values(json.putObject("props"), component.props());
        }
        json.set("style", style(node.style()));
        final ObjectNode meta = json.putObject("meta");
        node.meta().forEach(meta::put);
        return json;
    }

    private static ObjectNode style(IrStyle style) {
        final ObjectNode json = MAPPER.createObjectNode();
        style.paddingToken().ifPresent(token -> json.put("padding", token.token()));
        style.gapToken().ifPresent(token -> json.put("gap", token.token()));
        style.alignment().ifPresent(token -> json.put("align", token.token()));
        style.justification().ifPresent(token -> json.put("justify", token.token()));
        return json;
    }

    private static void values(ObjectNode target, Map<String, IrValue> values) {
        values.forEach((key, value) -> {
            if (value instanceof IrValue.Number number) {
                if (number.isIntegral() && Math.abs(number.value()) < Long.MAX_VALUE) {
                    target.put(key, (long) number.value());
                } else {
                    target.put(key, number.value());
                }
            } else {
                target.put(key, value.asString());
            }
        });
    }
}

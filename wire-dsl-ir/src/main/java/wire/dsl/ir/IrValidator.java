package wire.dsl.ir;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Structural checks over an assembled [IrDocument]:
///
/// - the version is [IrGenerator#IR_VERSION] and the project has an id and at least one screen
/// - screen ids are non-empty and unique
/// - every `nodes` key matches the id of the node stored under it
/// - every screen root and container child reference resolves
/// - the graph reachable from the screen roots is a tree (no shared node, no cycle)
/// - every node is reachable from a screen root
/// - container params hold sensible geometry (`direction`, `columns`, `span`, `sidebar`)
/// - a split has at most two children and a panel at most one
/// - component `width`/`height`, when given, are non-negative numbers
///
/// Token values and style tokens are typed, so they cannot be out of range here.
public final class IrValidator {

    private static final Logger LOG = Logger.getLogger(IrValidator.class.getName());

    private IrValidator() {
    }

    /// Validates a document, typically one assembled by hand.
    /// @throws WireValidationException if any check fails
    public static void validate(IrDocument document) {
        final var errors = check(document);
        if (!errors.isEmpty()) {
            throw new WireValidationException(errors);
        }
    }

    /// Runs every check and returns the violations in document order.
    static List<IrValidationError> check(IrDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        final var errors = new ArrayList<IrValidationError>();
        final var project = document.project();
        final IrPath root = IrPath.root();

        if (!IrGenerator.IR_VERSION.equals(document.irVersion())) {
            errors.add(new IrValidationError("irVersion",
                "unsupported IR version '" + document.irVersion() + "'; expected " + IrGenerator.IR_VERSION));
        }
        if (project.id().isEmpty()) {
            errors.add(new IrValidationError(root.field("id").value(),
                "project name '" + project.name() + "' must contain at least one letter, digit or underscore"));
        }
        if (project.screens().isEmpty()) {
            errors.add(new IrValidationError(root.field("screens").value(), "at least one screen is required"));
        }

        project.nodes().forEach((key, node) -> {
            if (!key.equals(node.id())) {
                errors.add(new IrValidationError(IrPath.node(key).field("id").value(),
                    "node stored under '" + key + "' has id '" + node.id() + "'"));
            }
        });

        final Set<String> screenIds = new HashSet<>();
        final Set<String> reached = new HashSet<>();
        for (int i = 0; i < project.screens().size(); i++) {
            final IrScreen screen = project.screens().get(i);
            final IrPath at = root.field("screens").index(i);
            if (screen.id().isEmpty()) {
                errors.add(new IrValidationError(at.field("id").value(), "screen id must not be empty"));
            } else if (!screenIds.add(screen.id())) {
                errors.add(new IrValidationError(at.field("id").value(),
                    "duplicate screen id '" + screen.id() + "'"));
            }
            walk(screen.root(), at.field("root").field("ref"), project.nodes(), reached, errors);
        }

        project.nodes().forEach((key, node) -> {
            if (!reached.contains(key)) {
                errors.add(new IrValidationError(IrPath.node(key).value(),
                    "node '" + key + "' is not reachable from any screen root"));
                checkNode(node, errors);
            }
        });

        LOG.fine(() -> "Validated IR: " + project.nodes().size() + " node(s), " + errors.size() + " error(s)");
        return errors;
    }

    /// Depth-first walk from a reference, checking each node on first visit so
    /// errors come out in document order. A node reached twice is either shared
    /// between parents or part of a cycle.
    private static void walk(String ref, IrPath at, Map<String, IrNode> nodes, Set<String> reached,
                             List<IrValidationError> errors) {
        final IrNode node = nodes.get(ref);
        if (node == null) {
            errors.add(new IrValidationError(at.value(), "reference '" + ref + "' does not resolve to a node"));
            return;
        }
        if (!reached.add(ref)) {
            errors.add(new IrValidationError(at.value(), "node '" + ref + "' is referenced more than once"));
            return;
        }
        checkNode(node, errors);
        if (node instanceof IrNode.Container container) {
            final IrPath children = IrPath.node(ref).field("children");
            for (int i = 0; i < container.children().size(); i++) {
                walk(container.children().get(i), children.index(i).field("ref"), nodes, reached, errors);
            }
        }
    }

    private static void checkNode(IrNode node, List<IrValidationError> errors) {
        final IrPath path = IrPath.node(node.id());
        if (node instanceof IrNode.Container container) {
            final IrPath params = path.field("params");
            container.param("direction").ifPresent(direction -> {
                final String value = direction.asString();
                if (!"vertical".equals(value) && !"horizontal".equals(value)) {
                    errors.add(new IrValidationError(params.field("direction").value(),
                        "'" + value + "' is not one of vertical, horizontal"));
                }
            });
            if (container.containerType() == ContainerType.GRID) {
                container.param("columns").ifPresent(value -> positiveWhole(value, params.field("columns"), errors));
            }
            if (container.isCell()) {
                container.param("span").ifPresent(value -> positiveWhole(value, params.field("span"), errors));
            }
            if (container.containerType() == ContainerType.SPLIT && container.children().size() > 2) {
                errors.add(new IrValidationError(path.field("children").value(),
                    "a split holds at most two children but has " + container.children().size()));
            }
            if (container.containerType() == ContainerType.PANEL && container.children().size() > 1) {
                errors.add(new IrValidationError(path.field("children").value(),
                    "a panel holds at most one child but has " + container.children().size()));
            }
            if (container.containerType() == ContainerType.SPLIT) {
                container.param("sidebar").ifPresent(value -> {
                    final var number = value.asNumber();
                    if (number.isEmpty() || number.getAsDouble() <= 0) {
                        errors.add(new IrValidationError(params.field("sidebar").value(),
                            "must be a positive number but was '" + value.asString() + "'"));
                    }
                });
            }
        } else if (node instanceof IrNode.Component component) {
            if (component.componentType().isBlank()) {
                errors.add(new IrValidationError(path.field("componentType").value(), "component type must not be blank"));
            }
            for (final String key : List.of("width", "height")) {
                component.prop(key).ifPresent(value -> {
                    final var number = value.asNumber();
                    if (number.isEmpty() || number.getAsDouble() < 0) {
                        errors.add(new IrValidationError(path.field("props").field(key).value(),
                            "must be a non-negative number but was '" + value.asString() + "'"));
                    }
                });
            }
        }
    }

    private static void positiveWhole(IrValue value, IrPath at, List<IrValidationError> errors) {
        final var number = value.asNumber();
        if (number.isEmpty() || number.getAsDouble() < 1 || number.getAsDouble() != Math.rint(number.getAsDouble())) {
            errors.add(new IrValidationError(at.value(), "must be a positive whole number but was '" + value.asString() + "'"));
        }
    }
}

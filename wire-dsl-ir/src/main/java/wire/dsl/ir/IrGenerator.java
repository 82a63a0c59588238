package wire.dsl.ir;

import wire.dsl.parser.WireAst;
import wire.dsl.parser.WireAst.Cell;
import wire.dsl.parser.WireAst.CellChild;
import wire.dsl.parser.WireAst.ComponentDefinition;
import wire.dsl.parser.WireAst.Layout;
import wire.dsl.parser.WireAst.LayoutChild;
import wire.dsl.parser.WireAst.LayoutDefinition;
import wire.dsl.parser.WireAst.Project;
import wire.dsl.parser.WireAst.Property;
import wire.dsl.parser.WireAst.Screen;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Turns a parsed [Project] into a validated [IrDocument].
///
/// Each call builds its own id counter and node table, so generating the same
/// AST twice yields identical documents and concurrent calls share nothing.
/// Node ids are handed out depth-first, a parent before its children.
///
/// Conversion problems (unknown tokens, layout types, screen params) are
/// collected together with the structural findings of [IrValidator]; if any
/// exist a single [WireValidationException] reports them all.
public final class IrGenerator {

    private static final Logger LOG = Logger.getLogger(IrGenerator.class.getName());

    public static final String IR_VERSION = "1.0";

    private static final String PADDING = "padding";
    private static final String GAP = "gap";
    private static final String ALIGN = "align";
    private static final String JUSTIFY = "justify";

    private static final String CHILDREN = "Children";
    private static final String BINDING_PREFIX = "prop_";

    private final NodeIds ids = new NodeIds("node");
    private final Map<String, ComponentDefinition> componentDefinitions = new HashMap<>();
    private final Map<String, LayoutDefinition> layoutDefinitions = new HashMap<>();
    private final Map<String, IrNode> nodes = new LinkedHashMap<>();
    private final List<IrValidationError> errors = new ArrayList<>();

    private IrGenerator() {
    }

    /// Builds the IR for a parsed project.
    /// @param ast parser output
    /// @return the validated document
    /// @throws WireValidationException listing every schema violation found
    public static IrDocument generate(Project ast) {
        Objects.requireNonNull(ast, "ast must not be null");
        LOG.fine(() -> "Generating IR for project '" + ast.name() + "'");
        final var generator = new IrGenerator();
        final var document = generator.build(ast);

        final var problems = new ArrayList<>(generator.errors);
        problems.addAll(IrValidator.check(document));
        if (!problems.isEmpty()) {
            LOG.fine(() -> "IR for '" + ast.name() + "' rejected with " + problems.size() + " error(s)");
            throw new WireValidationException(problems);
        }
        LOG.fine(() -> "Generated IR with " + document.project().nodes().size() + " node(s) across "
            + document.project().screens().size() + " screen(s)");
        return document;
    }

    private IrDocument build(Project ast) {
        final IrPath projectPath = IrPath.root();
        final DesignTokens tokens = resolveTokens(ast.tokens(), projectPath.field("tokens"));
        final Map<String, String> mocks = entries(ast.mocks());
        final Map<String, String> colors = entries(ast.colors());

        ast.components().forEach(definition -> componentDefinitions.put(definition.name(), definition));
        ast.layouts().forEach(definition -> layoutDefinitions.put(definition.name(), definition));

        final var screens = new ArrayList<IrScreen>();
        for (int i = 0; i < ast.screens().size(); i++) {
            screens.add(screen(ast.screens().get(i), projectPath.field("screens").index(i)));
        }

        final var project = new IrProject(sanitizeId(ast.name()), ast.name(), tokens, mocks, colors, screens, nodes);
        return new IrDocument(IR_VERSION, project);
    }

    // ---------------------------------------------------------------- tokens

    /// Starts from the defaults; each declaration overwrites one key, later ones win.
    private DesignTokens resolveTokens(List<Property> declared, IrPath path) {
        DesignTokens tokens = DesignTokens.DEFAULTS;
        for (final var declaration : declared) {
            final IrPath at = path.field(declaration.key());
            final String value = declaration.value().asString();
            switch (declaration.key()) {
                case "density" -> {
                    final var parsed = token(Density.class, value, at);
                    if (parsed.isPresent()) {
                        tokens = tokens.withDensity(parsed.get());
                    }
                }
                case "spacing" -> {
                    final var parsed = token(SpacingToken.class, value, at);
                    if (parsed.isPresent() && parsed.get() == SpacingToken.NONE) {
                        error(at, "spacing token must be one of xs, sm, md, lg, xl but was 'none'");
                    } else if (parsed.isPresent()) {
                        tokens = tokens.withSpacing(parsed.get());
                    }
                }
                case "radius" -> {
                    final var parsed = token(Radius.class, value, at);
                    if (parsed.isPresent()) {
                        tokens = tokens.withRadius(parsed.get());
                    }
                }
                case "stroke" -> {
                    final var parsed = token(Stroke.class, value, at);
                    if (parsed.isPresent()) {
                        tokens = tokens.withStroke(parsed.get());
                    }
                }
                case "font" -> {
                    final var parsed = token(FontSize.class, value, at);
                    if (parsed.isPresent()) {
                        tokens = tokens.withFont(parsed.get());
                    }
                }
                default -> error(at, "unknown token '" + declaration.key()
                    + "'; expected density, spacing, radius, stroke or font");
            }
        }
        return tokens;
    }

    private <E extends Enum<E>> Optional<E> token(Class<E> type, String value, IrPath at) {
        final Optional<E> parsed = DesignTokens.parse(type, value);
        if (parsed.isEmpty()) {
            error(at, "'" + value + "' is not one of " + DesignTokens.accepted(type));
        }
        return parsed;
    }

    /// Mock and color entries; a repeated key keeps its first position and its last value.
    private static Map<String, String> entries(List<Property> declared) {
        final var map = new LinkedHashMap<String, String>();
        for (final var entry : declared) {
            map.put(entry.key(), entry.value().asString());
        }
        return map;
    }

    // ---------------------------------------------------------------- screens

    private IrScreen screen(Screen screen, IrPath path) {
        final Viewport viewport = viewport(screen.params(), path.field("params"));
        final String root = container(screen.root(), Scope.top());
        LOG.finer(() -> "Screen " + screen.name() + " -> root " + root + " at " + viewport.width() + "x" + viewport.height());
        return new IrScreen(sanitizeId(screen.name()), screen.name(), viewport, root);
    }

    /// `device` picks a preset; explicit `width`/`height` override it.
    private Viewport viewport(List<Property> params, IrPath path) {
        Viewport base = Viewport.DEFAULT;
        Integer width = null;
        Integer height = null;
        for (final var param : params) {
            final IrPath at = path.field(param.key());
            switch (param.key()) {
                case "device" -> {
                    final String device = param.value().asString();
                    final var preset = DevicePreset.named(device);
                    if (preset.isPresent()) {
                        base = preset.get().viewport();
                    } else {
                        error(at, "unknown device '" + device + "'; expected mobile, tablet, desktop, print or a4");
                    }
                }
                case "width" -> width = dimension(param, at);
                case "height" -> height = dimension(param, at);
                default -> error(at, "unknown screen parameter '" + param.key() + "'; expected device, width or height");
            }
        }
        return new Viewport(width != null ? width : base.width(), height != null ? height : base.height());
    }

    private Integer dimension(Property param, IrPath at) {
        if (param.value() instanceof WireAst.Number number && number.isIntegral() && number.value() > 0) {
            return (int) number.value();
        }
        error(at, "must be a positive whole number but was '" + param.value().asString() + "'");
        return null;
    }

    // ---------------------------------------------------------------- nodes

    private String container(Layout layout, Scope scope) {
        final List<Property> declared = bind(layout.params(), scope);
        final LayoutDefinition definition = layoutDefinitions.get(layout.layoutType());
        if (definition != null) {
            return expandLayout(definition, declared, layout.children(), scope);
        }

        final String id = ids.next();
        final IrPath path = IrPath.node(id);

        final ContainerType type = DesignTokens.parse(ContainerType.class, layout.layoutType()).orElseGet(() -> {
            error(path.field("containerType"), "unknown layout type '" + layout.layoutType()
                + "'; expected stack, grid, split, panel, card or a defined layout");
            return ContainerType.STACK;
        });

        final var children = new ArrayList<String>();
        for (final LayoutChild child : layout.children()) {
            child(child, scope, path).ifPresent(children::add);
        }

        final var params = new LinkedHashMap<String, IrValue>();
        final IrStyle style = partition(declared, params, path);
        nodes.put(id, new IrNode.Container(id, type, params, children, style, Map.of()));
        LOG.finer(() -> id + ": " + type.token() + " with " + children.size() + " child(ren)");
        return id;
    }

    private String cell(Cell cell, Scope scope) {
        final String id = ids.next();
        final IrPath path = IrPath.node(id);
        final var children = new ArrayList<String>();
        for (final CellChild child : cell.children()) {
            child(child, scope, path).ifPresent(children::add);
        }
        final var params = new LinkedHashMap<String, IrValue>();
        final IrStyle style = partition(bind(cell.props(), scope), params, path);
        nodes.put(id, new IrNode.Container(id, ContainerType.STACK, params, children, style,
            Map.of("source", IrNode.CELL_SOURCE)));
        LOG.finer(() -> id + ": cell with " + children.size() + " child(ren)");
        return id;
    }

    /// Empty when the component is a `Children` slot with nothing to put in it.
    private Optional<String> component(WireAst.Component component, Scope scope, IrPath parent) {
        if (CHILDREN.equals(component.componentType())) {
            return slot(scope, parent);
        }
        final List<Property> declared = bind(component.props(), scope);
        final ComponentDefinition definition = componentDefinitions.get(component.componentType());
        if (definition != null) {
            return expandComponent(definition, declared, scope, parent);
        }

        final String id = ids.next();
        final var props = new LinkedHashMap<String, IrValue>();
        for (final var prop : declared) {
            props.put(prop.key(), value(prop.value()));
        }
        nodes.put(id, new IrNode.Component(id, component.componentType(), props, IrStyle.EMPTY, Map.of()));
        LOG.finer(() -> id + ": " + component.componentType());
        return Optional.of(id);
    }

    private Optional<String> child(LayoutChild child, Scope scope, IrPath parent) {
        if (child instanceof Layout layout) {
            return Optional.of(container(layout, scope));
        }
        if (child instanceof Cell cell) {
            return Optional.of(cell(cell, scope));
        }
        return component((WireAst.Component) child, scope, parent);
    }

    // ---------------------------------------------------------------- definitions

    private Optional<String> expandComponent(ComponentDefinition definition, List<Property> args, Scope outer,
                                             IrPath parent) {
        final String key = "component " + definition.name();
        if (outer.isExpanding(key)) {
            error(definitionPath(definition.name()), "component '" + definition.name() + "' uses itself");
            return Optional.empty();
        }
        LOG.finer(() -> "Expanding component " + definition.name());
        final var scope = new Scope(key, definition.name(), arguments(args), false, null, outer);
        final Optional<String> id = definition.body() instanceof Layout layout
            ? Optional.of(container(layout, scope))
            : component((WireAst.Component) definition.body(), scope, parent);
        scope.reportUnused();
        return id;
    }

    /// The invocation's single child replaces `component Children` in the body
    /// and keeps the bindings of the scope it was written in. A missing slot is
    /// only reported when the body itself expanded cleanly.
    private String expandLayout(LayoutDefinition definition, List<Property> args, List<LayoutChild> children,
                                Scope outer) {
        final IrPath at = definitionPath(definition.name());
        if (children.size() != 1) {
            error(at, "layout '" + definition.name() + "' expects exactly one child but got " + children.size());
        }
        final String key = "layout " + definition.name();
        if (outer.isExpanding(key)) {
            error(at, "layout '" + definition.name() + "' uses itself");
            return placeholder();
        }
        LOG.finer(() -> "Expanding layout " + definition.name());
        final LayoutChild slot = children.isEmpty() ? null : children.get(0);
        final var scope = new Scope(key, definition.name(), arguments(args), true, slot, outer);
        final int reported = errors.size();
        final String id = container(definition.body(), scope);
        if (slot != null && !scope.slotUsed && errors.size() == reported) {
            error(at, "layout '" + definition.name() + "' has no 'Children' slot for the child it was given");
        }
        scope.reportUnused();
        return id;
    }

    private Optional<String> slot(Scope scope, IrPath parent) {
        if (!scope.slotAllowed) {
            error(scope.isTop() ? parent.field("children") : definitionPath(scope.definition),
                "'Children' can only be used inside a define Layout body");
            return Optional.empty();
        }
        scope.slotUsed = true;
        if (scope.slot == null) {
            return Optional.empty();
        }
        return child(scope.slot, scope.enclosing, parent);
    }

    /// Replaces `prop_name` values with the argument `name` of the enclosing
    /// definition. A binding with no argument drops the property.
    private static List<Property> bind(List<Property> declared, Scope scope) {
        if (scope.isTop()) {
            return declared;
        }
        final var bound = new ArrayList<Property>();
        for (final var property : declared) {
            final WireAst.PropertyValue value = property.value();
            if (value instanceof WireAst.Number || !value.asString().startsWith(BINDING_PREFIX)) {
                bound.add(property);
                continue;
            }
            final String arg = value.asString().substring(BINDING_PREFIX.length());
            final WireAst.PropertyValue supplied = scope.args.get(arg);
            if (supplied == null) {
                LOG.warning(() -> "'" + property.key() + "' omitted while expanding '" + scope.definition
                    + "': no argument '" + arg + "'");
                continue;
            }
            scope.used.add(arg);
            bound.add(new Property(property.key(), supplied, property.range()));
        }
        return bound;
    }

    private static Map<String, WireAst.PropertyValue> arguments(List<Property> args) {
        final var map = new LinkedHashMap<String, WireAst.PropertyValue>();
        for (final var arg : args) {
            map.put(arg.key(), arg.value());
        }
        return map;
    }

    /// Stand-in for a layout that could not be expanded; the document is rejected anyway.
    private String placeholder() {
        final String id = ids.next();
        nodes.put(id, new IrNode.Container(id, ContainerType.STACK, Map.of(), List.of(),
            IrStyle.EMPTY.withPadding(SpacingToken.NONE), Map.of()));
        return id;
    }

    private static IrPath definitionPath(String name) {
        return IrPath.root().field("definitions").field(name);
    }

    /// Arguments and `Children` slot of the definition being expanded; the
    /// top-level scope has neither. `enclosing` is the scope the definition was
    /// used in, so the chain lists every expansion in progress at this point.
    /// A slot child is converted in the enclosing scope.
    private static final class Scope {
        final String key;
        final String definition;
        final Map<String, WireAst.PropertyValue> args;
        final boolean slotAllowed;
        final LayoutChild slot;
        final Scope enclosing;
        final Set<String> used = new HashSet<>();
        boolean slotUsed;

        Scope(String key, String definition, Map<String, WireAst.PropertyValue> args, boolean slotAllowed,
              LayoutChild slot, Scope enclosing) {
            this.key = key;
            this.definition = definition;
            this.args = args;
            this.slotAllowed = slotAllowed;
            this.slot = slot;
            this.enclosing = enclosing;
        }

        static Scope top() {
            return new Scope(null, null, Map.of(), false, null, null);
        }

        boolean isTop() {
            return definition == null;
        }

        boolean isExpanding(String candidate) {
            for (Scope scope = this; scope != null; scope = scope.enclosing) {
                if (candidate.equals(scope.key)) {
                    return true;
                }
            }
            return false;
        }

        void reportUnused() {
            for (final String arg : args.keySet()) {
                if (!used.contains(arg)) {
                    LOG.warning(() -> "Argument '" + arg + "' is not used by '" + definition + "'");
                }
            }
        }
    }

    /// Splits declared params: style keys go to the returned [IrStyle], the rest
    /// into `params`. Padding defaults to `none`.
    private IrStyle partition(List<Property> declared, Map<String, IrValue> params, IrPath path) {
        IrStyle style = IrStyle.EMPTY.withPadding(SpacingToken.NONE);
        final IrPath stylePath = path.field("style");
        for (final var property : declared) {
            final String value = property.value().asString();
            switch (property.key()) {
                case PADDING -> {
                    final var parsed = token(SpacingToken.class, value, stylePath.field(PADDING));
                    if (parsed.isPresent()) {
                        style = style.withPadding(parsed.get());
                    }
                }
                case GAP -> {
                    final var parsed = token(SpacingToken.class, value, stylePath.field(GAP));
                    if (parsed.isPresent()) {
                        style = style.withGap(parsed.get());
                    }
                }
                case ALIGN -> {
                    final var parsed = token(Alignment.class, value, stylePath.field(ALIGN));
                    if (parsed.isPresent()) {
                        style = style.withAlign(parsed.get());
                    }
                }
                case JUSTIFY -> {
                    final var parsed = token(Justify.class, value, stylePath.field(JUSTIFY));
                    if (parsed.isPresent()) {
                        style = style.withJustify(parsed.get());
                    }
                }
                default -> params.put(property.key(), value(property.value()));
            }
        }
        return style;
    }

    private static IrValue value(WireAst.PropertyValue value) {
        if (value instanceof WireAst.Number number) {
            return IrValue.of(number.value());
        }
        return IrValue.of(value.asString());
    }

    /// Lower-case, whitespace runs to `_`, anything outside `[a-z0-9_]` dropped.
    static String sanitizeId(String name) {
        return name.toLowerCase(Locale.ROOT)
            .replaceAll("\\s+", "_")
            .replaceAll("[^a-z0-9_]", "");
    }

    private void error(IrPath path, String message) {
        LOG.finer(() -> "IR error at " + path + ": " + message);
        errors.add(new IrValidationError(path.value(), message));
    }
}

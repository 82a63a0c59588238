package wire.dsl.parser;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Abstract syntax tree of a wire source file.
///
/// The tree mirrors the written grammar:
/// ```
/// project "Name" {
///   tokens density: compact
///   mocks { status: "Active,Paused" }
///   colors { primary: #3B82F6 }
///   screen Main(device: mobile) {
///     layout grid(columns: 12, gap: md) {
///       cell span: 4 { component Button text: "Go" }
///     }
///   }
/// }
/// ```
/// Reusable pieces are declared at project level:
/// ```
/// define Component "Metric" { layout card { component StatCard title: prop_label } }
/// define Layout "Shell" { layout split(sidebar: 240) { component SidebarMenu component Children } }
/// ```
/// Every node carries the [SourceRange] of the text it was built from.
public sealed interface WireAst {

    SourceRange range();

    /// Root of a parsed file. Declarations and definitions keep source order.
    record Project(String name, List<Property> tokens, List<Property> mocks, List<Property> colors,
                   List<ComponentDefinition> components, List<LayoutDefinition> layouts,
                   List<Screen> screens, SourceRange range) implements WireAst {
        public Project {
            Objects.requireNonNull(name, "name must not be null");
            tokens = List.copyOf(tokens);
            mocks = List.copyOf(mocks);
            colors = List.copyOf(colors);
            components = List.copyOf(components);
            layouts = List.copyOf(layouts);
            screens = List.copyOf(screens);
            Objects.requireNonNull(range, "range must not be null");
        }
    }

    /// `define Component "Name" { layout ... }` or `define Component "Name" { component ... }`.
    /// Used as `component Name key: value`; the body refers to those values as `prop_key`.
    record ComponentDefinition(String name, CellChild body, SourceRange range) implements WireAst {
        public ComponentDefinition {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(body, "body must not be null");
            Objects.requireNonNull(range, "range must not be null");
        }
    }

    /// `define Layout "Name" { layout ... }`. Used as `layout Name(key: value) { child }`;
    /// the single child takes the place of `component Children` in the body.
    record LayoutDefinition(String name, Layout body, SourceRange range) implements WireAst {
        public LayoutDefinition {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(body, "body must not be null");
            Objects.requireNonNull(range, "range must not be null");
        }
    }

    /// `screen Name(params) { layout ... }` holding exactly one root layout.
    record Screen(String name, List<Property> params, Layout root, SourceRange range) implements WireAst {
        public Screen {
            Objects.requireNonNull(name, "name must not be null");
            params = List.copyOf(params);
            Objects.requireNonNull(root, "root must not be null");
            Objects.requireNonNull(range, "range must not be null");
        }
    }

    /// Anything that may appear in a layout body.
    sealed interface LayoutChild extends WireAst permits CellChild, Cell {}

    /// Anything that may appear in a cell body (and therefore in any layout body).
    sealed interface CellChild extends LayoutChild permits Layout, Component {}

    /// `layout type(params) { children }`. The type is kept as written; the IR
    /// generator decides whether it names a known container.
    record Layout(String layoutType, List<Property> params, List<LayoutChild> children,
                  SourceRange range) implements CellChild {
        public Layout {
            Objects.requireNonNull(layoutType, "layoutType must not be null");
            params = List.copyOf(params);
            children = List.copyOf(children);
            Objects.requireNonNull(range, "range must not be null");
        }

        public Optional<PropertyValue> param(String key) {
            return lookup(params, key);
        }
    }

    /// `cell key: value ... { children }`; only legal directly inside a grid layout.
    record Cell(List<Property> props, List<CellChild> children, SourceRange range) implements LayoutChild {
        public Cell {
            props = List.copyOf(props);
            children = List.copyOf(children);
            Objects.requireNonNull(range, "range must not be null");
        }

        public Optional<PropertyValue> prop(String key) {
            return lookup(props, key);
        }
    }

    /// `component Type key: value ...`
    record Component(String componentType, List<Property> props, SourceRange range) implements CellChild {
        public Component {
            Objects.requireNonNull(componentType, "componentType must not be null");
            props = List.copyOf(props);
            Objects.requireNonNull(range, "range must not be null");
        }

        public Optional<PropertyValue> prop(String key) {
            return lookup(props, key);
        }
    }

    /// A `key: value` pair. Used for layout params, cell and component props,
    /// token declarations, mock entries and color entries.
    record Property(String key, PropertyValue value, SourceRange range) implements WireAst {
        public Property {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(range, "range must not be null");
        }
    }

    /// Literal on the right-hand side of a property.
    sealed interface PropertyValue permits Text, Number, Identifier, HexColor {

        /// The value as it should appear in string-typed contexts.
        String asString();
    }

    /// A double-quoted string, unescaped.
    record Text(String value) implements PropertyValue {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String asString() {
            return value;
        }
    }

    /// A numeric literal such as `4` or `1.5`.
    record Number(double value) implements PropertyValue {
        public boolean isIntegral() {
            return value == Math.rint(value) && !Double.isInfinite(value);
        }

        @Override
        public String asString() {
            return isIntegral() ? Long.toString((long) value) : Double.toString(value);
        }
    }

    /// A bare word such as `vertical` or `md`.
    record Identifier(String name) implements PropertyValue {
        public Identifier {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String asString() {
            return name;
        }
    }

    /// `#RRGGBB`, only produced inside a `colors` block.
    record HexColor(String hex) implements PropertyValue {
        public HexColor {
            Objects.requireNonNull(hex, "hex must not be null");
        }

        @Override
        public String asString() {
            return hex;
        }
    }

    /// Last declaration wins, matching how duplicate keys collapse in the IR.
    private static Optional<PropertyValue> lookup(List<Property> properties, String key) {
        PropertyValue found = null;
        for (final var property : properties) {
            if (property.key().equals(key)) {
                found = property.value();
            }
        }
        return Optional.ofNullable(found);
    }
}

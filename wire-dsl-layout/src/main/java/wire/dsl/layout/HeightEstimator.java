package wire.dsl.layout;

import wire.dsl.ir.Alignment;
import wire.dsl.ir.ContainerType;
import wire.dsl.ir.IrNode;
import wire.dsl.ir.IrProject;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/// Content-driven height of any node at a given width, plus the slot geometry
/// that both measuring and positioning derive from.
///
/// Heights per container, with padding `p` and gap `g`:
/// - vertical stack, card, cell: `2p + sum(h) + g(n-1)`
/// - horizontal stack: `2p + max(h)`, each child measured at its slot width
/// - grid: `2p + sum(rowHeight) + g(rows-1)`, each cell measured at its span width
/// - split: `2p + max(h(sidebar), h(main))`
/// - panel: `2p + h(child)`
///
/// Nothing is cached; node ids are only meaningful within one document.
final class HeightEstimator {

    static final int DEFAULT_COLUMNS = 12;
    static final double DEFAULT_SIDEBAR = 260;

    private final Map<String, IrNode> nodes;
    private final Spacing spacing;
    private final ComponentMetrics metrics;
    private final Set<String> measuring = new HashSet<>();

    HeightEstimator(IrProject project, Spacing spacing, ComponentMetrics metrics) {
        this.nodes = project.nodes();
        this.spacing = spacing;
        this.metrics = metrics;
    }

    /// Resolves a reference.
    /// @throws WireLayoutException if no node has this id
    IrNode node(String id) {
        final IrNode node = nodes.get(id);
        if (node == null) {
            throw new WireLayoutException(id, "Reference to unknown node '" + id + "'");
        }
        return node;
    }

    double measureHeight(String id, double availableWidth) {
        final IrNode node = node(id);
        if (!measuring.add(id)) {
            throw new WireLayoutException(id, "Reference cycle through node '" + id + "'");
        }
        try {
            if (node instanceof IrNode.Container container) {
                return containerHeight(container, availableWidth);
            }
            return metrics.height((IrNode.Component) node, availableWidth);
        } finally {
            measuring.remove(id);
        }
    }

    private double containerHeight(IrNode.Container container, double width) {
        final int padding = spacing.padding(container.style());
        final int gap = spacing.gap(container.style());
        final double inner = width - 2.0 * padding;
        final List<String> children = container.children();
        if (children.isEmpty()) {
            return 2.0 * padding;
        }

        final double content = switch (container.containerType()) {
            case STACK -> isHorizontal(container)
                ? tallest(children, slotWidths(container, inner, gap))
                : stacked(children, inner, gap);
            case CARD -> stacked(children, inner, gap);
            case GRID -> gridPlan(container, inner, gap).contentHeight();
            case SPLIT -> tallest(splitChildren(children), splitWidths(container, inner, gap));
            case PANEL -> measureHeight(children.get(0), inner);
        };
        return 2.0 * padding + content;
    }

    private double stacked(List<String> children, double width, int gap) {
        double total = 0;
        for (final String child : children) {
            total += measureHeight(child, width);
        }
        return total + (double) gap * (children.size() - 1);
    }

    private double tallest(List<String> children, double[] widths) {
        double max = 0;
        for (int i = 0; i < children.size(); i++) {
            max = Math.max(max, measureHeight(children.get(i), widths[i]));
        }
        return max;
    }

    // ---------------------------------------------------------------- shared geometry

    static boolean isHorizontal(IrNode.Container container) {
        return container.containerType() == ContainerType.STACK
            && container.param("direction").map(value -> "horizontal".equals(value.asString())).orElse(false);
    }

    /// Widths of the children of a horizontal stack.
    ///
    /// With `align: justify` (the default) the inner width is shared: components
    /// with an explicit `width` keep it, the rest split what remains equally.
    /// With `left`, `center` or `right` every child keeps its intrinsic width.
    double[] slotWidths(IrNode.Container container, double inner, int gap) {
        final List<String> children = container.children();
        final int count = children.size();
        final double[] widths = new double[count];
        final boolean aligned = isAligned(container);

        double fixed = 0;
        int flexible = 0;
        for (int i = 0; i < count; i++) {
            final IrNode child = node(children.get(i));
            if (aligned) {
                widths[i] = metrics.intrinsicWidth(child);
                continue;
            }
            final OptionalDouble explicit = child instanceof IrNode.Component component
                ? ComponentMetrics.explicitWidth(component) : OptionalDouble.empty();
            if (explicit.isPresent()) {
                widths[i] = explicit.getAsDouble();
                fixed += widths[i];
            } else {
                widths[i] = -1;
                flexible++;
            }
        }
        if (!aligned && flexible > 0) {
            final double share = (inner - (double) gap * (count - 1) - fixed) / flexible;
            for (int i = 0; i < count; i++) {
                if (widths[i] < 0) {
                    widths[i] = share;
                }
            }
        }
        return widths;
    }

    static boolean isAligned(IrNode.Container container) {
        return container.style().alignment().map(align -> align != Alignment.JUSTIFY).orElse(false);
    }

    /// Offset of the first child of an aligned horizontal stack from the inner left edge.
    static double alignmentOffset(Alignment align, double inner, double occupied) {
        return switch (align) {
            case LEFT, JUSTIFY -> 0;
            case CENTER -> (inner - occupied) / 2;
            case RIGHT -> inner - occupied;
        };
    }

    static List<String> splitChildren(List<String> children) {
        return children.size() > 2 ? children.subList(0, 2) : children;
    }

    /// One child takes the whole inner width; two get `sidebar` and the rest.
    static double[] splitWidths(IrNode.Container split, double inner, int gap) {
        if (split.children().size() == 1) {
            return new double[] {inner};
        }
        final double sidebar = sidebar(split);
        return new double[] {sidebar, inner - sidebar - gap};
    }

    static double sidebar(IrNode.Container split) {
        final OptionalDouble value = split.param("sidebar").map(v -> v.asNumber()).orElse(OptionalDouble.empty());
        return value.isPresent() && value.getAsDouble() > 0 ? value.getAsDouble() : DEFAULT_SIDEBAR;
    }

    static int columns(IrNode.Container grid) {
        return wholeParam(grid, "columns", DEFAULT_COLUMNS);
    }

    /// Columns a grid child occupies: a cell's `span`, clamped to the grid; 1 for anything else.
    static int span(IrNode child, int columns) {
        if (child instanceof IrNode.Container container && container.isCell()) {
            return Math.min(wholeParam(container, "span", 1), columns);
        }
        return 1;
    }

    private static int wholeParam(IrNode.Container container, String key, int fallback) {
        final OptionalDouble value = container.param(key).map(v -> v.asNumber()).orElse(OptionalDouble.empty());
        if (value.isEmpty() || value.getAsDouble() < 1) {
            return fallback;
        }
        return (int) Math.floor(value.getAsDouble());
    }

    /// Row and column assignment of a grid's children with their measured
    /// heights. A child wraps to a new row when its span would overflow the
    /// current one.
    GridPlan gridPlan(IrNode.Container grid, double inner, int gap) {
        final int columns = columns(grid);
        final double columnWidth = (inner - (double) gap * (columns - 1)) / columns;
        final var cells = new ArrayList<GridCell>();
        final var rowHeights = new ArrayList<Double>();

        int row = 0;
        int column = 0;
        for (final String id : grid.children()) {
            final int span = span(node(id), columns);
            if (column + span > columns) {
                row++;
                column = 0;
            }
            final double width = columnWidth * span + (double) gap * (span - 1);
            final double height = measureHeight(id, width);
            if (rowHeights.size() <= row) {
                rowHeights.add(height);
            } else {
                rowHeights.set(row, Math.max(rowHeights.get(row), height));
            }
            cells.add(new GridCell(id, row, column, span, width));
            column += span;
        }
        return new GridPlan(columnWidth, gap, cells, rowHeights);
    }

    record GridCell(String id, int row, int column, int span, double width) {
    }

    record GridPlan(double columnWidth, int gap, List<GridCell> cells, List<Double> rowHeights) {
        GridPlan {
            cells = List.copyOf(cells);
            rowHeights = List.copyOf(rowHeights);
        }

        /// Distance from the grid's inner top to the top of a row.
        double rowOffset(int row) {
            double offset = 0;
            for (int r = 0; r < row; r++) {
                offset += rowHeights.get(r) + gap;
            }
            return offset;
        }

        /// Distance from the grid's inner left edge to a column.
        double columnOffset(int column) {
            return column * (columnWidth + gap);
        }

        double contentHeight() {
            if (rowHeights.isEmpty()) {
                return 0;
            }
            return rowOffset(rowHeights.size() - 1) + rowHeights.get(rowHeights.size() - 1);
        }
    }
}

package wire.dsl.layout;

import wire.dsl.ir.IrDocument;
import wire.dsl.ir.IrNode;
import wire.dsl.ir.IrProject;
import wire.dsl.ir.IrScreen;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Computes absolute geometry for every node of an [IrDocument].
///
/// Each screen root starts at `(0, 0)` with the screen's viewport as its slot.
/// Containers subtract their padding on all four sides and hand slots to their
/// children:
///
/// - vertical stack, card, cell: children top to bottom at full inner width;
///   the container's height is `last.bottom + padding - y`, so it grows with its
///   content and is never clipped to the incoming slot
/// - horizontal stack: children left to right (see [HeightEstimator#slotWidths]),
///   all given the height of the tallest
/// - grid: cells in rows of `columns` (default 12), each row as tall as its
///   tallest cell, cells stretched to the row
/// - split: a `sidebar` (default 260) and a main area after `gap`; a lone child
///   takes the whole width
/// - panel: one child inset by padding
///
/// Components take the slot height offered to them and their explicit `width`
/// when they declare one.
public final class LayoutEngine {

    private static final Logger LOG = Logger.getLogger(LayoutEngine.class.getName());

    private final Spacing spacing;
    private final HeightEstimator heights;
    private final Map<String, Box> boxes = new LinkedHashMap<>();
    private final Set<String> placed = new HashSet<>();

    private LayoutEngine(IrProject project) {
        this.spacing = new Spacing(project.tokens());
        this.heights = new HeightEstimator(project, spacing, new ComponentMetrics(project.tokens().density()));
    }

    /// Lays out every screen of a document.
    /// @param document generated (or hand-built) IR
    /// @return boxes for all nodes reachable from the screen roots
    /// @throws WireLayoutException on a reference to a missing node, or a node reached twice
    public static LayoutResult calculate(IrDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        final IrProject project = document.project();
        LOG.fine(() -> "Laying out " + project.screens().size() + " screen(s) of project '" + project.name() + "'");
        final var engine = new LayoutEngine(project);
        for (final IrScreen screen : project.screens()) {
            final var viewport = screen.viewport();
            engine.place(screen.root(), 0, 0, viewport.width(), viewport.height());
            LOG.finer(() -> "Screen " + screen.id() + " root " + screen.root() + " -> " + engine.boxes.get(screen.root()));
        }
        LOG.fine(() -> "Layout computed for " + engine.boxes.size() + " node(s)");
        return new LayoutResult(engine.boxes);
    }

    private Box place(String id, double x, double y, double width, double height) {
        final IrNode node = heights.node(id);
        if (!placed.add(id)) {
            throw new WireLayoutException(id, "Node '" + id + "' is reached more than once; references must form a tree");
        }
        if (node instanceof IrNode.Container container) {
            return placeContainer(container, x, y, width, height);
        }
        final var component = (IrNode.Component) node;
        final double actualWidth = ComponentMetrics.explicitWidth(component).orElse(width);
        return store(id, new Box(x, y, actualWidth, height));
    }

    private Box placeContainer(IrNode.Container container, double x, double y, double width, double height) {
        final int padding = spacing.padding(container.style());
        final int gap = spacing.gap(container.style());
        final double innerX = x + padding;
        final double innerY = y + padding;
        final double innerWidth = width - 2.0 * padding;

        // parents precede children in the result
        store(container.id(), new Box(x, y, width, height));

        final double actualHeight = switch (container.containerType()) {
            case STACK -> HeightEstimator.isHorizontal(container)
                ? 2.0 * padding + horizontal(container, innerX, innerY, innerWidth, gap)
                : vertical(container, innerX, innerY, innerWidth, gap, y, padding);
            case CARD -> vertical(container, innerX, innerY, innerWidth, gap, y, padding);
            case GRID -> 2.0 * padding + grid(container, innerX, innerY, innerWidth, gap);
            case SPLIT -> {
                split(container, innerX, innerY, innerWidth, height - 2.0 * padding, gap);
                yield height;
            }
            case PANEL -> 2.0 * padding + panel(container, innerX, innerY, innerWidth);
        };
        LOG.finer(() -> container.id() + " " + container.containerType().token() + " height " + actualHeight);
        return store(container.id(), new Box(x, y, width, actualHeight));
    }

    /// Places children top to bottom; returns the container's own height.
    private double vertical(IrNode.Container stack, double x, double y, double width, int gap,
                            double top, int padding) {
        final List<String> children = stack.children();
        if (children.isEmpty()) {
            return 2.0 * padding;
        }
        double cursor = y;
        double bottom = y;
        for (final String child : children) {
            final double hint = heights.measureHeight(child, width);
            bottom = place(child, x, cursor, width, hint).bottom();
            cursor = bottom + gap;
        }
        return bottom + padding - top;
    }

    /// Places children left to right; returns the shared content height.
    private double horizontal(IrNode.Container stack, double x, double y, double width, int gap) {
        final List<String> children = stack.children();
        if (children.isEmpty()) {
            return 0;
        }
        final double[] widths = heights.slotWidths(stack, width, gap);
        double tallest = 0;
        double occupied = (double) gap * (children.size() - 1);
        for (int i = 0; i < children.size(); i++) {
            tallest = Math.max(tallest, heights.measureHeight(children.get(i), widths[i]));
            occupied += widths[i];
        }
        final double total = occupied;
        double cursor = x + stack.style().alignment()
            .map(align -> HeightEstimator.alignmentOffset(align, width, total))
            .orElse(0.0);
        for (int i = 0; i < children.size(); i++) {
            place(children.get(i), cursor, y, widths[i], tallest);
            cursor += widths[i] + gap;
        }
        return tallest;
    }

    /// Measures, assigns rows, then positions; returns the content height.
    private double grid(IrNode.Container grid, double x, double y, double width, int gap) {
        final var plan = heights.gridPlan(grid, width, gap);
        for (final var cell : plan.cells()) {
            final double rowHeight = plan.rowHeights().get(cell.row());
            final Box box = place(cell.id(), x + plan.columnOffset(cell.column()), y + plan.rowOffset(cell.row()),
                cell.width(), rowHeight);
            store(cell.id(), box.withHeight(rowHeight));
        }
        return plan.contentHeight();
    }

    private void split(IrNode.Container split, double x, double y, double width, double height, int gap) {
        final List<String> children = split.children();
        if (children.isEmpty()) {
            return;
        }
        if (children.size() == 1) {
            LOG.warning(() -> "Split " + split.id() + " has a single child; giving it the full width");
        } else if (children.size() > 2) {
            LOG.warning(() -> "Split " + split.id() + " has " + children.size() + " children; only the first two are laid out");
        }
        final double[] widths = HeightEstimator.splitWidths(split, width, gap);
        final List<String> laidOut = HeightEstimator.splitChildren(children);
        double cursor = x;
        for (int i = 0; i < laidOut.size(); i++) {
            final String child = laidOut.get(i);
            final double slotHeight = heights.node(child) instanceof IrNode.Container
                ? height
                : heights.measureHeight(child, widths[i]);
            place(child, cursor, y, widths[i], slotHeight);
            cursor += widths[i] + gap;
        }
    }

    /// Places the single child; returns its height.
    private double panel(IrNode.Container panel, double x, double y, double width) {
        final List<String> children = panel.children();
        if (children.isEmpty()) {
            return 0;
        }
        if (children.size() > 1) {
            LOG.warning(() -> "Panel " + panel.id() + " has " + children.size() + " children; only the first is laid out");
        }
        final String child = children.get(0);
        return place(child, x, y, width, heights.measureHeight(child, width)).height();
    }

    private Box store(String id, Box box) {
        boxes.put(id, box);
        return box;
    }
}

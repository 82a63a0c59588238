package wire.dsl.layout;

import wire.dsl.ir.Density;
import wire.dsl.ir.DesignTokens;
import wire.dsl.ir.IrNode;
import wire.dsl.ir.IrValue;
import wire.dsl.ir.SpacingToken;

import java.util.OptionalDouble;

/// Intrinsic sizes of leaf components.
///
/// Height, in priority order: an explicit positive `height` prop; a
/// type-specific rule (Table rows, Image aspect ratio, wrapped Heading/Text/Alert,
/// SidebarMenu items, Separate size, fixed heights for a handful of tall
/// widgets); otherwise the density row height.
final class ComponentMetrics {

    static final int TABLE_HEADER = 44;
    static final int TABLE_ROW = 36;
    static final int TABLE_TITLE = 32;
    static final int TABLE_PAGINATION = 64;
    static final int TABLE_DEFAULT_ROWS = 5;
    static final int SIDEBAR_ITEM = 40;
    static final int ALERT_FONT = 13;
    static final int ALERT_PADDING = 12;
    static final int ALERT_TITLE_GAP = 6;
    static final int CONTAINER_WIDTH = 120;

    /// Width assumed for text wrapping when nothing usable is offered.
    private static final double FALLBACK_TEXT_WIDTH = 200;

    private final Density density;

    ComponentMetrics(Density density) {
        this.density = density;
    }

    /// Default component height for the project's density.
    int rowHeight() {
        return switch (density) {
            case COMPACT -> 32;
            case NORMAL -> 40;
            case COMFORTABLE -> 48;
        };
    }

    /// The `width` prop when it is a positive number.
    static OptionalDouble explicitWidth(IrNode.Component component) {
        return positive(component, "width");
    }

    double height(IrNode.Component component, double availableWidth) {
        final OptionalDouble explicit = positive(component, "height");
        if (explicit.isPresent()) {
            return explicit.getAsDouble();
        }
        final double width = explicitWidth(component).orElse(availableWidth);
        return switch (component.componentType()) {
            case "Table" -> tableHeight(component);
            case "Image" -> width > 0 ? imageHeight(text(component, "placeholder", "landscape"), width) : 200;
            case "Heading" -> wrappedHeight(text(component, "text", "Heading"), width, headingFontSize(), 1.25);
            case "Text" -> wrappedHeight(text(component, "content", ""), width, textFontSize(), textLineHeight());
            case "Alert" -> alertHeight(component, width);
            case "SidebarMenu" -> Math.max(rowHeight(), sidebarItems(component) * SIDEBAR_ITEM);
            case "Separate" -> separateSize(component);
            case "Textarea" -> 100;
            case "Modal" -> 300;
            case "Card", "StatCard" -> 120;
            case "ChartPlaceholder" -> 250;
            case "List" -> 180;
            case "Topbar" -> 56;
            case "Divider" -> 1;
            default -> rowHeight();
        };
    }

    /// Natural width used by aligned horizontal stacks.
    double intrinsicWidth(IrNode node) {
        if (!(node instanceof IrNode.Component component)) {
            return CONTAINER_WIDTH;
        }
        final OptionalDouble explicit = explicitWidth(component);
        if (explicit.isPresent()) {
            return explicit.getAsDouble();
        }
        return switch (component.componentType()) {
            case "Button", "Link" -> Math.max(80, text(component, "text", "").length() * 8 + 32);
            case "Heading" -> Math.max(80, text(component, "text", "").length() * 12 + 16);
            case "Text", "Label" -> {
                final String content = component.prop("content").map(IrValue::asString)
                    .orElseGet(() -> text(component, "text", ""));
                yield Math.max(60, content.length() * 8 + 16);
            }
            case "Badge", "Chip" -> Math.max(50, text(component, "text", "").length() * 7 + 16);
            case "Input", "Select", "Textarea" -> 200;
            case "Checkbox", "Radio" -> 24;
            case "Icon" -> 18;
            case "IconButton" -> 40;
            case "Image" -> switch (text(component, "placeholder", "landscape")) {
                case "portrait", "square" -> 200;
                case "icon", "avatar" -> 64;
                default -> 300;
            };
            case "Table" -> 400;
            case "Card", "StatCard" -> 280;
            case "SidebarMenu" -> 260;
            case "Separate" -> separateSize(component);
            default -> CONTAINER_WIDTH;
        };
    }

    /// A missing, zero or non-numeric `rows` prop means five rows.
    private double tableHeight(IrNode.Component table) {
        final double rows = positive(table, "rows").orElse(TABLE_DEFAULT_ROWS);
        final boolean hasTitle = !text(table, "title", "").isEmpty();
        final boolean hasPagination = "true".equals(text(table, "pagination", ""));
        return (hasTitle ? TABLE_TITLE : 0) + TABLE_HEADER + rows * TABLE_ROW + (hasPagination ? TABLE_PAGINATION : 0);
    }

    /// Height of an image placeholder of the given width: landscape 16:9
    /// (also for unknown placeholders), portrait 2:3, square/icon/avatar 1:1.
    static double imageHeight(String placeholder, double width) {
        return switch (placeholder) {
            case "portrait" -> width * 3 / 2;
            case "square", "icon", "avatar" -> width;
            default -> width * 9 / 16;
        };
    }

    /// Padded box holding an optional bold title over the message, both wrapped
    /// at the available width less 24px of horizontal padding.
    private double alertHeight(IrNode.Component alert, double availableWidth) {
        final String title = text(alert, "title", "");
        final String message = text(alert, "text", "Alert message");
        final double maxWidth = Math.max(40, (availableWidth > 0 ? availableWidth : 280) - 2 * ALERT_PADDING);
        final int titleLines = title.isBlank() ? 0 : lineCount(title, maxWidth, ALERT_FONT);
        final int messageLines = lineCount(message, maxWidth, ALERT_FONT);
        final double content = ALERT_PADDING
            + titleLines * Math.ceil(ALERT_FONT * 1.25)
            + (titleLines > 0 ? ALERT_TITLE_GAP : 0)
            + messageLines * Math.ceil(ALERT_FONT * 1.4)
            + ALERT_PADDING;
        return Math.max(rowHeight(), content);
    }

    /// Spacer extent: a numeric `size` as is, otherwise a spacing token
    /// (`md` when absent or unknown) scaled by density.
    private double separateSize(IrNode.Component separator) {
        final var size = separator.prop("size");
        if (size.isPresent() && size.get() instanceof IrValue.Number number) {
            return Math.max(0, number.value());
        }
        final SpacingToken token = size.flatMap(value -> DesignTokens.parse(SpacingToken.class, value.asString()))
            .orElse(SpacingToken.MD);
        return Math.round(token.pixels() * densityFactor());
    }

    private double densityFactor() {
        return switch (density) {
            case COMPACT -> 0.8;
            case NORMAL -> 1.0;
            case COMFORTABLE -> 1.25;
        };
    }

    private static int sidebarItems(IrNode.Component menu) {
        int count = 0;
        for (final String item : text(menu, "items", "Item 1,Item 2,Item 3").split(",")) {
            if (!item.isBlank()) {
                count++;
            }
        }
        return count > 0 ? count : 3;
    }

    private double wrappedHeight(String text, double availableWidth, int fontSize, double lineHeight) {
        final double lineHeightPx = Math.ceil(fontSize * lineHeight);
        final double maxWidth = availableWidth > 0 ? availableWidth : FALLBACK_TEXT_WIDTH;
        final int lines = lineCount(text, maxWidth, fontSize);
        return Math.max(rowHeight(), Math.max(1, lines) * lineHeightPx);
    }

    /// Greedy word wrap with an average glyph width of 0.6em. Words longer than
    /// a line are broken into line-sized pieces, each on its own line; blank paragraphs count as one line.
    static int lineCount(String text, double maxWidth, int fontSize) {
        final double charWidth = fontSize * 0.6;
        final int maxChars = Math.max(1, (int) Math.floor(Math.max(maxWidth, charWidth) / charWidth));
        int lines = 0;
        for (final String paragraph : text.replace("\r\n", "\n").split("\n", -1)) {
            if (paragraph.isBlank()) {
                lines++;
                continue;
            }
            int current = 0;
            for (final String word : paragraph.trim().split("\\s+")) {
                final int candidate = current == 0 ? word.length() : current + 1 + word.length();
                if (candidate <= maxChars) {
                    current = candidate;
                    continue;
                }
                if (current > 0) {
                    lines++;
                    current = 0;
                }
                if (word.length() <= maxChars) {
                    current = word.length();
                } else {
                    lines += (word.length() + maxChars - 1) / maxChars;
                }
            }
            if (current > 0) {
                lines++;
            }
        }
        return Math.max(1, lines);
    }

    private int textFontSize() {
        return switch (density) {
            case COMPACT -> 12;
            case NORMAL -> 14;
            case COMFORTABLE -> 16;
        };
    }

    private double textLineHeight() {
        return switch (density) {
            case COMPACT -> 1.4;
            case NORMAL -> 1.5;
            case COMFORTABLE -> 1.6;
        };
    }

    private int headingFontSize() {
        return switch (density) {
            case COMPACT -> 16;
            case NORMAL -> 20;
            case COMFORTABLE -> 24;
        };
    }

    private static String text(IrNode.Component component, String key, String fallback) {
        return component.prop(key).map(IrValue::asString).orElse(fallback);
    }

    private static OptionalDouble positive(IrNode.Component component, String key) {
        final var value = component.prop(key);
        if (value.isEmpty()) {
            return OptionalDouble.empty();
        }
        final OptionalDouble number = value.get().asNumber();
        return number.isPresent() && number.getAsDouble() > 0 ? number : OptionalDouble.empty();
    }
}

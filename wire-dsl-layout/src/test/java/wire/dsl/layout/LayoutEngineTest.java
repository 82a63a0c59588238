package wire.dsl.layout;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import wire.dsl.ir.ContainerType;
import wire.dsl.ir.DesignTokens;
import wire.dsl.ir.IrDocument;
import wire.dsl.ir.IrNode;
import wire.dsl.ir.IrProject;
import wire.dsl.ir.IrScreen;
import wire.dsl.ir.IrStyle;
import wire.dsl.ir.Viewport;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/// Unit tests for LayoutEngine - container algorithms and component sizing
class LayoutEngineTest extends LayoutTestBase {

    // ========== Stacks ==========

    @Test
    void testVerticalStackSumsChildrenGapsAndPadding() {
        final var laid = layRoot("""
            layout stack(gap: md, padding: sm) { component Button text: "A" component Input component Textarea }
            """);

        assertThat(laid.box("node_2")).isEqualTo(new Box(8, 8, 1264, 40));
        assertThat(laid.box("node_3")).isEqualTo(new Box(8, 64, 1264, 40));
        assertThat(laid.box("node_4")).isEqualTo(new Box(8, 120, 1264, 100));
        assertThat(laid.box("node_1")).isEqualTo(new Box(0, 0, 1280, 228));
    }

    @Test
    void testHeadingThenButtonAreSeparatedByGap() {
        final var laid = layRoot("""
            layout stack(direction: vertical, gap: md) { component Heading text: "Hi" component Button text: "Go" }
            """);
        final Box heading = laid.box("node_2");
        final Box button = laid.box("node_3");

        assertThat(laid.layout().size()).isEqualTo(3);
        assertThat(button.y()).isEqualTo(heading.y() + heading.height() + 16);
    }

    @Test
    void testVerticalStackGrowsWithNestedContent() {
        final var laid = layRoot("""
            layout stack(gap: md) {
              layout card(padding: md) { component Text content: "Hello" }
              component Button text: "Go"
            }
            """);

        assertThat(laid.box("node_2").height()).isEqualTo(72);
        assertThat(laid.box("node_3")).isEqualTo(new Box(16, 16, 1248, 40));
        assertThat(laid.box("node_4").y()).isEqualTo(88);
        assertThat(laid.box("node_1").height()).isEqualTo(128);
    }

    @Test
    void testCardIsLaidOutLikeVerticalStack() {
        final var laid = layRoot("""
            layout card(padding: md, gap: sm) { component Button text: "A" component Button text: "B" }
            """);

        assertThat(laid.box("node_2")).isEqualTo(new Box(16, 16, 1248, 40));
        assertThat(laid.box("node_3")).isEqualTo(new Box(16, 64, 1248, 40));
        assertThat(laid.box("node_1").height()).isEqualTo(120);
    }

    @Test
    void testHorizontalStackSharesWidthAndKeepsGap() {
        final var laid = layRoot("""
            layout stack(direction: horizontal, gap: lg) {
              component Button text: "A" component Button text: "B" component Button text: "C"
            }
            """);
        final Box a = laid.box("node_2");
        final Box b = laid.box("node_3");
        final Box c = laid.box("node_4");

        assertThat(a.width()).isCloseTo((1280 - 48) / 3.0, within(EPS));
        assertThat(b.x()).isCloseTo(a.x() + a.width() + 24, within(EPS));
        assertThat(c.x()).isCloseTo(b.x() + b.width() + 24, within(EPS));
        assertThat(c.right()).isCloseTo(1280, within(EPS));
        assertThat(List.of(a.y(), b.y(), c.y())).containsOnly(0.0);
        assertThat(laid.box("node_1").height()).isEqualTo(40);
    }

    @Test
    void testHorizontalChildrenShareTallestHeight() {
        final var laid = layRoot("""
            layout stack(direction: horizontal) { component Button text: "A" component Textarea }
            """);
        assertThat(laid.box("node_2").height()).isEqualTo(100);
        assertThat(laid.box("node_3").height()).isEqualTo(100);
        assertThat(laid.box("node_1").height()).isEqualTo(100);
    }

    @Test
    void testExplicitWidthIsKeptInSharedMode() {
        final var laid = layRoot("""
            layout stack(direction: horizontal, gap: md) {
              component Input width: 300 component Button text: "A" component Button text: "B"
            }
            """);

        assertThat(laid.box("node_2")).isEqualTo(new Box(0, 0, 300, 40));
        assertThat(laid.box("node_3")).isEqualTo(new Box(316, 0, 474, 40));
        assertThat(laid.box("node_4")).isEqualTo(new Box(806, 0, 474, 40));
    }

    @ParameterizedTest
    @CsvSource({"left, 0", "center, 556", "right, 1112"})
    void testAlignedHorizontalStackUsesIntrinsicWidths(String align, double firstX) {
        final var laid = layRoot("layout stack(direction: horizontal, gap: sm, align: " + align + ") {"
            + " component Button text: \"OK\" component Button text: \"Cancel\" }");

        assertThat(laid.box("node_2")).isEqualTo(new Box(firstX, 0, 80, 40));
        assertThat(laid.box("node_3")).isEqualTo(new Box(firstX + 88, 0, 80, 40));
    }

    @Test
    void testJustifyAlignmentSharesTheRow() {
        final String children = " component Button text: \"OK\" component Button text: \"Cancel\" }";
        final var justified = layRoot("layout stack(direction: horizontal, gap: sm, align: justify) {" + children);
        final var unset = layRoot("layout stack(direction: horizontal, gap: sm) {" + children);

        assertThat(justified.box("node_2")).isEqualTo(new Box(0, 0, 636, 40));
        assertThat(justified.box("node_3")).isEqualTo(new Box(644, 0, 636, 40));
        assertThat(justified.layout()).isEqualTo(unset.layout());
    }

    // ========== Grid ==========

    @Test
    void testThreeSpanFourCellsShareOneRow() {
        final var laid = layRoot("""
            layout grid(columns: 12, gap: md) {
              cell span: 4 { component Button text: "A" }
              cell span: 4 { component Button text: "B" }
              cell span: 4 { component Button text: "C" }
            }
            """);
        final Box first = laid.box("node_2");
        final Box second = laid.box("node_4");
        final Box third = laid.box("node_6");

        assertThat(first).isEqualTo(new Box(0, 0, 416, 40));
        assertThat(second).isEqualTo(new Box(432, 0, 416, 40));
        assertThat(third).isEqualTo(new Box(864, 0, 416, 40));
        assertThat(first.right()).isLessThan(second.x());
        assertThat(second.right()).isLessThan(third.x());
        assertThat(laid.box("node_7")).isEqualTo(new Box(864, 0, 416, 40));
    }

    @Test
    void testSpanSixCellsWrapToSecondRow() {
        final var laid = layRoot("""
            layout grid(columns: 12, gap: md) {
              cell span: 6 { component Button text: "A" }
              cell span: 6 { component Button text: "B" }
              cell span: 6 { component Button text: "C" }
            }
            """);

        assertThat(laid.box("node_2").y()).isEqualTo(laid.box("node_4").y());
        assertThat(laid.box("node_4").x()).isEqualTo(648);
        assertThat(laid.box("node_6")).isEqualTo(new Box(0, 56, 632, 40));
        assertThat(laid.box("node_6").y()).isGreaterThan(laid.box("node_2").y());
        assertThat(laid.box("node_1").height()).isEqualTo(96);
    }

    @Test
    void testRowHeightIsTallestCellAndCellsStretch() {
        final var laid = layRoot("""
            layout grid(gap: sm) {
              cell span: 6 { component Button text: "A" }
              cell span: 6 { component Textarea }
            }
            """);

        assertThat(laid.box("node_2").height()).isEqualTo(100);
        assertThat(laid.box("node_3").height()).isEqualTo(40);
        assertThat(laid.box("node_4").height()).isEqualTo(100);
        assertThat(laid.box("node_1").height()).isEqualTo(100);
    }

    @Test
    void testSpanIsClampedToColumns() {
        final var laid = layRoot("layout grid(columns: 4) { cell span: 12 { component Button text: \"Wide\" } }");
        assertThat(laid.box("node_2").width()).isCloseTo(1280, within(EPS));
    }

    // ========== Split and panel ==========

    @Test
    void testSplitGivesSidebarItsDeclaredWidth() {
        final var laid = layRoot("""
            layout split(sidebar: 240, gap: md) {
              component SidebarMenu
              layout stack { component Heading text: "Main" }
            }
            """);

        assertThat(laid.box("node_2")).isEqualTo(new Box(0, 0, 240, 120));
        final Box main = laid.box("node_3");
        assertThat(main.x()).isEqualTo(256);
        assertThat(main.width()).isEqualTo(1024);
        assertThat(laid.box("node_4").x()).isEqualTo(256);
        assertThat(laid.box("node_1")).isEqualTo(new Box(0, 0, 1280, 720));
    }

    @Test
    void testSplitWithOneChildUsesFullWidth() {
        final var laid = layRoot("layout split(sidebar: 240) { component Text content: \"x\" }");
        assertThat(laid.box("node_2")).isEqualTo(new Box(0, 0, 1280, 40));
    }

    @Test
    void testPanelInsetsItsChild() {
        final var laid = layRoot("layout panel(padding: lg) { component Table rows: 8 }");
        assertThat(laid.box("node_2")).isEqualTo(new Box(24, 24, 1232, 332));
        assertThat(laid.box("node_1")).isEqualTo(new Box(0, 0, 1280, 380));
    }

    // ========== Component sizes ==========

    @ParameterizedTest
    @CsvSource({"compact, 32", "normal, 40", "comfortable, 48"})
    void testDensityDrivesDefaultHeight(String density, double height) {
        final var laid = lay("project \"D\" { tokens density: " + density
            + " screen M { layout stack { component Button text: \"Go\" } } }");
        assertThat(laid.box("node_2").height()).isEqualTo(height);
    }

    @Test
    void testTableHeights() {
        final var laid = layRoot("""
            layout stack { component Table rows: 8 component Table rows: 8 title: "Users" pagination: true component Table }
            """);
        assertThat(laid.box("node_2").height()).isEqualTo(332);
        assertThat(laid.box("node_3").height()).isEqualTo(428);
        assertThat(laid.box("node_4").height()).isEqualTo(224);
    }

    @Test
    void testExplicitHeightWins() {
        final var laid = layRoot("layout stack { component Button text: \"Go\" height: 60 component Table rows: 8 height: 90 }");
        assertThat(laid.box("node_2").height()).isEqualTo(60);
        assertThat(laid.box("node_3").height()).isEqualTo(90);
    }

    @Test
    void testImageFollowsAspectRatio() {
        final var laid = layRoot("""
            layout stack {
              component Image
              component Image placeholder: square width: 200
              component Image placeholder: portrait width: 300
            }
            """);
        assertThat(laid.box("node_2").height()).isCloseTo(720, within(EPS));
        assertThat(laid.box("node_3")).isEqualTo(new Box(0, 736, 200, 200));
        assertThat(laid.box("node_4").width()).isEqualTo(300);
        assertThat(laid.box("node_4").height()).isCloseTo(450, within(EPS));
    }

    @Test
    void testLongHeadingWraps() {
        final var laid = layRoot("layout stack { component Heading text: \"Quarterly revenue overview\" width: 120 }");
        assertThat(laid.box("node_2")).isEqualTo(new Box(0, 0, 120, 75));
    }

    @Test
    void testUnsetGapUsesProjectSpacing() {
        final var laid = lay("""
            project "S" { tokens spacing: xl screen M { layout stack { component Button text: "A" component Button text: "B" } } }
            """);
        assertThat(laid.box("node_3").y()).isEqualTo(72);
    }

    // ========== Screens ==========

    @Test
    void testEachScreenUsesItsOwnViewport() {
        final var laid = lay("""
            project "Multi" {
              screen Phone(device: mobile) { layout stack { component Button text: "Go" } }
              screen Desk { layout split { component SidebarMenu component Text content: "Body" } }
            }
            """);

        assertThat(laid.box("node_1").width()).isEqualTo(375);
        assertThat(laid.box("node_2").width()).isEqualTo(375);
        assertThat(laid.box("node_3")).isEqualTo(new Box(0, 0, 1280, 720));
        assertThat(laid.box("node_4").width()).isEqualTo(260);
        assertThat(laid.layout().boxes().keySet()).isEqualTo(laid.ir().project().nodes().keySet());
    }

    @Test
    void testJsonOutput() {
        final var json = layRoot("layout stack { component Button text: \"Go\" }").layout().toJson();
        assertThat(json.get("node_1").get("width").asDouble()).isEqualTo(1280);
        assertThat(json.get("node_2").get("height").asDouble()).isEqualTo(40);
        assertThat(json.fieldNames()).toIterable().containsExactly("node_1", "node_2");
    }

    // ========== Broken references ==========

    private static IrDocument handBuilt(List<IrScreen> screens, Map<String, IrNode> nodes) {
        return new IrDocument("1.0", new IrProject("p", "P", DesignTokens.DEFAULTS, Map.of(), Map.of(), screens, nodes));
    }

    private static IrNode.Container stack(String id, String... children) {
        return new IrNode.Container(id, ContainerType.STACK, Map.of(), List.of(children), IrStyle.EMPTY, Map.of());
    }

    @Test
    void testDanglingChildReferenceIsAnError() {
        final var doc = handBuilt(List.of(new IrScreen("m", "M", Viewport.DEFAULT, "a")), Map.of("a", stack("a", "ghost")));
        assertThatThrownBy(() -> LayoutEngine.calculate(doc))
            .isInstanceOf(WireLayoutException.class)
            .hasMessage("Reference to unknown node 'ghost'")
            .satisfies(e -> assertThat(((WireLayoutException) e).nodeId()).isEqualTo("ghost"));
    }

    @Test
    void testDanglingRootIsAnError() {
        final var doc = handBuilt(List.of(new IrScreen("m", "M", Viewport.DEFAULT, "nope")), Map.of());
        assertThatThrownBy(() -> LayoutEngine.calculate(doc))
            .isInstanceOf(WireLayoutException.class)
            .satisfies(e -> assertThat(((WireLayoutException) e).nodeId()).isEqualTo("nope"));
    }

    @Test
    void testCycleIsAnError() {
        final var doc = handBuilt(List.of(new IrScreen("m", "M", Viewport.DEFAULT, "a")),
            Map.of("a", stack("a", "b"), "b", stack("b", "a")));
        assertThatThrownBy(() -> LayoutEngine.calculate(doc))
            .isInstanceOf(WireLayoutException.class)
            .satisfies(e -> assertThat(((WireLayoutException) e).nodeId()).isIn("a", "b"));
    }

    @Test
    void testSharedSubtreeIsAnError() {
        final var doc = handBuilt(
            List.of(new IrScreen("one", "One", Viewport.DEFAULT, "a"), new IrScreen("two", "Two", Viewport.DEFAULT, "b")),
            Map.of("a", stack("a", "c"), "b", stack("b", "c"), "c", stack("c")));
        assertThatThrownBy(() -> LayoutEngine.calculate(doc))
            .isInstanceOf(WireLayoutException.class)
            .hasMessageContaining("reached more than once")
            .satisfies(e -> assertThat(((WireLayoutException) e).nodeId()).isEqualTo("c"));
    }
}

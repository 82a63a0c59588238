package wire.dsl.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/// Syntax error locations and messages
class WireSyntaxExceptionTest extends ParserTestBase {

    private static WireSyntaxException failParse(String source) {
        final var thrown = catchThrowable(() -> WireParser.parse(source));
        assertThat(thrown).isInstanceOf(WireSyntaxException.class);
        return (WireSyntaxException) thrown;
    }

    @Test
    void testMultiKeyTokenDeclarationIsRejected() {
        final var ex = failParse("""
            project "T" {
              tokens density: compact spacing: lg
              screen M { layout stack { } }
            }
            """);
        assertThat(ex.line()).isEqualTo(2);
        assertThat(ex.column()).isEqualTo(27);
        assertThat(ex.reason()).contains("exactly one key");
    }

    @Test
    void testCommaSeparatedTokenDeclarationIsRejected() {
        final var ex = failParse("""
            project "T" {
              tokens density: compact, spacing: lg
              screen M { layout stack { } }
            }
            """);
        assertThat(ex.line()).isEqualTo(2);
        assertThat(ex.column()).isEqualTo(26);
        assertThat(ex.reason()).contains("exactly one key");
    }

    @Test
    void testCellOutsideGridIsRejected() {
        final var ex = failParse("project \"T\" { screen M { layout stack { cell span: 2 { } } } }");
        assertThat(ex.line()).isEqualTo(1);
        assertThat(ex.column()).isEqualTo(41);
        assertThat(ex.reason()).isEqualTo("'cell' is only allowed directly inside a grid layout");
        assertThat(ex.getMessage())
            .isEqualTo("'cell' is only allowed directly inside a grid layout at line 1, column 41 (near 'c')");
    }

    @Test
    void testCellNestedInCellIsRejected() {
        final var ex = failParse("""
            project "T" { screen M { layout grid { cell span: 6 { cell span: 2 { } } } } }
            """);
        assertThat(ex.reason()).contains("cannot be nested");
    }

    @Test
    void testCellInsideStackNestedInGridIsRejected() {
        final var ex = failParse("""
            project "T" { screen M { layout grid { cell { layout stack { cell { } } } } } }
            """);
        assertThat(ex.reason()).contains("only allowed directly inside a grid");
    }

    @Test
    void testScreenWithoutLayout() {
        final var ex = failParse("project \"T\" { screen M { } }");
        assertThat(ex.column()).isEqualTo(26);
        assertThat(ex.reason()).contains("exactly one root layout");
    }

    @Test
    void testScreenWithTwoRootLayouts() {
        final var ex = failParse("""
            project "T" {
              screen M {
                layout stack { }
                layout stack { }
              }
            }
            """);
        assertThat(ex.line()).isEqualTo(4);
        assertThat(ex.column()).isEqualTo(5);
        assertThat(ex.reason()).contains("exactly one root layout");
    }

    @Test
    void testProjectWithoutScreens() {
        final var ex = failParse("project \"T\" { }");
        assertThat(ex.column()).isEqualTo(15);
        assertThat(ex.reason()).contains("at least one screen");
    }

    @Test
    void testEmptySourceReportsEndOfInput() {
        final var ex = failParse("");
        assertThat(ex.line()).isEqualTo(1);
        assertThat(ex.column()).isEqualTo(1);
        assertThat(ex.getMessage()).isEqualTo("Expected 'project' but found end of input at line 1, column 1");
    }

    @Test
    void testUnterminatedStringPointsAtOpeningQuote() {
        final var ex = failParse("project \"T { }");
        assertThat(ex.column()).isEqualTo(9);
        assertThat(ex.reason()).isEqualTo("Unterminated string literal");
    }

    @Test
    void testUnterminatedBlockComment() {
        final var ex = failParse("project \"T\" { /* never closed");
        assertThat(ex.column()).isEqualTo(15);
        assertThat(ex.reason()).isEqualTo("Unterminated block comment");
    }

    @Test
    void testUnexpectedCharacter() {
        final var ex = failParse("project \"T\" { screen M { layout stack { component Button text: @ } } }");
        assertThat(ex.reason()).isEqualTo("Unexpected character '@'");
        assertThat(ex.column()).isEqualTo(64);
    }

    @Test
    void testMalformedHexColor() {
        final var ex = failParse("""
            project "T" {
              colors { primary: #12345 }
              screen M { layout stack { } }
            }
            """);
        assertThat(ex.line()).isEqualTo(2);
        assertThat(ex.column()).isEqualTo(21);
        assertThat(ex.reason()).contains("six hex digits");
    }

    @Test
    void testHexColorOutsideColorsBlock() {
        final var ex = failParse("""
            project "T" { screen M { layout stack { component Text color: #FFFFFF } } }
            """);
        assertThat(ex.reason()).startsWith("Expected string, number or identifier value for 'color'");
    }

    @Test
    void testOversizedNumberLiteralIsRejected() {
        final String digits = "9".repeat(400);
        final var ex = failParse("project \"T\" { screen M { layout stack { component Table rows: " + digits + " } } }");
        assertThat(ex.line()).isEqualTo(1);
        assertThat(ex.column()).isEqualTo(63);
        assertThat(ex.reason()).isEqualTo("Number literal out of range");
    }

    @Test
    void testDefinitionKindMustBeComponentOrLayout() {
        final var ex = failParse("project \"T\" { define Widget \"X\" { layout stack { } } screen M { layout stack { } } }");
        assertThat(ex.column()).isEqualTo(22);
        assertThat(ex.reason()).isEqualTo("Expected 'Component' or 'Layout' but found 'Widget'");
    }

    @Test
    void testBlankDefinitionName() {
        final var ex = failParse("project \"T\" { define Layout \" \" { layout stack { } } screen M { layout stack { } } }");
        assertThat(ex.column()).isEqualTo(29);
        assertThat(ex.reason()).isEqualTo("A definition name must not be blank");
    }

    @Test
    void testLayoutDefinitionBodyMustBeALayout() {
        final var ex = failParse("project \"T\" { define Layout \"Box\" { component Button } screen M { layout stack { } } }");
        assertThat(ex.column()).isEqualTo(37);
        assertThat(ex.reason()).isEqualTo("Expected 'layout' but found 'component'");
    }

    @Test
    void testDefinitionHoldsASingleBody() {
        final var ex = failParse("""
            project "T" { define Component "Two" { component Button component Text } screen M { layout stack { } } }
            """);
        assertThat(ex.column()).isEqualTo(57);
        assertThat(ex.reason())
            .isEqualTo("A definition holds exactly one layout or component; expected '}' but found 'component'");
    }

    @Test
    void testTrailingContentAfterProject() {
        final var ex = failParse("project \"T\" { screen M { layout stack { } } } extra");
        assertThat(ex.reason()).isEqualTo("Expected end of input but found 'extra'");
    }

    @Test
    void testMissingColonInParams() {
        assertThatThrownBy(() -> WireParser.parse("project \"T\" { screen M { layout stack(gap md) { } } }"))
            .isInstanceOf(WireSyntaxException.class)
            .hasMessageStartingWith("Expected ':' but found 'md'");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "project T { screen M { layout stack { } } }",
        "project \"T\" { screen { layout stack { } } }",
        "project \"T\" { screen M { layout { } } }",
        "project \"T\" { screen M { layout stack(gap: md,) { } } }",
        "project \"T\" { screen M { layout stack { component } } }",
        "project \"T\" { screen M { layout stack { } }",
        "project \"T\" { mocks { status: Active } screen M { layout stack { } } }",
        "project \"T\" { tokens density compact screen M { layout stack { } } }",
    })
    void testMalformedSourcesFailFast(String source) {
        assertThatThrownBy(() -> WireParser.parse(source))
            .isInstanceOf(WireSyntaxException.class)
            .satisfies(e -> {
                final var ex = (WireSyntaxException) e;
                assertThat(ex.line()).isEqualTo(1);
                assertThat(ex.column()).isPositive();
                assertThat(ex.getMessage()).contains("at line 1, column " + ex.column());
            });
    }

    @Test
    void testNullSourceIsRejected() {
        assertThatThrownBy(() -> WireParser.parse(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("source must not be null");
    }
}

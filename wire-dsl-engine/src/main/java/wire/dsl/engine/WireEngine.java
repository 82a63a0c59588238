package wire.dsl.engine;

import wire.dsl.ir.IrDocument;
import wire.dsl.ir.IrGenerator;
import wire.dsl.ir.WireValidationException;
import wire.dsl.layout.LayoutEngine;
import wire.dsl.layout.LayoutResult;
import wire.dsl.layout.WireLayoutException;
import wire.dsl.parser.WireAst;
import wire.dsl.parser.WireParser;
import wire.dsl.parser.WireSyntaxException;

import java.util.Objects;
import java.util.logging.Logger;

/// Entry point for turning wire source into geometry.
///
/// ```java
/// CompiledWireframe compiled = WireEngine.compile("""
///     project "Demo" { screen Main { layout stack { component Button text: "Go" } } }
///     """);
/// Box button = compiled.layout().get("node_2");
/// ```
/// Every call is independent: no state survives between calls and the same
/// source always yields an equal result or the same exception.
public final class WireEngine {

    private static final Logger LOG = Logger.getLogger(WireEngine.class.getName());

    private WireEngine() {
    }

    /// Parses, generates and lays out in one go.
    /// @param source wire source text
    /// @return AST, IR and boxes of the same call
    /// @throws WireSyntaxException if the text does not parse
    /// @throws WireValidationException if the IR breaks the schema
    /// @throws WireLayoutException if the IR cannot be laid out
    public static CompiledWireframe compile(String source) {
        Objects.requireNonNull(source, "source must not be null");
        final long start = System.nanoTime();
        final WireAst.Project ast = parse(source);
        final IrDocument ir = generate(ast);
        final LayoutResult layout = layout(ir);
        LOG.fine(() -> "Compiled project '" + ast.name() + "': " + ir.project().nodes().size() + " node(s), "
            + layout.size() + " box(es) in " + (System.nanoTime() - start) / 1_000 + "us");
        return new CompiledWireframe(ast, ir, layout);
    }

    /// @throws WireSyntaxException at the first grammar violation
    public static WireAst.Project parse(String source) {
        return WireParser.parse(source);
    }

    /// @throws WireValidationException listing every schema violation
    public static IrDocument generate(WireAst.Project ast) {
        return IrGenerator.generate(ast);
    }

    /// @throws WireLayoutException on a missing, shared or cyclic reference
    public static LayoutResult layout(IrDocument ir) {
        return LayoutEngine.calculate(ir);
    }
}

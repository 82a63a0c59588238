package wire.dsl.engine;

import wire.dsl.ir.IrDocument;
import wire.dsl.layout.LayoutResult;
import wire.dsl.parser.WireAst;

import java.util.Objects;

/// Output of all three stages for one source text. Node ids in `layout`
/// are the keys of `ir.project().nodes()`.
public record CompiledWireframe(WireAst.Project ast, IrDocument ir, LayoutResult layout) {

    public CompiledWireframe {
        Objects.requireNonNull(ast, "ast must not be null");
        Objects.requireNonNull(ir, "ir must not be null");
        Objects.requireNonNull(layout, "layout must not be null");
    }
}

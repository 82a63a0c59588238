package wire.dsl.ir;

/// Breadcrumb trail naming a location inside an IR document, e.g.
/// `project.nodes.node_3.style.padding` or `project.screens[1].root`.
record IrPath(String value) {
    static IrPath root() {
        return new IrPath("project");
    }

    IrPath field(String name) {
        return new IrPath(value + "." + name);
    }

    IrPath index(int idx) {
        return new IrPath(value + "[" + idx + "]");
    }

    static IrPath node(String nodeId) {
        return root().field("nodes").field(nodeId);
    }

    @Override
    public String toString() {
        return value;
    }
}

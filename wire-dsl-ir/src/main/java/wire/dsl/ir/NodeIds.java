package wire.dsl.ir;

/// Sequential id source, `node_1`, `node_2`, ... One instance per generation run.
final class NodeIds {

    private final String prefix;
    private int counter;

    NodeIds(String prefix) {
        this.prefix = prefix;
    }

    String next() {
        counter++;
        return prefix + "_" + counter;
    }
}

package wire.dsl.layout;

/// Absolute pixel rectangle of one node. Origin is the screen's top-left corner.
public record Box(double x, double y, double width, double height) {

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    Box withHeight(double value) {
        return new Box(x, y, width, value);
    }
}

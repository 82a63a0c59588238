package wire.dsl.ir;

import java.util.Objects;
import java.util.OptionalDouble;

/// A param or prop value in the IR: either a string or a number.
public sealed interface IrValue permits IrValue.Text, IrValue.Number {

    /// String form; numbers print without a trailing `.0` when integral.
    String asString();

    /// Numeric form. Text that spells a number (`"120"`) also yields a value.
    OptionalDouble asNumber();

    static IrValue of(String value) {
        return new Text(value);
    }

    static IrValue of(double value) {
        return new Number(value);
    }

    record Text(String value) implements IrValue {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String asString() {
            return value;
        }

        @Override
        public OptionalDouble asNumber() {
            final String trimmed = value.trim();
            if (trimmed.isEmpty()) {
                return OptionalDouble.empty();
            }
            try {
                final double parsed = Double.parseDouble(trimmed);
                return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
    }

    record Number(double value) implements IrValue {
        public Number {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("value must be finite, got " + value);
            }
        }

        public boolean isIntegral() {
            return value == Math.rint(value);
        }

        @Override
        public String asString() {
            return isIntegral() ? Long.toString((long) value) : Double.toString(value);
        }

        @Override
        public OptionalDouble asNumber() {
            return OptionalDouble.of(value);
        }
    }
}

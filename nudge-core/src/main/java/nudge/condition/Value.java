package nudge.condition;

import java.util.Objects;

/**
 * Tagged condition value. Comparison operators coerce between variants with
 * {@link #toNumber()} and {@link #toText()}; equality is strict (same variant, same value).
 *
 * <p>{@link Missing} is produced only by path resolution when a field is absent and is
 * distinct from an explicit {@link Null}.
 */
public sealed interface Value permits Value.Text, Value.Num, Value.Bool, Value.Null, Value.Missing {

    Null NULL = new Null();
    Missing MISSING = new Missing();

    /**
     * Wraps a raw Java value. Strings, numbers and booleans map to their variant,
     * {@code null} maps to {@link #NULL}; anything else is rendered with {@code toString()}.
     */
    static Value of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof Value value) {
            return value;
        }
        if (raw instanceof CharSequence text) {
            return new Text(text.toString());
        }
        if (raw instanceof Number number) {
            return new Num(number.doubleValue());
        }
        if (raw instanceof Boolean bool) {
            return new Bool(bool);
        }
        return new Text(raw.toString());
    }

    static Value text(String value) {
        return new Text(value);
    }

    static Value num(double value) {
        return new Num(value);
    }

    static Value bool(boolean value) {
        return new Bool(value);
    }

    /** Numeric coercion; values with no numeric reading yield {@code NaN}. */
    double toNumber();

    /** String coercion used by substring matching. */
    String toText();

    /** Returns the underlying Java value ({@code null} for both null variants). */
    Object raw();

    default boolean isPresent() {
        return !(this instanceof Null) && !(this instanceof Missing);
    }

    /**
     * Strict equality. Two numbers are equal when numerically equal, so {@code NaN}
     * never equals itself and {@code 0.0} equals {@code -0.0}.
     */
    default boolean strictEquals(Value other) {
        if (this instanceof Num a && other instanceof Num b) {
            return a.value() == b.value();
        }
        return equals(other);
    }

    record Text(String value) implements Value {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public double toNumber() {
            String trimmed = value.strip();
            if (trimmed.isEmpty()) {
                return 0d;
            }
            char last = trimmed.charAt(trimmed.length() - 1);
            // Double.parseDouble accepts type suffixes and hex floats that are not numbers here
            if (last == 'd' || last == 'D' || last == 'f' || last == 'F' || trimmed.contains("0x")) {
                return Double.NaN;
            }
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }

        @Override
        public String toText() {
            return value;
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record Num(double value) implements Value {
        @Override
        public double toNumber() {
            return value;
        }

        @Override
        public String toText() {
            if (Double.isNaN(value)) {
                return "NaN";
            }
            if (Double.isInfinite(value)) {
                return value > 0 ? "Infinity" : "-Infinity";
            }
            if (value == Math.rint(value) && Math.abs(value) < 1e21) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public double toNumber() {
            return value ? 1d : 0d;
        }

        @Override
        public String toText() {
            return Boolean.toString(value);
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record Null() implements Value {
        @Override
        public double toNumber() {
            return 0d;
        }

        @Override
        public String toText() {
            return "null";
        }

        @Override
        public Object raw() {
            return null;
        }
    }

    record Missing() implements Value {
        @Override
        public double toNumber() {
            return Double.NaN;
        }

        @Override
        public String toText() {
            return "undefined";
        }

        @Override
        public Object raw() {
            return null;
        }
    }
}

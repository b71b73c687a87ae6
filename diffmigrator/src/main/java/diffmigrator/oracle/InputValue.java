package diffmigrator.oracle;

import diffmigrator.model.PrimitiveKind;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A concrete value bound to a function parameter in a test case.
 *
 * <p>Values are typed by the parameter's {@link PrimitiveKind} so harness
 * generators can render them as literals of the right width. {@link #render()}
 * is the canonical text form used in suite renderings and reports.
 */
public interface InputValue {

    /** Canonical, locale independent text form. */
    String render();

    static Integral of(PrimitiveKind kind, long value) {
        return new Integral(kind, value);
    }

    static Floating of(PrimitiveKind kind, double value) {
        return new Floating(kind, value);
    }

    static Bool of(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    static Text text(String value) {
        return new Text(value);
    }

    static Null nullValue() {
        return Null.INSTANCE;
    }

    /**
     * An integer of an integral kind. Unsigned 64-bit values are stored as raw
     * bits and rendered unsigned.
     */
    record Integral(PrimitiveKind kind, long value) implements InputValue {
        public Integral {
            if (!kind.isIntegral()) {
                throw new IllegalArgumentException("Not an integral kind: " + kind);
            }
        }

        @Override
        public String render() {
            return kind == PrimitiveKind.ULONG ? Long.toUnsignedString(value) : Long.toString(value);
        }
    }

    record Floating(PrimitiveKind kind, double value) implements InputValue {
        public Floating {
            if (!kind.isFloating()) {
                throw new IllegalArgumentException("Not a floating kind: " + kind);
            }
        }

        @Override
        public String render() {
            if (Double.isNaN(value)) return "nan";
            if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
            return kind == PrimitiveKind.FLOAT ? Float.toString((float) value) : Double.toString(value);
        }
    }

    record Bool(boolean value) implements InputValue {
        static final Bool TRUE = new Bool(true);
        static final Bool FALSE = new Bool(false);

        @Override
        public String render() {
            return value ? "true" : "false";
        }
    }

    record Text(String value) implements InputValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            StringBuilder sb = new StringBuilder("\"");
            for (char c : value.toCharArray()) {
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\n' -> sb.append("\\n");
                    case '\t' -> sb.append("\\t");
                    default -> sb.append(c);
                }
            }
            return sb.append('"').toString();
        }
    }

    /** A null pointer. */
    record Null() implements InputValue {
        static final Null INSTANCE = new Null();

        @Override
        public String render() {
            return "null";
        }
    }

    /**
     * A sequence bound to a pointer or array parameter. Elements are scalar
     * values of {@code elementKind}.
     */
    record Array(PrimitiveKind elementKind, List<InputValue> elements) implements InputValue {
        public Array {
            elements = List.copyOf(elements);
        }

        public int length() {
            return elements.size();
        }

        @Override
        public String render() {
            return elements.stream().map(InputValue::render).collect(Collectors.joining(";", "[", "]"));
        }
    }
}

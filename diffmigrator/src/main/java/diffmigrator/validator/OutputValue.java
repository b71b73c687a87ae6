package diffmigrator.validator;

import diffmigrator.model.PrimitiveKind;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A typed output captured from a harness run.
 *
 * <p>Each value is tagged with the kind declared for its output at harness
 * generation time, so the validator dispatches comparison on the tag rather
 * than on the printed text.
 */
public interface OutputValue {

    /** Text form used in reports and feedback to the code generator. */
    String render();

    /** Integer of an integral kind; unsigned 64-bit values are raw bits. */
    record Integral(PrimitiveKind kind, long value) implements OutputValue {
        @Override
        public String render() {
            return kind == PrimitiveKind.ULONG ? Long.toUnsignedString(value) : Long.toString(value);
        }
    }

    record Floating(PrimitiveKind kind, double value) implements OutputValue {
        public boolean singlePrecision() {
            return kind == PrimitiveKind.FLOAT;
        }

        @Override
        public String render() {
            if (Double.isNaN(value)) return "nan";
            if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
            return String.format(Locale.ROOT, "%.17g", value).replaceFirst("\\.?0+(e|$)", "$1");
        }
    }

    record Bool(boolean value) implements OutputValue {
        @Override
        public String render() {
            return Boolean.toString(value);
        }
    }

    record Text(String value) implements OutputValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
        }
    }

    record Null() implements OutputValue {
        public static final Null INSTANCE = new Null();

        @Override
        public String render() {
            return "null";
        }
    }

    record Array(List<OutputValue> elements) implements OutputValue {
        public Array {
            elements = List.copyOf(elements);
        }

        @Override
        public String render() {
            return elements.stream().map(OutputValue::render).collect(Collectors.joining(";", "[", "]"));
        }
    }
}

package diffmigrator.oracle;

import diffmigrator.model.PrimitiveKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Value domains per scalar kind: boundary sets, edge values, neutral values
 * and seeded random draws.
 */
final class BoundaryValues {

    private static final double[] FLOAT_BOUNDARIES = {-1e38, -1000.5, -1.0, -0.1, -Float.MIN_NORMAL, 0.0,
            Float.MIN_NORMAL, 0.1, 1.0, 1000.5, 1e38};
    private static final double[] DOUBLE_BOUNDARIES = {-1e308, -1000.5, -1.0, -0.1, -Double.MIN_NORMAL, 0.0,
            Double.MIN_NORMAL, 0.1, 1.0, 1000.5, 1e308};
    private static final double[] FLOAT_SPECIALS = {-0.0, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NaN};
    private static final String[] STRING_BOUNDARIES = {"", "a", "Hello, World!"};
    private static final String[] STRING_EDGES = {" ", "line\nbreak", "quote\"and\\slash"};
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz";

    private BoundaryValues() {}

    /**
     * Boundary set of a scalar kind: the extrema, the values next to them and
     * the values around zero, smallest first. Floating kinds include the
     * smallest normal magnitudes on both sides of zero.
     */
    static List<InputValue> boundaries(PrimitiveKind kind) {
        if (kind == PrimitiveKind.BOOL) {
            return List.of(InputValue.of(false), InputValue.of(true));
        }
        if (kind == PrimitiveKind.STRING) {
            List<InputValue> values = new ArrayList<>();
            for (String s : STRING_BOUNDARIES) values.add(InputValue.text(s));
            return values;
        }
        if (kind.isFloating()) {
            double[] source = kind == PrimitiveKind.FLOAT ? FLOAT_BOUNDARIES : DOUBLE_BOUNDARIES;
            List<InputValue> values = new ArrayList<>();
            for (double d : source) values.add(InputValue.of(kind, d));
            return values;
        }
        Set<Long> raw = new LinkedHashSet<>();
        long min = kind.minValue();
        long max = kind.maxValue();
        if (kind.isUnsigned()) {
            raw.add(0L);
            raw.add(1L);
            raw.add(max - 1);
            raw.add(max);
        } else {
            raw.add(min);
            raw.add(min + 1);
            raw.add(-1L);
            raw.add(0L);
            raw.add(1L);
            raw.add(max - 1);
            raw.add(max);
        }
        List<InputValue> values = new ArrayList<>();
        for (long v : raw) values.add(InputValue.of(kind, v));
        return values;
    }

    /** Smallest boundary value of a kind. */
    static InputValue minimum(PrimitiveKind kind) {
        return boundaries(kind).get(0);
    }

    /** Largest boundary value of a kind. */
    static InputValue maximum(PrimitiveKind kind) {
        List<InputValue> values = boundaries(kind);
        return values.get(values.size() - 1);
    }

    /**
     * Edge values of a scalar kind beyond its boundary set: float specials,
     * integer wrap points and awkward strings.
     */
    static List<InputValue> edges(PrimitiveKind kind) {
        List<InputValue> values = new ArrayList<>();
        if (kind.isFloating()) {
            for (double d : FLOAT_SPECIALS) values.add(InputValue.of(kind, d));
        } else if (kind == PrimitiveKind.STRING) {
            for (String s : STRING_EDGES) values.add(InputValue.text(s));
        } else if (kind.isIntegral()) {
            if (kind.isUnsigned()) {
                // sign bit set: wraps negative when reinterpreted as signed
                values.add(InputValue.of(kind, 1L << (kind.bits() - 1)));
                values.add(InputValue.of(kind, kind.maxValue()));
            } else {
                values.add(InputValue.of(kind, kind.maxValue()));
                values.add(InputValue.of(kind, kind.minValue()));
            }
        }
        return values;
    }

    /** The value other parameters hold while one parameter is varied. */
    static InputValue neutral(PrimitiveKind kind, boolean divisor) {
        if (kind == PrimitiveKind.BOOL) return InputValue.of(false);
        if (kind == PrimitiveKind.STRING) return InputValue.text("");
        if (kind.isFloating()) return InputValue.of(kind, divisor ? 1.0 : 0.0);
        return InputValue.of(kind, divisor ? 1L : 0L);
    }

    /** Zero of a numeric kind. */
    static InputValue zero(PrimitiveKind kind) {
        return kind.isFloating() ? InputValue.of(kind, 0.0) : InputValue.of(kind, 0L);
    }

    /**
     * Draws a value within the kind's range. Floats are drawn from
     * [-1000, 1000), doubles from [-10000, 10000).
     */
    static InputValue random(PrimitiveKind kind, Random random) {
        if (kind == PrimitiveKind.BOOL) return InputValue.of(random.nextBoolean());
        if (kind == PrimitiveKind.STRING) {
            int length = random.nextInt(9);
            StringBuilder sb = new StringBuilder(length);
            for (int i = 0; i < length; i++) {
                sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
            }
            return InputValue.text(sb.toString());
        }
        if (kind == PrimitiveKind.FLOAT) {
            return InputValue.of(kind, (double) (float) (random.nextDouble() * 2000.0 - 1000.0));
        }
        if (kind == PrimitiveKind.DOUBLE) {
            return InputValue.of(kind, random.nextDouble() * 20000.0 - 10000.0);
        }
        long bits = random.nextLong();
        return InputValue.of(kind, narrow(kind, bits));
    }

    /** Truncates raw bits to the width of the kind, sign extending signed kinds. */
    static long narrow(PrimitiveKind kind, long bits) {
        int width = kind.bits();
        if (width >= 64) return bits;
        long mask = (1L << width) - 1;
        long value = bits & mask;
        if (kind.isSigned() && (value & (1L << (width - 1))) != 0) {
            value -= 1L << width;
        }
        return value;
    }
}

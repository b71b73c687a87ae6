package diffmigrator.validator;

/**
 * Floating point comparison thresholds.
 *
 * <p>Two finite values {@code a} and {@code b} are equal when
 * {@code |a - b| <= absolute} or {@code |a - b| <= relative * max(|a|, |b|)}.
 * The absolute threshold depends on the declared precision.
 *
 * @param floatAbsolute absolute threshold for single precision values
 * @param doubleAbsolute absolute threshold for double precision values
 * @param relative relative threshold for both precisions
 */
public record Tolerance(double floatAbsolute, double doubleAbsolute, double relative) {

    public static final Tolerance DEFAULT = new Tolerance(1e-6, 1e-12, 1e-9);

    public Tolerance {
        requireNonNegative("floatAbsolute", floatAbsolute);
        requireNonNegative("doubleAbsolute", doubleAbsolute);
        requireNonNegative("relative", relative);
    }

    private static void requireNonNegative(String name, double value) {
        if (Double.isNaN(value) || value < 0) {
            throw new IllegalArgumentException(name + " must be a non-negative number: " + value);
        }
    }

    public double absoluteFor(boolean singlePrecision) {
        return singlePrecision ? floatAbsolute : doubleAbsolute;
    }

    /**
     * Compares two finite values. Symmetric in {@code a} and {@code b}.
     */
    public boolean accepts(double a, double b, boolean singlePrecision) {
        double delta = Math.abs(a - b);
        if (delta <= absoluteFor(singlePrecision)) return true;
        return delta <= relative * Math.max(Math.abs(a), Math.abs(b));
    }
}

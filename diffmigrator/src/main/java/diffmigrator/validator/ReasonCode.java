package diffmigrator.validator;

/**
 * Why a value pair or a test case did not match.
 */
public enum ReasonCode {
    /** Integer, boolean or text values differ. */
    VALUE_MISMATCH,
    /** Finite floating point values differ beyond tolerance. */
    OUTSIDE_TOLERANCE,
    /** NaN or infinity on one side only, or infinities of opposite sign. */
    SPECIAL_VALUE_MISMATCH,
    /** The two sides produced values of different shape. */
    KIND_MISMATCH,
    /** Arrays of different length. */
    LENGTH_MISMATCH,
    /** An output is present on one side only. */
    MISSING_OUTPUT,
    BASELINE_COMPILATION_FAILURE,
    TARGET_COMPILATION_FAILURE,
    BASELINE_RUNTIME_FAILURE,
    TARGET_RUNTIME_FAILURE,
    BASELINE_TIMEOUT,
    TARGET_TIMEOUT,
    /** No result was recorded for the case, e.g. after cancellation. */
    MISSING_RESULT
}

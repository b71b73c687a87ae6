package diffmigrator.executor;

/**
 * How a test case execution failed, if it did.
 */
public enum FailureKind {
    NONE,
    /** The harness or unit did not compile; applies to every case of the suite. */
    COMPILATION_FAILURE,
    /** The case crashed, exited non-zero, timed out or printed no result line. */
    RUNTIME_FAILURE
}

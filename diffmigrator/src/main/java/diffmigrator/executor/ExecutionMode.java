package diffmigrator.executor;

/**
 * How a compiled harness is driven over a test suite.
 */
public enum ExecutionMode {
    /**
     * One process per test case, run on a bounded worker pool. A crash or
     * timeout affects only that case.
     */
    PER_CASE,
    /**
     * A single process runs every case. Cheaper, but a crash loses the cases
     * that had not yet printed their outputs.
     */
    BATCH
}

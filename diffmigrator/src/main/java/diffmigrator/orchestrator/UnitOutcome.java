package diffmigrator.orchestrator;

/**
 * Final reported outcome of a unit.
 */
public enum UnitOutcome {
    /** Every case of the frozen suite matched. */
    CONVERTED,
    /** Baseline failed to build, or retries were exhausted. */
    FAILED,
    /** Never started, blocked by a cycle or a failed dependency, or cancelled. */
    SKIPPED
}

package diffmigrator.orchestrator;

/**
 * Whether a unit's test suite is kept or partly regenerated between conversion attempts.
 */
public enum SuiteRegeneration {
    /** Every attempt is validated against the same frozen suite. */
    REUSE,
    /**
     * Random cases are regenerated with a per-attempt seed; boundary and edge
     * cases stay. The baseline is re-run for the new suite.
     */
    REGENERATE_RANDOM
}

package diffmigrator.model;

/**
 * Lifecycle status of a translation unit during a migration run.
 *
 * <p>Transitions only move forward: {@code PENDING -> READY -> IN_PROGRESS},
 * then either back to {@code IN_PROGRESS} for a retry or to one of the
 * terminal states {@code CONVERTED} and {@code FAILED}.
 */
public enum ConversionStatus {
    PENDING,
    READY,
    IN_PROGRESS,
    CONVERTED,
    FAILED;

    public boolean isTerminal() {
        return this == CONVERTED || this == FAILED;
    }

    /** True while the unit has not been picked up by the orchestrator. */
    public boolean isWaiting() {
        return this == PENDING || this == READY;
    }
}

package diffmigrator.exceptions;

/**
 * Base exception for failures in the migration engine.
 *
 * <p>Carries optional diagnostic context: the translation unit being
 * processed and the pipeline stage in which the failure occurred. Both are
 * plain strings so the exception can be logged or reported without holding on
 * to engine objects.
 *
 * @see diffmigrator.orchestrator.MigrationOrchestrator
 */
public class MigrationException extends Exception {

    private final String unitId;
    private final String stage;

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrationException(String message) {
        this(message, null, null, null);
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrationException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    /**
     * Creates a new migration exception with unit and stage context.
     *
     * @param message the error message
     * @param unitId the translation unit being processed (may be null)
     * @param stage the pipeline stage where the failure occurred (may be null)
     * @param cause the underlying cause (may be null)
     */
    public MigrationException(String message, String unitId, String stage, Throwable cause) {
        super(message, cause);
        this.unitId = unitId;
        this.stage = stage;
    }

    /** Returns the translation unit id, or null if not unit specific. */
    public String getUnitId() {
        return unitId;
    }

    /** Returns the pipeline stage, or null if unknown. */
    public String getStage() {
        return stage;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName());
        sb.append(": ").append(getMessage());
        if (unitId != null) sb.append(" [unit=").append(unitId).append(']');
        if (stage != null) sb.append(" [stage=").append(stage).append(']');
        return sb.toString();
    }
}

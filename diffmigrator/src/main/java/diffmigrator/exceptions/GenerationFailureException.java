package diffmigrator.exceptions;

/**
 * Thrown by a {@link diffmigrator.orchestrator.CodeGenerator} that could not
 * produce target source for a unit.
 *
 * <p>Generation failures are retryable: the orchestrator counts the attempt
 * and asks again until the retry budget is spent.
 */
public class GenerationFailureException extends MigrationException {

    /**
     * @param unitId the unit that could not be converted
     * @param message description of the failure
     */
    public GenerationFailureException(String unitId, String message) {
        super(message, unitId, "convert", null);
    }

    /**
     * @param unitId the unit that could not be converted
     * @param message description of the failure
     * @param cause underlying cause
     */
    public GenerationFailureException(String unitId, String message, Throwable cause) {
        super(message, unitId, "convert", cause);
    }
}

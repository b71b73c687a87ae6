package diffmigrator.exceptions;

/**
 * Thrown by a toolchain when a harness and its unit fail to compile.
 *
 * <p>Compilation is unit granular: the differential executor maps this
 * exception to a compilation failure for every test case of the suite.
 */
public class CompilationException extends MigrationException {

    private final String stderr;
    private final boolean timedOut;

    /**
     * @param message short description
     * @param stderr compiler diagnostics (may be empty)
     * @param timedOut true if the compiler exceeded its timeout
     */
    public CompilationException(String message, String stderr, boolean timedOut) {
        super(message);
        this.stderr = stderr != null ? stderr : "";
        this.timedOut = timedOut;
    }

    /**
     * @param message short description
     * @param cause the I/O or process failure that prevented compilation
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
        this.stderr = cause != null && cause.getMessage() != null ? cause.getMessage() : "";
        this.timedOut = false;
    }

    /** Returns the compiler diagnostics. */
    public String getStderr() {
        return stderr;
    }

    /** Returns true if the compiler was killed after exceeding its timeout. */
    public boolean isTimedOut() {
        return timedOut;
    }
}

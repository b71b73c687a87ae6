package diffmigrator.executor;

import diffmigrator.validator.OutputValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one test case on one backend.
 *
 * @param caseName the test case
 * @param backend where it ran
 * @param failure failure kind, {@link FailureKind#NONE} on success
 * @param timedOut true if the compile or run hit its timeout
 * @param exitCode process exit status, or -1 if no process completed
 * @param outputs typed outputs keyed by output name; empty on failure
 * @param stderr stderr excerpt or failure description
 * @param wallTimeMs wall-clock time of the run
 */
public record ExecutionResult(
        String caseName,
        Backend backend,
        FailureKind failure,
        boolean timedOut,
        int exitCode,
        Map<String, OutputValue> outputs,
        String stderr,
        long wallTimeMs
) {

    static final int STDERR_EXCERPT = 2000;

    public ExecutionResult {
        Objects.requireNonNull(caseName, "caseName");
        Objects.requireNonNull(failure, "failure");
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        stderr = stderr != null ? stderr : "";
    }

    public static ExecutionResult success(String caseName, Backend backend, Map<String, OutputValue> outputs,
                                          long wallTimeMs) {
        return new ExecutionResult(caseName, backend, FailureKind.NONE, false, 0, outputs, "", wallTimeMs);
    }

    public static ExecutionResult compilationFailure(String caseName, Backend backend, String stderr,
                                                     boolean timedOut) {
        return new ExecutionResult(caseName, backend, FailureKind.COMPILATION_FAILURE, timedOut, -1, Map.of(),
                ProcessOutcome.excerpt(stderr, STDERR_EXCERPT), 0);
    }

    public static ExecutionResult runtimeFailure(String caseName, Backend backend, int exitCode, String stderr,
                                                 boolean timedOut, long wallTimeMs) {
        return new ExecutionResult(caseName, backend, FailureKind.RUNTIME_FAILURE, timedOut, exitCode, Map.of(),
                ProcessOutcome.excerpt(stderr, STDERR_EXCERPT), wallTimeMs);
    }

    public boolean succeeded() {
        return failure == FailureKind.NONE;
    }

    /** Short description of the failure for reports. */
    public String describeFailure() {
        return switch (failure) {
            case NONE -> "ok";
            case COMPILATION_FAILURE -> timedOut ? "compilation timed out" : "compilation failed";
            case RUNTIME_FAILURE -> timedOut ? "timed out" : "runtime failure (exit " + exitCode + ")";
        };
    }
}

package diffmigrator.executor;

import diffmigrator.validator.OutputValue;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Results of running a suite on one backend, one slot per test case.
 *
 * <p>Each slot is written at most once. Workers running cases in parallel
 * write only their own slot, so no further locking is needed.
 */
public final class ResultSet {

    private final String unitId;
    private final Backend backend;
    private final List<String> caseOrder;
    private final Map<String, ExecutionResult> results = new ConcurrentHashMap<>();
    private volatile String compilationDiagnostics;

    public ResultSet(String unitId, Backend backend, List<String> caseNames) {
        this.unitId = unitId;
        this.backend = backend;
        this.caseOrder = List.copyOf(caseNames);
    }

    public String unitId() {
        return unitId;
    }

    public Backend backend() {
        return backend;
    }

    /**
     * Records a result.
     *
     * @throws IllegalArgumentException if the case is not part of the suite
     * @throws IllegalStateException if the case already has a result
     */
    public void record(ExecutionResult result) {
        if (!caseOrder.contains(result.caseName())) {
            throw new IllegalArgumentException("Unknown test case: " + result.caseName());
        }
        if (results.putIfAbsent(result.caseName(), result) != null) {
            throw new IllegalStateException("Result already recorded for " + result.caseName());
        }
    }

    public Optional<ExecutionResult> result(String caseName) {
        return Optional.ofNullable(results.get(caseName));
    }

    /** Recorded results in suite order. */
    public List<ExecutionResult> results() {
        List<ExecutionResult> ordered = new ArrayList<>(results.size());
        for (String name : caseOrder) {
            ExecutionResult r = results.get(name);
            if (r != null) ordered.add(r);
        }
        return ordered;
    }

    public int size() {
        return results.size();
    }

    public boolean isComplete() {
        return results.size() == caseOrder.size();
    }

    /**
     * Marks the whole unit as failing to compile. Holds even for an empty
     * suite, where no per-case result carries the failure.
     */
    public void markCompilationFailed(String diagnostics) {
        this.compilationDiagnostics = diagnostics != null ? diagnostics : "";
    }

    public boolean compilationFailed() {
        return compilationDiagnostics != null
                || results.values().stream().anyMatch(r -> r.failure() == FailureKind.COMPILATION_FAILURE);
    }

    public long count(FailureKind kind) {
        return results.values().stream().filter(r -> r.failure() == kind).count();
    }

    /** Returns the first compilation diagnostics found, or an empty string. */
    public String compilationDiagnostics() {
        if (compilationDiagnostics != null) return compilationDiagnostics;
        return results().stream()
                .filter(r -> r.failure() == FailureKind.COMPILATION_FAILURE)
                .map(ExecutionResult::stderr)
                .findFirst()
                .orElse("");
    }

    /** Outputs of successful cases keyed by case name. */
    public Map<String, Map<String, OutputValue>> outputsByCase() {
        Map<String, Map<String, OutputValue>> outputs = new LinkedHashMap<>();
        for (ExecutionResult r : results()) {
            if (r.succeeded()) {
                outputs.put(r.caseName(), r.outputs());
            }
        }
        return outputs;
    }

    @Override
    public String toString() {
        return "ResultSet{unit=" + unitId + ", backend=" + backend + ", results=" + results.size()
                + "/" + caseOrder.size() + '}';
    }
}

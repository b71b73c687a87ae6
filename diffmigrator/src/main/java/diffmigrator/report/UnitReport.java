package diffmigrator.report;

import diffmigrator.metrics.UnitMetrics;
import diffmigrator.orchestrator.UnitOutcome;
import diffmigrator.validator.UnitVerdict;

import java.util.*;

/**
 * Final state of one unit after a run.
 *
 * @param unitId the unit
 * @param outcome converted, failed or skipped
 * @param attempts conversion attempts made, 0 if the unit never reached conversion
 * @param verdicts verdict of every attempt that produced code, oldest first
 * @param reason failure or skip reason, empty for converted units
 * @param dependencies direct dependencies of the unit
 * @param metrics phase timings, null for units that never started
 */
public record UnitReport(
        String unitId,
        UnitOutcome outcome,
        int attempts,
        List<UnitVerdict> verdicts,
        String reason,
        SortedSet<String> dependencies,
        UnitMetrics metrics
) {

    public UnitReport {
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(outcome, "outcome");
        verdicts = List.copyOf(verdicts);
        reason = reason != null ? reason : "";
        dependencies = Collections.unmodifiableSortedSet(new TreeSet<>(dependencies));
    }

    public Optional<UnitVerdict> lastVerdict() {
        return verdicts.isEmpty() ? Optional.empty() : Optional.of(verdicts.get(verdicts.size() - 1));
    }

    /** Passing cases of the last verdict. */
    public int passed() {
        return lastVerdict().map(UnitVerdict::passed).orElse(0);
    }

    /** Failing cases of the last verdict. */
    public int failed() {
        return lastVerdict().map(UnitVerdict::failed).orElse(0);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", outcome.name());
        map.put("attempts", attempts);
        map.put("passed", passed());
        map.put("failed", failed());
        if (!reason.isEmpty()) map.put("reason", reason);
        map.put("dependencies", List.copyOf(dependencies));
        map.put("verdicts", verdicts.stream().map(UnitVerdict::toMap).toList());
        if (metrics != null) map.put("metrics", metrics.toMap());
        return map;
    }
}

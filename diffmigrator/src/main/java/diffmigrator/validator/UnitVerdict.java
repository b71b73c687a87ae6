package diffmigrator.validator;

import java.util.*;

/**
 * Aggregated comparison outcome for one unit and one conversion attempt.
 *
 * <p>A verdict is accepted when every case of the suite matched and the
 * target compiled. An empty suite is accepted on compilation alone.
 */
public final class UnitVerdict {

    private final String unitId;
    private final int attempt;
    private final List<CaseVerdict> cases;
    private final String targetCompilationFailure;

    public UnitVerdict(String unitId, int attempt, List<CaseVerdict> cases, String targetCompilationFailure) {
        this.unitId = Objects.requireNonNull(unitId, "unitId");
        this.attempt = attempt;
        this.cases = List.copyOf(cases);
        this.targetCompilationFailure = targetCompilationFailure;
    }

    public String unitId() {
        return unitId;
    }

    public int attempt() {
        return attempt;
    }

    /** Returns a copy of this verdict tagged with the given attempt. */
    public UnitVerdict forAttempt(int attempt) {
        return new UnitVerdict(unitId, attempt, cases, targetCompilationFailure);
    }

    public List<CaseVerdict> cases() {
        return cases;
    }

    public int total() {
        return cases.size();
    }

    public int passed() {
        return (int) cases.stream().filter(CaseVerdict::matched).count();
    }

    public int failed() {
        return total() - passed();
    }

    public Optional<String> targetCompilationFailure() {
        return Optional.ofNullable(targetCompilationFailure);
    }

    public boolean accepted() {
        return targetCompilationFailure == null && failed() == 0;
    }

    public List<CaseVerdict> mismatchedCases() {
        return cases.stream().filter(c -> !c.matched()).toList();
    }

    /** All differences of mismatched cases, keyed by case name in suite order. */
    public Map<String, List<Difference>> differences() {
        Map<String, List<Difference>> byCase = new LinkedHashMap<>();
        for (CaseVerdict c : mismatchedCases()) {
            byCase.put(c.caseName(), c.differences());
        }
        return byCase;
    }

    /** Short failure reason naming the first mismatches. */
    public String failureSummary(int maxCases) {
        if (accepted()) return "accepted";
        if (targetCompilationFailure != null && cases.isEmpty()) {
            return "target compilation failed";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(failed()).append('/').append(total()).append(" cases mismatched");
        List<CaseVerdict> mismatched = mismatchedCases();
        for (int i = 0; i < Math.min(maxCases, mismatched.size()); i++) {
            CaseVerdict c = mismatched.get(i);
            sb.append("; ").append(c.caseName()).append(' ').append(c.differences().get(0).describe());
        }
        return sb.toString();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("attempt", attempt);
        map.put("accepted", accepted());
        map.put("passed", passed());
        map.put("failed", failed());
        if (targetCompilationFailure != null) {
            map.put("targetCompilationFailure", targetCompilationFailure);
        }
        Map<String, Object> mismatches = new LinkedHashMap<>();
        for (CaseVerdict c : mismatchedCases()) {
            mismatches.put(c.caseName(), c.differences().stream().map(Difference::toMap).toList());
        }
        map.put("mismatches", mismatches);
        return map;
    }

    @Override
    public String toString() {
        return "UnitVerdict{unit=" + unitId + ", attempt=" + attempt + ", passed=" + passed()
                + "/" + total() + ", accepted=" + accepted() + '}';
    }
}

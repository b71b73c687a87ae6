package diffmigrator.validator;

import java.util.List;
import java.util.Objects;

/**
 * Comparison outcome of one test case.
 */
public record CaseVerdict(String caseName, String functionName, boolean matched, List<Difference> differences) {

    public CaseVerdict {
        Objects.requireNonNull(caseName, "caseName");
        differences = List.copyOf(differences);
        if (matched && !differences.isEmpty()) {
            throw new IllegalArgumentException("A matching case carries no differences: " + caseName);
        }
    }

    public static CaseVerdict match(String caseName, String functionName) {
        return new CaseVerdict(caseName, functionName, true, List.of());
    }

    public static CaseVerdict mismatch(String caseName, String functionName, List<Difference> differences) {
        if (differences.isEmpty()) {
            throw new IllegalArgumentException("A mismatch needs at least one difference: " + caseName);
        }
        return new CaseVerdict(caseName, functionName, false, differences);
    }
}

package diffmigrator.validator;

import diffmigrator.config.MigrationConfig;
import diffmigrator.executor.ExecutionResult;
import diffmigrator.executor.FailureKind;
import diffmigrator.executor.ResultSet;
import diffmigrator.oracle.TestCase;
import diffmigrator.oracle.TestSuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Compares baseline and target results case by case.
 *
 * <p>Integers, booleans, text and nulls must be equal. Floating point values
 * are compared with a {@link Tolerance}; two NaNs are equal, as are two
 * infinities of the same sign. Arrays compare element-wise. An output present
 * on one side only, or a case that failed on either side, is a mismatch with
 * a {@link ReasonCode} instead of a numeric delta.
 *
 * <p>Whether a case matches does not depend on which side is the baseline.
 */
public final class OutputValidator {

    private static final Logger log = LoggerFactory.getLogger(OutputValidator.class);

    private static final int REPORT_WIDTH = 70;

    private final Tolerance tolerance;
    private final boolean runtimeFailureParity;

    public OutputValidator(Tolerance tolerance, boolean runtimeFailureParity) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
        this.runtimeFailureParity = runtimeFailureParity;
    }

    public OutputValidator(Tolerance tolerance) {
        this(tolerance, false);
    }

    public static OutputValidator fromConfig(MigrationConfig config) {
        return new OutputValidator(config.tolerance(), config.runtimeFailureParity());
    }

    public Tolerance tolerance() {
        return tolerance;
    }

    /**
     * Validates target results against baseline results for every case of
     * the suite.
     *
     * @param suite the frozen suite
     * @param baseline results of the original code
     * @param target results of the converted code
     * @return the unit verdict, tagged as attempt 1
     */
    public UnitVerdict validate(TestSuite suite, ResultSet baseline, ResultSet target) {
        List<CaseVerdict> verdicts = new ArrayList<>(suite.size());
        for (TestCase tc : suite.cases()) {
            verdicts.add(validateCase(tc, baseline.result(tc.name()), target.result(tc.name())));
        }
        String compileFailure = target.compilationFailed() ? target.compilationDiagnostics() : null;
        UnitVerdict verdict = new UnitVerdict(suite.unitId(), 1, verdicts, compileFailure);
        log.debug("Validated unit {}: {}/{} cases matched", suite.unitId(), verdict.passed(), verdict.total());
        return verdict;
    }

    CaseVerdict validateCase(TestCase tc, Optional<ExecutionResult> baseline, Optional<ExecutionResult> target) {
        List<Difference> differences = new ArrayList<>();
        if (baseline.isEmpty() || target.isEmpty()) {
            differences.add(Difference.execution(ReasonCode.MISSING_RESULT,
                    baseline.isEmpty() ? "no baseline result" : "no target result"));
            return CaseVerdict.mismatch(tc.name(), tc.functionName(), differences);
        }
        ExecutionResult b = baseline.get();
        ExecutionResult t = target.get();

        if (!b.succeeded() || !t.succeeded()) {
            if (runtimeFailureParity
                    && b.failure() == FailureKind.RUNTIME_FAILURE
                    && t.failure() == FailureKind.RUNTIME_FAILURE) {
                return CaseVerdict.match(tc.name(), tc.functionName());
            }
            if (!b.succeeded()) differences.add(failureDifference(b, true));
            if (!t.succeeded()) differences.add(failureDifference(t, false));
            return CaseVerdict.mismatch(tc.name(), tc.functionName(), differences);
        }

        Set<String> names = new LinkedHashSet<>(b.outputs().keySet());
        names.addAll(t.outputs().keySet());
        for (String name : names) {
            OutputValue bv = b.outputs().get(name);
            OutputValue tv = t.outputs().get(name);
            if (bv == null || tv == null) {
                differences.add(Difference.of(name, bv, tv, ReasonCode.MISSING_OUTPUT));
            } else {
                compare(name, bv, tv, differences);
            }
        }
        return differences.isEmpty()
                ? CaseVerdict.match(tc.name(), tc.functionName())
                : CaseVerdict.mismatch(tc.name(), tc.functionName(), differences);
    }

    private static Difference failureDifference(ExecutionResult result, boolean baselineSide) {
        ReasonCode reason;
        if (result.failure() == FailureKind.COMPILATION_FAILURE) {
            reason = baselineSide ? ReasonCode.BASELINE_COMPILATION_FAILURE : ReasonCode.TARGET_COMPILATION_FAILURE;
        } else if (result.timedOut()) {
            reason = baselineSide ? ReasonCode.BASELINE_TIMEOUT : ReasonCode.TARGET_TIMEOUT;
        } else {
            reason = baselineSide ? ReasonCode.BASELINE_RUNTIME_FAILURE : ReasonCode.TARGET_RUNTIME_FAILURE;
        }
        String detail = result.describeFailure();
        if (!result.stderr().isBlank()) detail += ": " + result.stderr().strip();
        return Difference.execution(reason, detail);
    }

    /**
     * Compares one value pair, appending any differences found.
     */
    void compare(String name, OutputValue baseline, OutputValue target, List<Difference> differences) {
        if (baseline instanceof OutputValue.Floating bf && target instanceof OutputValue.Floating tf) {
            compareFloating(name, bf, tf, differences);
        } else if (baseline instanceof OutputValue.Array ba && target instanceof OutputValue.Array ta) {
            if (ba.elements().size() != ta.elements().size()) {
                differences.add(Difference.of(name, baseline, target, ReasonCode.LENGTH_MISMATCH));
                return;
            }
            for (int i = 0; i < ba.elements().size(); i++) {
                compare(name + "[" + i + "]", ba.elements().get(i), ta.elements().get(i), differences);
            }
        } else if (baseline.getClass() != target.getClass()) {
            differences.add(Difference.of(name, baseline, target, ReasonCode.KIND_MISMATCH));
        } else if (!exactlyEqual(baseline, target)) {
            differences.add(Difference.of(name, baseline, target, ReasonCode.VALUE_MISMATCH));
        }
    }

    private static boolean exactlyEqual(OutputValue a, OutputValue b) {
        if (a instanceof OutputValue.Integral ai && b instanceof OutputValue.Integral bi) {
            return ai.value() == bi.value();
        }
        return a.equals(b);
    }

    private void compareFloating(String name, OutputValue.Floating a, OutputValue.Floating b,
                                 List<Difference> differences) {
        double x = a.value();
        double y = b.value();
        if (Double.isNaN(x) || Double.isNaN(y)) {
            if (!(Double.isNaN(x) && Double.isNaN(y))) {
                differences.add(Difference.of(name, a, b, ReasonCode.SPECIAL_VALUE_MISMATCH));
            }
            return;
        }
        if (Double.isInfinite(x) || Double.isInfinite(y)) {
            if (x != y) {
                differences.add(Difference.of(name, a, b, ReasonCode.SPECIAL_VALUE_MISMATCH));
            }
            return;
        }
        boolean single = a.singlePrecision() || b.singlePrecision();
        if (!tolerance.accepts(x, y, single)) {
            differences.add(Difference.numeric(name, a, b, Math.abs(x - y)));
        }
    }

    /**
     * Renders a human readable report of a verdict.
     */
    public String report(UnitVerdict verdict) {
        String rule = "=".repeat(REPORT_WIDTH);
        StringBuilder sb = new StringBuilder();
        sb.append(rule).append('\n');
        sb.append("VALIDATION REPORT: ").append(verdict.unitId())
                .append(" (attempt ").append(verdict.attempt()).append(")\n");
        sb.append(rule).append('\n');

        int total = verdict.total();
        sb.append("Summary:\n");
        sb.append("  Total tests: ").append(total).append('\n');
        sb.append("  Passed: ").append(verdict.passed()).append(percent(verdict.passed(), total)).append('\n');
        sb.append("  Failed: ").append(verdict.failed()).append(percent(verdict.failed(), total)).append('\n');
        sb.append("  Accepted: ").append(verdict.accepted() ? "yes" : "no").append('\n');
        verdict.targetCompilationFailure().ifPresent(stderr ->
                sb.append("  Target compilation failed:\n").append(indent(stderr, "    ")).append('\n'));

        List<CaseVerdict> mismatched = verdict.mismatchedCases();
        if (!mismatched.isEmpty()) {
            sb.append('\n').append("Failed tests:\n").append("-".repeat(REPORT_WIDTH)).append('\n');
            for (CaseVerdict c : mismatched) {
                sb.append("x ").append(c.caseName()).append(" (").append(c.functionName()).append(")\n");
                for (Difference d : c.differences()) {
                    sb.append("    - ").append(d.describe()).append('\n');
                }
            }
        }
        sb.append(rule).append('\n');
        return sb.toString();
    }

    private static String percent(int part, int total) {
        if (total == 0) return "";
        return String.format(Locale.ROOT, " (%.1f%%)", part * 100.0 / total);
    }

    private static String indent(String text, String prefix) {
        return prefix + text.strip().replace("\n", "\n" + prefix);
    }
}

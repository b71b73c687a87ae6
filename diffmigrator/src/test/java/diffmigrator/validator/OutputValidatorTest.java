package diffmigrator.validator;

import diffmigrator.executor.Backend;
import diffmigrator.executor.ExecutionResult;
import diffmigrator.executor.ResultSet;
import diffmigrator.model.PrimitiveKind;
import diffmigrator.oracle.InputValue;
import diffmigrator.oracle.TestCase;
import diffmigrator.oracle.TestCategory;
import diffmigrator.oracle.TestSuite;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

@DisplayName("OutputValidator")
class OutputValidatorTest {

    private static final TestCase CASE = new TestCase("area_boundary_0", "area", TestCategory.BOUNDARY,
            Map.of("r", InputValue.of(PrimitiveKind.DOUBLE, 1.0)));

    private final OutputValidator validator = new OutputValidator(Tolerance.DEFAULT);

    private static OutputValue.Floating dbl(double value) {
        return new OutputValue.Floating(PrimitiveKind.DOUBLE, value);
    }

    private static OutputValue.Integral integer(long value) {
        return new OutputValue.Integral(PrimitiveKind.INT, value);
    }

    private static Optional<ExecutionResult> success(Backend backend, Map<String, OutputValue> outputs) {
        return Optional.of(ExecutionResult.success(CASE.name(), backend, outputs, 1));
    }

    private static Optional<ExecutionResult> crash(Backend backend, boolean timedOut) {
        return Optional.of(ExecutionResult.runtimeFailure(CASE.name(), backend, timedOut ? -1 : 139,
                "Segmentation fault", timedOut, 5));
    }

    private CaseVerdict compareReturn(OutputValidator v, OutputValue baseline, OutputValue target) {
        return v.validateCase(CASE,
                success(Backend.C, Map.of("return", baseline)),
                success(Backend.CSHARP, Map.of("return", target)));
    }

    @Nested
    @DisplayName("floating point comparison")
    class FloatingPoint {

        @Test
        @DisplayName("should reject 3.14159265 against 3.14159266 at default tolerance")
        void shouldRejectOutsideDefaultTolerance() {
            CaseVerdict verdict = compareReturn(validator, dbl(3.14159265), dbl(3.14159266));

            assertThat(verdict.matched()).isFalse();
            Difference difference = verdict.differences().get(0);
            assertThat(difference.reason()).isEqualTo(ReasonCode.OUTSIDE_TOLERANCE);
            assertThat(difference.delta()).isCloseTo(1e-8, offset(1e-12));
        }

        @Test
        @DisplayName("should accept 3.14159265 against 3.14159266 with a 1e-6 absolute tolerance")
        void shouldAcceptWithLooserTolerance() {
            OutputValidator loose = new OutputValidator(new Tolerance(1e-6, 1e-6, 0));

            assertThat(compareReturn(loose, dbl(3.14159265), dbl(3.14159266)).matched()).isTrue();
        }

        @Test
        @DisplayName("should decide a match regardless of which side is the baseline")
        void shouldBeSymmetric() {
            double[][] pairs = {{1.0, 1.0 + 1e-13}, {3.14159265, 3.14159266}, {0.0, -0.0},
                    {Double.NaN, 1.0}, {Double.POSITIVE_INFINITY, Double.MAX_VALUE}};

            for (double[] pair : pairs) {
                assertThat(compareReturn(validator, dbl(pair[0]), dbl(pair[1])).matched())
                        .as("%s vs %s", pair[0], pair[1])
                        .isEqualTo(compareReturn(validator, dbl(pair[1]), dbl(pair[0])).matched());
            }
        }

        @Test
        @DisplayName("should treat two NaNs as equal and one NaN as a special value mismatch")
        void shouldHandleNaN() {
            assertThat(compareReturn(validator, dbl(Double.NaN), dbl(Double.NaN)).matched()).isTrue();

            CaseVerdict verdict = compareReturn(validator, dbl(Double.NaN), dbl(0.0));
            assertThat(verdict.differences()).extracting(Difference::reason)
                    .containsExactly(ReasonCode.SPECIAL_VALUE_MISMATCH);
        }

        @Test
        @DisplayName("should require infinities to agree in sign")
        void shouldHandleInfinities() {
            assertThat(compareReturn(validator, dbl(Double.POSITIVE_INFINITY), dbl(Double.POSITIVE_INFINITY))
                    .matched()).isTrue();
            assertThat(compareReturn(validator, dbl(Double.POSITIVE_INFINITY), dbl(Double.NEGATIVE_INFINITY))
                    .differences()).extracting(Difference::reason)
                    .containsExactly(ReasonCode.SPECIAL_VALUE_MISMATCH);
        }

        @Test
        @DisplayName("should use the single precision threshold when either side is a float")
        void shouldUseSinglePrecisionThreshold() {
            OutputValue.Floating f = new OutputValue.Floating(PrimitiveKind.FLOAT, 1.0f);

            assertThat(compareReturn(validator, f, dbl(1.0 + 1e-7)).matched()).isTrue();
            assertThat(compareReturn(validator, dbl(1.0), dbl(1.0 + 1e-7)).matched()).isFalse();
        }
    }

    @Nested
    @DisplayName("value comparison")
    class Values {

        @Test
        @DisplayName("should require exact integer equality")
        void shouldCompareIntegersExactly() {
            assertThat(compareReturn(validator, integer(5), integer(5)).matched()).isTrue();
            assertThat(compareReturn(validator, integer(5), integer(6)).differences())
                    .extracting(Difference::reason).containsExactly(ReasonCode.VALUE_MISMATCH);
        }

        @Test
        @DisplayName("should compare arrays element-wise and name the failing index")
        void shouldCompareArrays() {
            OutputValue baseline = new OutputValue.Array(List.of(integer(1), integer(2), integer(3)));
            OutputValue target = new OutputValue.Array(List.of(integer(1), integer(9), integer(3)));

            CaseVerdict verdict = compareReturn(validator, baseline, target);

            assertThat(verdict.differences()).singleElement().satisfies(d -> {
                assertThat(d.name()).isEqualTo("return[1]");
                assertThat(d.reason()).isEqualTo(ReasonCode.VALUE_MISMATCH);
            });
        }

        @Test
        @DisplayName("should report arrays of different lengths once")
        void shouldReportLengthMismatch() {
            OutputValue baseline = new OutputValue.Array(List.of(integer(1), integer(2)));
            OutputValue target = new OutputValue.Array(List.of(integer(1)));

            assertThat(compareReturn(validator, baseline, target).differences())
                    .extracting(Difference::reason).containsExactly(ReasonCode.LENGTH_MISMATCH);
        }

        @Test
        @DisplayName("should report a kind mismatch between text and null")
        void shouldReportKindMismatch() {
            CaseVerdict verdict = compareReturn(validator, new OutputValue.Text("abc"), OutputValue.Null.INSTANCE);

            assertThat(verdict.differences()).extracting(Difference::reason)
                    .containsExactly(ReasonCode.KIND_MISMATCH);
        }

        @Test
        @DisplayName("should report outputs present on one side only")
        void shouldReportMissingOutputs() {
            CaseVerdict verdict = validator.validateCase(CASE,
                    success(Backend.C, Map.of("return", integer(1), "out", integer(2))),
                    success(Backend.CSHARP, Map.of("return", integer(1))));

            assertThat(verdict.differences()).singleElement().satisfies(d -> {
                assertThat(d.name()).isEqualTo("out");
                assertThat(d.reason()).isEqualTo(ReasonCode.MISSING_OUTPUT);
                assertThat(d.describe()).isEqualTo("out: expected 2, got <missing> [MISSING_OUTPUT]");
            });
        }
    }

    @Nested
    @DisplayName("execution failures")
    class ExecutionFailures {

        @Test
        @DisplayName("should report a target crash against a successful baseline")
        void shouldReportTargetCrash() {
            CaseVerdict verdict = validator.validateCase(CASE,
                    success(Backend.C, Map.of("return", integer(1))), crash(Backend.CSHARP, false));

            assertThat(verdict.matched()).isFalse();
            assertThat(verdict.differences()).singleElement().satisfies(d -> {
                assertThat(d.reason()).isEqualTo(ReasonCode.TARGET_RUNTIME_FAILURE);
                assertThat(d.detail()).contains("exit 139").contains("Segmentation fault");
            });
        }

        @Test
        @DisplayName("should report timeouts separately from crashes")
        void shouldReportTimeouts() {
            CaseVerdict verdict = validator.validateCase(CASE,
                    success(Backend.C, Map.of("return", integer(1))), crash(Backend.CSHARP, true));

            assertThat(verdict.differences()).extracting(Difference::reason)
                    .containsExactly(ReasonCode.TARGET_TIMEOUT);
        }

        @Test
        @DisplayName("should report both sides when both crash in strict mode")
        void shouldReportBothCrashesWhenStrict() {
            CaseVerdict verdict = validator.validateCase(CASE, crash(Backend.C, false), crash(Backend.CSHARP, false));

            assertThat(verdict.differences()).extracting(Difference::reason)
                    .containsExactly(ReasonCode.BASELINE_RUNTIME_FAILURE, ReasonCode.TARGET_RUNTIME_FAILURE);
        }

        @Test
        @DisplayName("should match two crashes when runtime failure parity is on")
        void shouldMatchBothCrashesWithParity() {
            OutputValidator lenient = new OutputValidator(Tolerance.DEFAULT, true);

            assertThat(lenient.validateCase(CASE, crash(Backend.C, false), crash(Backend.CSHARP, false)).matched())
                    .isTrue();
            assertThat(lenient.validateCase(CASE, crash(Backend.C, false),
                    success(Backend.CSHARP, Map.of("return", integer(1)))).matched()).isFalse();
        }

        @Test
        @DisplayName("should report a missing result")
        void shouldReportMissingResult() {
            CaseVerdict verdict = validator.validateCase(CASE,
                    success(Backend.C, Map.of("return", integer(1))), Optional.empty());

            assertThat(verdict.differences()).singleElement()
                    .satisfies(d -> assertThat(d.detail()).isEqualTo("no target result"));
        }
    }

    @Nested
    @DisplayName("unit verdicts")
    class UnitVerdicts {

        private TestSuite suite(int size) {
            TestSuite.Builder builder = TestSuite.builder("geometry", 42, EnumSet.of(TestCategory.BOUNDARY));
            for (int i = 0; i < size; i++) {
                builder.add(new TestCase("area_boundary_" + i, "area", TestCategory.BOUNDARY,
                        Map.of("r", InputValue.of(PrimitiveKind.DOUBLE, i))));
            }
            return builder.build();
        }

        private ResultSet results(TestSuite suite, Backend backend, double... values) {
            List<String> names = new ArrayList<>();
            suite.cases().forEach(c -> names.add(c.name()));
            ResultSet set = new ResultSet(suite.unitId(), backend, names);
            for (int i = 0; i < values.length; i++) {
                set.record(ExecutionResult.success(names.get(i), backend, Map.of("return", dbl(values[i])), 1));
            }
            return set;
        }

        @Test
        @DisplayName("should accept when every case matches")
        void shouldAcceptFullMatch() {
            TestSuite suite = suite(3);

            UnitVerdict verdict = validator.validate(suite,
                    results(suite, Backend.C, 0, 3.14, 12.56), results(suite, Backend.CSHARP, 0, 3.14, 12.56));

            assertThat(verdict.accepted()).isTrue();
            assertThat(verdict.passed()).isEqualTo(3);
            assertThat(verdict.attempt()).isEqualTo(1);
            assertThat(verdict.failureSummary(3)).isEqualTo("accepted");
        }

        @Test
        @DisplayName("should list mismatches in suite order")
        void shouldListMismatches() {
            TestSuite suite = suite(3);

            UnitVerdict verdict = validator.validate(suite,
                    results(suite, Backend.C, 0, 3.14, 12.56), results(suite, Backend.CSHARP, 1, 3.14, 12.0));

            assertThat(verdict.accepted()).isFalse();
            assertThat(verdict.failed()).isEqualTo(2);
            assertThat(verdict.differences()).containsOnlyKeys("area_boundary_0", "area_boundary_2");
            assertThat(verdict.failureSummary(1)).startsWith("2/3 cases mismatched; area_boundary_0 return:");
            assertThat(verdict.forAttempt(2).attempt()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject an empty suite whose target did not compile")
        void shouldRejectEmptySuiteWithCompileFailure() {
            TestSuite suite = suite(0);
            ResultSet target = results(suite, Backend.CSHARP);
            target.markCompilationFailed("error CS1002: ; expected");

            UnitVerdict verdict = validator.validate(suite, results(suite, Backend.C), target);

            assertThat(verdict.accepted()).isFalse();
            assertThat(verdict.targetCompilationFailure()).contains("error CS1002: ; expected");
            assertThat(verdict.failureSummary(3)).isEqualTo("target compilation failed");
        }

        @Test
        @DisplayName("should accept an empty suite whose target compiled")
        void shouldAcceptEmptySuite() {
            TestSuite suite = suite(0);

            assertThat(validator.validate(suite, results(suite, Backend.C), results(suite, Backend.CSHARP))
                    .accepted()).isTrue();
        }

        @Test
        @DisplayName("report should summarize and list failed tests")
        void reportShouldListFailures() {
            TestSuite suite = suite(2);
            UnitVerdict verdict = validator.validate(suite,
                    results(suite, Backend.C, 0, 1), results(suite, Backend.CSHARP, 0, 2));

            String report = validator.report(verdict);

            assertThat(report)
                    .contains("VALIDATION REPORT: geometry (attempt 1)")
                    .contains("Total tests: 2")
                    .contains("Passed: 1 (50.0%)")
                    .contains("Failed tests:")
                    .contains("x area_boundary_1 (area)")
                    .contains("return: expected 1, got 2 [OUTSIDE_TOLERANCE, delta=1.0]");
        }
    }
}

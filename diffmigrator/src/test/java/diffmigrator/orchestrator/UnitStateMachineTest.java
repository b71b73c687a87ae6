package diffmigrator.orchestrator;

import diffmigrator.model.ConversionStatus;
import diffmigrator.validator.CaseVerdict;
import diffmigrator.validator.Difference;
import diffmigrator.validator.ReasonCode;
import diffmigrator.validator.UnitVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UnitStateMachine")
class UnitStateMachineTest {

    private static final ConvertedArtifact ARTIFACT = new ConvertedArtifact("math", "public static class Math { }");

    private static UnitVerdict accepted(int attempt) {
        return new UnitVerdict("math", attempt, List.of(CaseVerdict.match("square_boundary_0", "square")), null);
    }

    private static UnitVerdict rejected(int attempt) {
        return new UnitVerdict("math", attempt, List.of(CaseVerdict.mismatch("square_boundary_0", "square",
                List.of(Difference.execution(ReasonCode.TARGET_RUNTIME_FAILURE, "exit 1")))), null);
    }

    private static UnitStateMachine started(int maxRetries) {
        UnitStateMachine m = new UnitStateMachine("math", maxRetries);
        m.markReady();
        m.start();
        return m;
    }

    @Nested
    @DisplayName("transitions")
    class Transitions {

        @Test
        @DisplayName("should walk pending, ready, in progress and converted")
        void shouldConvert() {
            UnitStateMachine m = new UnitStateMachine("math", 3);
            assertThat(m.status()).isEqualTo(ConversionStatus.PENDING);
            assertThat(m.attempt()).isZero();

            m.markReady();
            m.start();
            m.accept(ARTIFACT, accepted(1));

            assertThat(m.status()).isEqualTo(ConversionStatus.CONVERTED);
            assertThat(m.attempt()).isEqualTo(1);
            assertThat(m.artifact()).contains(ARTIFACT);
            assertThat(m.outcome()).contains(UnitOutcome.CONVERTED);
            assertThat(m.isDone()).isTrue();
        }

        @Test
        @DisplayName("should reject starting a unit that is not ready")
        void shouldRejectStartFromPending() {
            UnitStateMachine m = new UnitStateMachine("math", 3);

            assertThatThrownBy(m::start)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("PENDING");
        }

        @Test
        @DisplayName("should refuse to accept a rejected verdict")
        void shouldRefuseRejectedVerdict() {
            UnitStateMachine m = started(3);

            assertThatThrownBy(() -> m.accept(ARTIFACT, rejected(1))).isInstanceOf(IllegalStateException.class);
            assertThat(m.status()).isEqualTo(ConversionStatus.IN_PROGRESS);
        }
    }

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("should count attempts and fail after the last one")
        void shouldFailAfterMaxRetries() {
            UnitStateMachine m = started(3);

            assertThat(m.reject("mismatch 1", rejected(1))).isTrue();
            assertThat(m.attempt()).isEqualTo(2);
            assertThat(m.reject("generation failed", null)).isTrue();
            assertThat(m.attempt()).isEqualTo(3);
            assertThat(m.reject("mismatch 3", rejected(3))).isFalse();

            assertThat(m.status()).isEqualTo(ConversionStatus.FAILED);
            assertThat(m.attempt()).isEqualTo(3);
            assertThat(m.verdicts()).hasSize(2);
            assertThat(m.reason()).contains("mismatch 3");
            assertThat(m.lastRejection()).contains("mismatch 3");
        }

        @Test
        @DisplayName("should fail at once with a single allowed attempt")
        void shouldFailWithSingleAttempt() {
            UnitStateMachine m = started(1);

            assertThat(m.reject("mismatch", rejected(1))).isFalse();
            assertThat(m.outcome()).contains(UnitOutcome.FAILED);
        }

        @Test
        @DisplayName("should reject a non-positive retry limit")
        void shouldRejectInvalidLimit() {
            assertThatThrownBy(() -> new UnitStateMachine("math", 0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("skipping")
    class Skipping {

        @Test
        @DisplayName("should skip a unit that never started")
        void shouldSkipPendingUnit() {
            UnitStateMachine m = new UnitStateMachine("geometry", 3);

            m.skip("blocked by math (failed)");

            assertThat(m.isDone()).isTrue();
            assertThat(m.status()).isEqualTo(ConversionStatus.PENDING);
            assertThat(m.outcome()).contains(UnitOutcome.SKIPPED);
            assertThat(m.reason()).contains("blocked by math (failed)");
            assertThatThrownBy(m::markReady).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should not skip a terminal unit")
        void shouldNotSkipTerminalUnit() {
            UnitStateMachine m = started(3);
            m.fail("baseline compilation failed");

            assertThatThrownBy(() -> m.skip("cancelled")).isInstanceOf(IllegalStateException.class);
        }
    }
}

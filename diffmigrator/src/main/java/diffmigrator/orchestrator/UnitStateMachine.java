package diffmigrator.orchestrator;

import diffmigrator.executor.ResultSet;
import diffmigrator.model.ConversionStatus;
import diffmigrator.oracle.TestSuite;
import diffmigrator.validator.UnitVerdict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Conversion state of one unit.
 *
 * <p>Transitions:
 * <pre>
 * PENDING -> READY -> IN_PROGRESS -> CONVERTED
 *                                 -> FAILED
 * </pre>
 * {@code IN_PROGRESS} carries an attempt counter starting at 1. A rejected
 * attempt either increments the counter or, once it reaches {@code maxRetries},
 * moves the unit to {@code FAILED}. A unit that is not terminal may be marked
 * skipped, which ends it without a conversion status change.
 *
 * <p>Illegal transitions throw {@link IllegalStateException}. Not thread-safe;
 * owned by the orchestrator.
 */
public final class UnitStateMachine {

    private final String unitId;
    private final int maxRetries;

    private ConversionStatus status = ConversionStatus.PENDING;
    private int attempt;
    private TestSuite suite;
    private ResultSet baseline;
    private ConvertedArtifact artifact;
    private final List<UnitVerdict> verdicts = new ArrayList<>();
    private String lastRejection;
    private String failureReason;
    private String skipReason;

    public UnitStateMachine(String unitId, int maxRetries) {
        this.unitId = Objects.requireNonNull(unitId, "unitId");
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be at least 1");
        this.maxRetries = maxRetries;
    }

    public String unitId() {
        return unitId;
    }

    public ConversionStatus status() {
        return status;
    }

    /** Current attempt, 0 before the unit starts. */
    public int attempt() {
        return attempt;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public void markReady() {
        require(ConversionStatus.PENDING, "mark ready");
        status = ConversionStatus.READY;
    }

    public void start() {
        require(ConversionStatus.READY, "start");
        status = ConversionStatus.IN_PROGRESS;
        attempt = 1;
    }

    /** Attaches the frozen suite and the baseline results it was frozen from. */
    public void attachSuite(TestSuite suite, ResultSet baseline) {
        require(ConversionStatus.IN_PROGRESS, "attach suite");
        this.suite = Objects.requireNonNull(suite, "suite");
        this.baseline = Objects.requireNonNull(baseline, "baseline");
    }

    public Optional<TestSuite> suite() {
        return Optional.ofNullable(suite);
    }

    public Optional<ResultSet> baseline() {
        return Optional.ofNullable(baseline);
    }

    /**
     * Accepts the current attempt.
     */
    public void accept(ConvertedArtifact artifact, UnitVerdict verdict) {
        require(ConversionStatus.IN_PROGRESS, "accept");
        if (!verdict.accepted()) {
            throw new IllegalStateException("Unit " + unitId + " cannot be accepted with a rejected verdict");
        }
        this.artifact = Objects.requireNonNull(artifact, "artifact");
        verdicts.add(verdict);
        status = ConversionStatus.CONVERTED;
    }

    /**
     * Rejects the current attempt.
     *
     * @param reason why the attempt was rejected
     * @param verdict the verdict, or null when no code was produced
     * @return true if another attempt follows, false if the unit is now failed
     */
    public boolean reject(String reason, UnitVerdict verdict) {
        require(ConversionStatus.IN_PROGRESS, "reject");
        lastRejection = reason;
        if (verdict != null) verdicts.add(verdict);
        if (attempt < maxRetries) {
            attempt++;
            return true;
        }
        failureReason = reason;
        status = ConversionStatus.FAILED;
        return false;
    }

    /** Fails the unit immediately, without retry. */
    public void fail(String reason) {
        require(ConversionStatus.IN_PROGRESS, "fail");
        failureReason = reason;
        status = ConversionStatus.FAILED;
    }

    /** Ends a unit that never converted or failed. */
    public void skip(String reason) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Unit " + unitId + " is already " + status);
        }
        skipReason = reason;
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    /** True once the unit converted, failed or was skipped. */
    public boolean isDone() {
        return status.isTerminal() || isSkipped();
    }

    public Optional<UnitOutcome> outcome() {
        if (status == ConversionStatus.CONVERTED) return Optional.of(UnitOutcome.CONVERTED);
        if (status == ConversionStatus.FAILED) return Optional.of(UnitOutcome.FAILED);
        if (isSkipped()) return Optional.of(UnitOutcome.SKIPPED);
        return Optional.empty();
    }

    public Optional<ConvertedArtifact> artifact() {
        return Optional.ofNullable(artifact);
    }

    public List<UnitVerdict> verdicts() {
        return Collections.unmodifiableList(verdicts);
    }

    public Optional<UnitVerdict> lastVerdict() {
        return verdicts.isEmpty() ? Optional.empty() : Optional.of(verdicts.get(verdicts.size() - 1));
    }

    /** Reason the most recent attempt was rejected, if any. */
    public Optional<String> lastRejection() {
        return Optional.ofNullable(lastRejection);
    }

    /** Failure or skip reason; empty for converted and unfinished units. */
    public Optional<String> reason() {
        if (failureReason != null) return Optional.of(failureReason);
        return Optional.ofNullable(skipReason);
    }

    private void require(ConversionStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Cannot " + action + " unit " + unitId + " in state " + status + ", expected " + expected);
        }
        if (isSkipped()) {
            throw new IllegalStateException("Cannot " + action + " skipped unit " + unitId);
        }
    }

    @Override
    public String toString() {
        return "UnitStateMachine{unit=" + unitId + ", status=" + status + ", attempt=" + attempt
                + (isSkipped() ? ", skipped" : "") + '}';
    }
}

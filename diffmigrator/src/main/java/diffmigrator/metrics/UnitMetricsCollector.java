package diffmigrator.metrics;

import diffmigrator.metrics.UnitMetrics.Phase;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Collects per-phase timings while one unit moves through the pipeline.
 *
 * <h2>Usage:</h2>
 * <pre>
 * UnitMetricsCollector collector = new UnitMetricsCollector().start("math_utils");
 * TestSuite suite = collector.timed(Phase.GENERATE, () -&gt; generator.generateForUnit(unit, ...));
 * collector.attempt();
 * UnitMetrics metrics = collector.finish();
 * </pre>
 *
 * <p>Not thread safe; each unit gets its own collector.
 *
 * @see UnitMetrics
 */
public final class UnitMetricsCollector {

    private final Map<Phase, Long> phaseDurations = new EnumMap<>(Phase.class);

    private String unitId;
    private Instant startTime;
    private int attempts;
    private int testCases;

    /**
     * Starts collection for a unit, discarding anything recorded before.
     *
     * @param unitId the unit being migrated
     * @return this collector for method chaining
     */
    public UnitMetricsCollector start(String unitId) {
        this.unitId = unitId;
        this.startTime = Instant.now();
        this.phaseDurations.clear();
        this.attempts = 0;
        this.testCases = 0;
        return this;
    }

    /** A pipeline phase; phases block on subprocesses and may be interrupted. */
    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E, InterruptedException;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E, InterruptedException;
    }

    /**
     * Time a phase and run the action (can throw checked exceptions).
     * Repeated phases accumulate.
     */
    public <E extends Exception> void timed(Phase phase, ThrowingRunnable<E> action)
            throws E, InterruptedException {
        long start = System.nanoTime();
        try {
            action.run();
        } finally {
            record(phase, start);
        }
    }

    /**
     * Time a phase and return the result (can throw checked exceptions).
     */
    public <T, E extends Exception> T timed(Phase phase, ThrowingSupplier<T, E> action)
            throws E, InterruptedException {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            record(phase, start);
        }
    }

    private void record(Phase phase, long startNanos) {
        long elapsed = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        phaseDurations.merge(phase, elapsed, Long::sum);
    }

    /** Counts one conversion attempt. */
    public UnitMetricsCollector attempt() {
        attempts++;
        return this;
    }

    public UnitMetricsCollector testCases(int count) {
        this.testCases = count;
        return this;
    }

    /**
     * Finishes collection and returns the metrics.
     *
     * @return the collected metrics
     * @throws IllegalStateException if {@link #start(String)} was not called
     */
    public UnitMetrics finish() {
        if (startTime == null) {
            throw new IllegalStateException("Collector not started");
        }
        Instant endTime = Instant.now();
        return new UnitMetrics(unitId, startTime, endTime, phaseDurations,
                Duration.between(startTime, endTime).toMillis(), attempts, testCases);
    }
}

package diffmigrator.config;

import diffmigrator.executor.ExecutionMode;
import diffmigrator.oracle.TestCategory;
import diffmigrator.orchestrator.CyclePolicy;
import diffmigrator.orchestrator.SuiteRegeneration;
import diffmigrator.validator.Tolerance;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Central configuration for a migration run.
 *
 * <p>This class encapsulates all configurable parameters of the engine:
 * <ul>
 *   <li>Retry budget and suite handling between attempts</li>
 *   <li>Compile, execute and convert timeouts</li>
 *   <li>Floating point tolerances</li>
 *   <li>Test generation: strategies, seed, random count and per-function cap</li>
 *   <li>Executor mode and worker count</li>
 *   <li>Cycle policy and alert level</li>
 * </ul>
 *
 * <p>Configuration can be loaded from {@code migration.properties} or
 * {@code migration.yml} using {@link MigrationConfigLoader}.
 *
 * @see MigrationConfigLoader
 */
public final class MigrationConfig {

    public static final MigrationConfig DEFAULTS = builder().build();

    private final int maxRetries;
    private final SuiteRegeneration suiteRegeneration;
    private final Duration compileTimeout;
    private final Duration executeTimeout;
    private final Duration convertTimeout;
    private final Tolerance tolerance;
    private final int maxTestsPerFunction;
    private final int randomCount;
    private final long seed;
    private final Set<TestCategory> strategies;
    private final ExecutionMode executionMode;
    private final int workers;
    private final CyclePolicy cyclePolicy;
    private final boolean runtimeFailureParity;
    private final AlertLevel alertLevel;

    private MigrationConfig(Builder b) {
        this.maxRetries = b.maxRetries;
        this.suiteRegeneration = b.suiteRegeneration;
        this.compileTimeout = b.compileTimeout;
        this.executeTimeout = b.executeTimeout;
        this.convertTimeout = b.convertTimeout;
        this.tolerance = new Tolerance(b.floatAbsolute, b.doubleAbsolute, b.relative);
        this.maxTestsPerFunction = b.maxTestsPerFunction;
        this.randomCount = b.randomCount;
        this.seed = b.seed;
        this.strategies = Collections.unmodifiableSet(EnumSet.copyOf(b.strategies));
        this.executionMode = b.executionMode;
        this.workers = b.workers;
        this.cyclePolicy = b.cyclePolicy;
        this.runtimeFailureParity = b.runtimeFailureParity;
        this.alertLevel = b.alertLevel;
    }

    /**
     * Creates a new configuration builder.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the maximum number of conversion attempts per unit. */
    public int maxRetries() { return maxRetries; }

    /** Returns whether suites are reused or partly regenerated between attempts. */
    public SuiteRegeneration suiteRegeneration() { return suiteRegeneration; }

    /** Returns the timeout for a single compilation. */
    public Duration compileTimeout() { return compileTimeout; }

    /** Returns the timeout for a single harness execution. */
    public Duration executeTimeout() { return executeTimeout; }

    /** Returns the timeout for one code generator call, or zero if unbounded. */
    public Duration convertTimeout() { return convertTimeout; }

    public Tolerance tolerance() { return tolerance; }

    public int maxTestsPerFunction() { return maxTestsPerFunction; }

    /** Returns the number of random cases generated per function. */
    public int randomCount() { return randomCount; }

    public long seed() { return seed; }

    /** Returns the enabled test strategies. */
    public Set<TestCategory> strategies() { return strategies; }

    public ExecutionMode executionMode() { return executionMode; }

    /** Returns the worker count for per-case execution. */
    public int workers() { return workers; }

    public CyclePolicy cyclePolicy() { return cyclePolicy; }

    /** Returns true if a runtime failure on both sides counts as a match. */
    public boolean runtimeFailureParity() { return runtimeFailureParity; }

    /** Returns the alert level for event logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    @Override
    public String toString() {
        return "MigrationConfig{" +
                "maxRetries=" + maxRetries +
                ", suiteRegeneration=" + suiteRegeneration +
                ", compileTimeout=" + compileTimeout.toSeconds() + "s" +
                ", executeTimeout=" + executeTimeout.toSeconds() + "s" +
                ", convertTimeout=" + convertTimeout.toSeconds() + "s" +
                ", tolerance=" + tolerance +
                ", strategies=" + strategies +
                ", seed=" + seed +
                ", executionMode=" + executionMode +
                ", workers=" + workers +
                ", cyclePolicy=" + cyclePolicy +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for constructing {@link MigrationConfig} instances.
     */
    public static final class Builder {
        private int maxRetries = 3;
        private SuiteRegeneration suiteRegeneration = SuiteRegeneration.REUSE;
        private Duration compileTimeout = Duration.ofSeconds(60);
        private Duration executeTimeout = Duration.ofSeconds(30);
        private Duration convertTimeout = Duration.ofSeconds(300);
        private double floatAbsolute = Tolerance.DEFAULT.floatAbsolute();
        private double doubleAbsolute = Tolerance.DEFAULT.doubleAbsolute();
        private double relative = Tolerance.DEFAULT.relative();
        private int maxTestsPerFunction = 100;
        private int randomCount = 5;
        private long seed = 42L;
        private Set<TestCategory> strategies = EnumSet.allOf(TestCategory.class);
        private ExecutionMode executionMode = ExecutionMode.PER_CASE;
        private int workers = Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));
        private CyclePolicy cyclePolicy = CyclePolicy.ABORT;
        private boolean runtimeFailureParity = false;
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder maxRetries(int retries) {
            if (retries <= 0) throw new IllegalArgumentException("maxRetries must be positive");
            this.maxRetries = retries;
            return this;
        }

        public Builder suiteRegeneration(SuiteRegeneration mode) {
            this.suiteRegeneration = mode;
            return this;
        }

        public Builder compileTimeout(Duration timeout) {
            this.compileTimeout = timeout;
            return this;
        }

        public Builder compileTimeoutSeconds(long seconds) {
            return compileTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder executeTimeout(Duration timeout) {
            this.executeTimeout = timeout;
            return this;
        }

        public Builder executeTimeoutSeconds(long seconds) {
            return executeTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder convertTimeout(Duration timeout) {
            this.convertTimeout = timeout;
            return this;
        }

        public Builder convertTimeoutSeconds(long seconds) {
            return convertTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder floatTolerance(double absolute) {
            this.floatAbsolute = absolute;
            return this;
        }

        public Builder doubleTolerance(double absolute) {
            this.doubleAbsolute = absolute;
            return this;
        }

        public Builder relativeTolerance(double relative) {
            this.relative = relative;
            return this;
        }

        public Builder maxTestsPerFunction(int max) {
            if (max <= 0) throw new IllegalArgumentException("maxTestsPerFunction must be positive");
            this.maxTestsPerFunction = max;
            return this;
        }

        public Builder randomCount(int count) {
            if (count < 0) throw new IllegalArgumentException("randomCount must not be negative");
            this.randomCount = count;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder strategies(Set<TestCategory> strategies) {
            if (strategies.isEmpty()) throw new IllegalArgumentException("at least one strategy is required");
            this.strategies = EnumSet.copyOf(strategies);
            return this;
        }

        public Builder executionMode(ExecutionMode mode) {
            this.executionMode = mode;
            return this;
        }

        public Builder workers(int workers) {
            if (workers <= 0) throw new IllegalArgumentException("workers must be positive");
            this.workers = workers;
            return this;
        }

        public Builder cyclePolicy(CyclePolicy policy) {
            this.cyclePolicy = policy;
            return this;
        }

        public Builder runtimeFailureParity(boolean enabled) {
            this.runtimeFailureParity = enabled;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a tolerance is negative
         */
        public MigrationConfig build() {
            return new MigrationConfig(this);
        }
    }
}

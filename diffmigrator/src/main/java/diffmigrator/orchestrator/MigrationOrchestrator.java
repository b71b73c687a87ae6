package diffmigrator.orchestrator;

import diffmigrator.alert.MigrationAlertLogger;
import diffmigrator.config.MigrationConfig;
import diffmigrator.exceptions.CyclicDependencyException;
import diffmigrator.exceptions.GenerationFailureException;
import diffmigrator.exceptions.MigrationTimeoutException;
import diffmigrator.executor.DifferentialExecutor;
import diffmigrator.executor.ResultSet;
import diffmigrator.graph.DependencyEdge;
import diffmigrator.graph.DependencyGraph;
import diffmigrator.metrics.UnitMetrics;
import diffmigrator.metrics.UnitMetrics.Phase;
import diffmigrator.metrics.UnitMetricsCollector;
import diffmigrator.model.ConversionStatus;
import diffmigrator.model.ProgramModel;
import diffmigrator.model.TranslationUnit;
import diffmigrator.oracle.OracleGenerator;
import diffmigrator.oracle.TestCategory;
import diffmigrator.oracle.TestSuite;
import diffmigrator.report.MigrationReport;
import diffmigrator.report.UnitReport;
import diffmigrator.validator.OutputValidator;
import diffmigrator.validator.UnitVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the migration of a program model, one unit at a time, in dependency
 * order.
 *
 * <p>For each ready unit the pipeline is:
 * <ol>
 *   <li>generate the test suite (once, unless retries regenerate random cases)</li>
 *   <li>run it against the original code; a baseline compilation failure fails
 *       the unit without retry</li>
 *   <li>request converted code from the {@link CodeGenerator}</li>
 *   <li>run the suite against the converted code and validate</li>
 *   <li>accept and unblock dependents, or retry up to {@code maxRetries}
 *       attempts with feedback, then fail</li>
 * </ol>
 *
 * <p>Units that never become ready are reported skipped. Unit-level failures
 * are recorded in the report; only a dependency cycle under
 * {@link CyclePolicy#ABORT} escapes {@link #run()}.
 *
 * <p>{@link #cancel()} may be called from another thread. It is honoured
 * between pipeline steps and interrupts running subprocesses; the unit in
 * progress and every unit not yet started are reported skipped.
 */
public final class MigrationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MigrationOrchestrator.class);

    static final String CANCELLED = "cancelled";
    private static final int FEEDBACK_CASES = 3;

    private final ProgramModel model;
    private final CodeGenerator codeGenerator;
    private final DifferentialExecutor executor;
    private final OracleGenerator oracle;
    private final OutputValidator validator;
    private final MigrationAlertLogger alerts;
    private final MigrationConfig config;

    private final DependencyGraph graph;
    private final Map<String, UnitStateMachine> machines = new TreeMap<>();
    private final Map<String, UnitMetrics> metrics = new HashMap<>();
    private final List<String> conversionOrder = new ArrayList<>();
    private List<String> priority = List.of();

    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean cancelled;
    private volatile Thread runner;

    public MigrationOrchestrator(ProgramModel model, CodeGenerator codeGenerator, DifferentialExecutor executor,
                                 MigrationConfig config) {
        this(model, codeGenerator, executor, OracleGenerator.fromConfig(config),
                OutputValidator.fromConfig(config), new MigrationAlertLogger(config.alertLevel()), config);
    }

    public MigrationOrchestrator(ProgramModel model, CodeGenerator codeGenerator, DifferentialExecutor executor,
                                 OracleGenerator oracle, OutputValidator validator,
                                 MigrationAlertLogger alerts, MigrationConfig config) {
        this.model = Objects.requireNonNull(model, "model");
        this.codeGenerator = Objects.requireNonNull(codeGenerator, "codeGenerator");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.alerts = Objects.requireNonNull(alerts, "alerts");
        this.config = Objects.requireNonNull(config, "config");
        this.graph = model.buildGraph();
        for (String id : model.unitIds()) {
            machines.put(id, new UnitStateMachine(id, config.maxRetries()));
        }
    }

    /**
     * Sets the preferred order among units that are ready at the same time.
     * Listed units go first, in list order; the rest follow by id.
     *
     * @return this orchestrator for method chaining
     */
    public MigrationOrchestrator withPriority(List<String> unitIds) {
        this.priority = List.copyOf(unitIds);
        return this;
    }

    public DependencyGraph graph() {
        return graph;
    }

    public Optional<UnitStateMachine> state(String unitId) {
        return Optional.ofNullable(machines.get(unitId));
    }

    /** Current conversion status of every unit. */
    public Map<String, ConversionStatus> statuses() {
        Map<String, ConversionStatus> statuses = new TreeMap<>();
        machines.forEach((id, m) -> statuses.put(id, m.status()));
        return statuses;
    }

    /**
     * Requests cancellation. The current pipeline step is interrupted and no
     * further unit is started.
     */
    public void cancel() {
        cancelled = true;
        Thread t = runner;
        if (t != null) {
            log.info("Cancelling migration run");
            t.interrupt();
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Runs the migration. May be called once.
     *
     * @return the per-unit outcome report
     * @throws CyclicDependencyException if the graph has cycles and the policy is {@link CyclePolicy#ABORT}
     */
    public MigrationReport run() throws CyclicDependencyException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("A migration run can only be started once");
        }
        long startNanos = System.nanoTime();
        runner = Thread.currentThread();
        try {
            alerts.runStarted(machines.size());
            List<Set<String>> cycles = graph.detectCycles();
            List<DependencyEdge> severed = handleCycles(cycles);

            while (!stopRequested()) {
                refreshReady();
                Optional<UnitStateMachine> next = pickNext();
                if (next.isEmpty()) break;
                conversionOrder.add(next.get().unitId());
                runUnit(next.get());
            }
            skipRemaining();

            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            MigrationReport report = buildReport(cycles, severed, durationMs);
            alerts.runCompleted(report.count(UnitOutcome.CONVERTED), report.count(UnitOutcome.FAILED),
                    report.count(UnitOutcome.SKIPPED), durationMs);
            return report;
        } finally {
            runner = null;
        }
    }

    private List<DependencyEdge> handleCycles(List<Set<String>> cycles) throws CyclicDependencyException {
        if (cycles.isEmpty()) return List.of();
        if (config.cyclePolicy() == CyclePolicy.ABORT) {
            cycles.forEach(c -> alerts.cycleDetected(c, "abort"));
            throw new CyclicDependencyException(cycles);
        }
        cycles.forEach(c -> alerts.cycleDetected(c, "break"));
        List<DependencyEdge> severed = graph.breakCycles();
        log.warn("Broke {} dependency cycle(s) by removing {}", cycles.size(), severed);
        return severed;
    }

    private void refreshReady() {
        for (String id : graph.readySet(statuses())) {
            UnitStateMachine m = machines.get(id);
            if (m.status() == ConversionStatus.PENDING && !m.isSkipped()) {
                m.markReady();
            }
        }
    }

    private Optional<UnitStateMachine> pickNext() {
        return machines.values().stream()
                .filter(m -> m.status() == ConversionStatus.READY && !m.isSkipped())
                .min(Comparator.comparingInt((UnitStateMachine m) -> priorityOf(m.unitId()))
                        .thenComparing(UnitStateMachine::unitId));
    }

    private int priorityOf(String unitId) {
        int index = priority.indexOf(unitId);
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    // ===== unit pipeline =====

    private void runUnit(UnitStateMachine m) {
        String id = m.unitId();
        TranslationUnit unit = model.unit(id).orElseThrow();
        List<TranslationUnit> dependencies = transitiveDependencies(id).stream()
                .map(dep -> model.unit(dep).orElseThrow())
                .toList();

        m.start();
        alerts.unitStarted(id, model.dependenciesOf(id).size());
        UnitMetricsCollector collector = new UnitMetricsCollector().start(id);
        try {
            if (!prepareSuite(m, unit, dependencies, config.seed(), collector)) return;
            while (true) {
                checkCancelled();
                if (m.attempt() > 1 && regeneratesOnRetry()) {
                    long seed = config.seed() + m.attempt() - 1;
                    log.debug("Regenerating suite of unit {} with seed {}", id, seed);
                    if (!prepareSuite(m, unit, dependencies, seed, collector)) return;
                }
                collector.attempt();
                if (!attemptConversion(m, unit, collector)) return;
            }
        } catch (InterruptedException e) {
            cancelled = true;
            if (!m.isDone()) {
                m.skip(CANCELLED);
                alerts.unitSkipped(id, CANCELLED);
            }
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Unexpected error migrating unit {}", id, e);
            if (!m.isDone()) {
                String reason = "internal error: " + e;
                m.fail(reason);
                alerts.unitFailed(id, m.attempt(), reason);
            }
        } finally {
            UnitMetrics unitMetrics = collector.finish();
            metrics.put(id, unitMetrics);
            if (m.status() == ConversionStatus.CONVERTED) {
                alerts.unitConverted(id, m.attempt(), m.suite().map(TestSuite::size).orElse(0),
                        unitMetrics.totalDurationMs());
            }
        }
    }

    private boolean regeneratesOnRetry() {
        return config.suiteRegeneration() == SuiteRegeneration.REGENERATE_RANDOM
                && config.strategies().contains(TestCategory.RANDOM);
    }

    /**
     * Generates the suite, runs it against the original code and freezes it
     * with the baseline outputs.
     *
     * @return false if the baseline failed to compile and the unit is now failed
     */
    private boolean prepareSuite(UnitStateMachine m, TranslationUnit unit, List<TranslationUnit> dependencies,
                                 long seed, UnitMetricsCollector collector) throws InterruptedException {
        TestSuite suite = collector.timed(Phase.GENERATE,
                () -> oracle.generateForUnit(unit, config.strategies(), seed));
        collector.testCases(suite.size());
        checkCancelled();

        ResultSet baseline = collector.timed(Phase.BASELINE,
                () -> executor.runBaseline(unit, dependencies, suite));
        if (baseline.compilationFailed()) {
            String reason = "baseline compilation failed: " + firstLine(baseline.compilationDiagnostics());
            m.fail(reason);
            alerts.unitFailed(unit.id(), m.attempt(), reason);
            return false;
        }
        m.attachSuite(suite.withExpectedOutputs(baseline.outputsByCase()), baseline);
        return true;
    }

    /**
     * Runs one conversion attempt.
     *
     * @return true if another attempt should follow
     */
    private boolean attemptConversion(UnitStateMachine m, TranslationUnit unit, UnitMetricsCollector collector)
            throws InterruptedException {
        String id = unit.id();
        int attempt = m.attempt();
        List<ConvertedArtifact> dependencyArtifacts = dependencyArtifacts(id);
        ConversionRequest request = new ConversionRequest(unit, attempt,
                m.lastVerdict().orElse(null), m.lastRejection().orElse(null), dependencyArtifacts);

        ConvertedArtifact artifact;
        try {
            artifact = collector.timed(Phase.CONVERT, () -> TimeoutExecutor.executeWithTimeout(
                    "convert " + id, config.convertTimeout(), () -> codeGenerator.convert(request)));
        } catch (GenerationFailureException e) {
            return reject(m, "code generation failed: " + e.getMessage(), null);
        } catch (MigrationTimeoutException e) {
            alerts.phaseTimeout(id, Phase.CONVERT, e.getTimeout());
            return reject(m, "code generation timed out after " + e.getTimeout().toSeconds() + "s", null);
        }
        checkCancelled();

        TestSuite suite = m.suite().orElseThrow();
        ResultSet baseline = m.baseline().orElseThrow();
        ResultSet target = collector.timed(Phase.TARGET,
                () -> executor.runTarget(unit, artifact, dependencyArtifacts, suite));
        UnitVerdict verdict = collector.timed(Phase.VALIDATE,
                () -> validator.validate(suite, baseline, target)).forAttempt(attempt);
        if (log.isDebugEnabled()) {
            log.debug("Attempt {} of unit {}:\n{}", attempt, id, validator.report(verdict));
        }

        if (verdict.accepted()) {
            m.accept(artifact, verdict);
            graph.markConverted(id);
            return false;
        }
        return reject(m, verdict.failureSummary(FEEDBACK_CASES), verdict);
    }

    private boolean reject(UnitStateMachine m, String reason, UnitVerdict verdict) {
        int attempt = m.attempt();
        alerts.attemptRejected(m.unitId(), attempt, reason);
        boolean retry = m.reject(reason, verdict);
        if (!retry) {
            alerts.unitFailed(m.unitId(), attempt, reason);
        }
        return retry;
    }

    private void checkCancelled() throws InterruptedException {
        if (stopRequested()) {
            throw new InterruptedException("Migration cancelled");
        }
    }

    private boolean stopRequested() {
        return cancelled || Thread.currentThread().isInterrupted();
    }

    private List<String> transitiveDependencies(String unitId) {
        Set<String> seen = new TreeSet<>();
        Deque<String> todo = new ArrayDeque<>(model.dependenciesOf(unitId));
        while (!todo.isEmpty()) {
            String dep = todo.pop();
            if (dep.equals(unitId) || !seen.add(dep)) continue;
            todo.addAll(model.dependenciesOf(dep));
        }
        return new ArrayList<>(seen);
    }

    private List<ConvertedArtifact> dependencyArtifacts(String unitId) {
        List<ConvertedArtifact> artifacts = new ArrayList<>();
        for (String dep : transitiveDependencies(unitId)) {
            machines.get(dep).artifact().ifPresent(artifacts::add);
        }
        return artifacts;
    }

    // ===== reporting =====

    private void skipRemaining() {
        Map<String, ConversionStatus> statuses = statuses();
        for (UnitStateMachine m : machines.values()) {
            if (m.isDone()) continue;
            String reason = cancelled ? CANCELLED : blockedReason(m.unitId(), statuses);
            m.skip(reason);
            alerts.unitSkipped(m.unitId(), reason);
        }
    }

    private String blockedReason(String unitId, Map<String, ConversionStatus> statuses) {
        StringJoiner blockers = new StringJoiner(", ", "blocked by ", "");
        blockers.setEmptyValue("never became ready");
        for (String dep : graph.dependenciesOf(unitId)) {
            ConversionStatus status = statuses.get(dep);
            if (status == ConversionStatus.FAILED) {
                blockers.add(dep + " (failed)");
            } else if (status != ConversionStatus.CONVERTED) {
                blockers.add(dep + " (not converted)");
            }
        }
        return blockers.toString();
    }

    private MigrationReport buildReport(List<Set<String>> cycles, List<DependencyEdge> severed, long durationMs) {
        List<UnitReport> reports = new ArrayList<>();
        for (UnitStateMachine m : machines.values()) {
            reports.add(new UnitReport(m.unitId(), m.outcome().orElseThrow(), m.attempt(), m.verdicts(),
                    m.reason().orElse(""), model.dependenciesOf(m.unitId()), metrics.get(m.unitId())));
        }
        return new MigrationReport(reports, conversionOrder, cycles, severed, graph.statistics(),
                cancelled, durationMs);
    }

    private static String firstLine(String text) {
        String trimmed = text.strip();
        int nl = trimmed.indexOf('\n');
        return nl < 0 ? trimmed : trimmed.substring(0, nl);
    }
}

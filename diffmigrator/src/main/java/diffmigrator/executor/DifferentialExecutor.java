package diffmigrator.executor;

import diffmigrator.config.MigrationConfig;
import diffmigrator.exceptions.CompilationException;
import diffmigrator.model.FunctionDecl;
import diffmigrator.model.IncludeDirective;
import diffmigrator.model.TranslationUnit;
import diffmigrator.oracle.TestCase;
import diffmigrator.oracle.TestSuite;
import diffmigrator.orchestrator.ConvertedArtifact;
import diffmigrator.validator.OutputValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a test suite against the original sources and against converted
 * sources, under identical inputs.
 *
 * <p>For each side the executor writes the sources and a generated harness
 * into a fresh {@link Workspace}, compiles once, then runs the artifact
 * either once per case on a bounded worker pool ({@link ExecutionMode#PER_CASE})
 * or once for the whole suite ({@link ExecutionMode#BATCH}). A compilation
 * failure is recorded for every case; execution failures only for the
 * affected case. When a batch process dies, the cases it did not report are
 * run again one at a time. The workspace is removed on every exit path.
 */
public final class DifferentialExecutor {

    private static final Logger log = LoggerFactory.getLogger(DifferentialExecutor.class);

    private final Toolchain sourceToolchain;
    private final HarnessGenerator sourceHarness;
    private final Toolchain targetToolchain;
    private final HarnessGenerator targetHarness;
    private final ExecutionMode mode;
    private final int workers;
    private final Duration compileTimeout;
    private final Duration executeTimeout;

    public DifferentialExecutor(Toolchain sourceToolchain, HarnessGenerator sourceHarness,
                                Toolchain targetToolchain, HarnessGenerator targetHarness,
                                ExecutionMode mode, int workers,
                                Duration compileTimeout, Duration executeTimeout) {
        this.sourceToolchain = Objects.requireNonNull(sourceToolchain, "sourceToolchain");
        this.sourceHarness = Objects.requireNonNull(sourceHarness, "sourceHarness");
        this.targetToolchain = Objects.requireNonNull(targetToolchain, "targetToolchain");
        this.targetHarness = Objects.requireNonNull(targetHarness, "targetHarness");
        this.mode = Objects.requireNonNull(mode, "mode");
        if (workers <= 0) throw new IllegalArgumentException("workers must be positive");
        this.workers = workers;
        this.compileTimeout = compileTimeout;
        this.executeTimeout = executeTimeout;
    }

    /**
     * Creates an executor for C sources and C# targets with the configured
     * mode, worker count and timeouts.
     */
    public static DifferentialExecutor fromConfig(MigrationConfig config, Toolchain sourceToolchain,
                                                  Toolchain targetToolchain) {
        return new DifferentialExecutor(sourceToolchain, new CHarnessGenerator(),
                targetToolchain, new CSharpHarnessGenerator(),
                config.executionMode(), config.workers(), config.compileTimeout(), config.executeTimeout());
    }

    /**
     * Runs the suite against the original unit, compiled with its dependencies.
     *
     * @param unit the unit under test
     * @param dependencies units it depends on, transitively
     * @param suite the frozen suite
     * @return one result per case
     * @throws InterruptedException if interrupted; running processes are killed
     */
    public ResultSet runBaseline(TranslationUnit unit, List<TranslationUnit> dependencies, TestSuite suite)
            throws InterruptedException {
        List<SourceFile> sources = new ArrayList<>();
        List<TranslationUnit> all = new ArrayList<>(dependencies);
        all.add(unit);
        for (TranslationUnit u : all) {
            sources.add(new SourceFile(sourceHarness.sourceFileName(u.id()),
                    sourceHarness.prepareSource(u.sourceText())));
        }
        return run(unit, suite, sourceToolchain, sourceHarness, sources, headersFor(all));
    }

    /**
     * Runs the suite against converted code, compiled with the converted
     * code of its dependencies.
     *
     * @param unit the original unit, for function signatures
     * @param artifact the converted unit
     * @param dependencies converted dependencies, transitively
     * @param suite the frozen suite
     * @return one result per case
     * @throws InterruptedException if interrupted; running processes are killed
     */
    public ResultSet runTarget(TranslationUnit unit, ConvertedArtifact artifact,
                               List<ConvertedArtifact> dependencies, TestSuite suite)
            throws InterruptedException {
        List<SourceFile> sources = new ArrayList<>();
        List<ConvertedArtifact> all = new ArrayList<>(dependencies);
        all.add(artifact);
        for (ConvertedArtifact a : all) {
            sources.add(new SourceFile(targetHarness.sourceFileName(a.unitId()),
                    targetHarness.prepareSource(a.sourceText())));
        }
        return run(unit, suite, targetToolchain, targetHarness, sources, List.of());
    }

    private ResultSet run(TranslationUnit unit, TestSuite suite, Toolchain toolchain, HarnessGenerator generator,
                          List<SourceFile> sources, List<SourceFile> headers) throws InterruptedException {
        Backend backend = toolchain.backend();
        List<String> names = suite.cases().stream().map(TestCase::name).toList();
        ResultSet results = new ResultSet(unit.id(), backend, names);
        Map<String, OutputSignature> signatures = signatures(unit, suite);

        List<SourceFile> compiled = new ArrayList<>(sources);
        compiled.add(new SourceFile(generator.harnessFileName(), generator.generate(unit, suite)));

        try (Workspace workspace = Workspace.create("diffmigrator-" + backend.role() + "-")) {
            for (SourceFile header : headers) {
                workspace.write(header);
            }
            for (SourceFile source : compiled) {
                workspace.write(source);
            }

            CompiledArtifact artifact;
            try {
                artifact = toolchain.compile(workspace, compiled, compileTimeout);
            } catch (CompilationException e) {
                log.info("{} compilation of unit {} failed: {}", backend.role(), unit.id(), e.getMessage());
                String diagnostics = e.getStderr().isBlank() ? e.getMessage() : e.getStderr();
                results.markCompilationFailed(ProcessOutcome.excerpt(diagnostics, ExecutionResult.STDERR_EXCERPT));
                for (String name : names) {
                    results.record(ExecutionResult.compilationFailure(name, backend, diagnostics, e.isTimedOut()));
                }
                return results;
            }

            if (mode == ExecutionMode.BATCH) {
                runBatch(suite, toolchain, artifact, signatures, results);
            } else {
                runPerCase(suite, toolchain, artifact, signatures, results);
            }
        } catch (IOException e) {
            log.error("Cannot prepare {} workspace for unit {}: {}", backend.role(), unit.id(), e.getMessage());
            results.markCompilationFailed("workspace error: " + e.getMessage());
            for (String name : names) {
                if (results.result(name).isEmpty()) {
                    results.record(ExecutionResult.compilationFailure(name, backend,
                            "workspace error: " + e.getMessage(), false));
                }
            }
        }

        log.debug("Ran {} cases of unit {} on {}: {} runtime failures", names.size(), unit.id(),
                backend.role(), results.count(FailureKind.RUNTIME_FAILURE));
        return results;
    }

    private void runPerCase(TestSuite suite, Toolchain toolchain, CompiledArtifact artifact,
                            Map<String, OutputSignature> signatures, ResultSet results)
            throws InterruptedException {
        if (suite.isEmpty()) return;
        int poolSize = Math.min(workers, suite.size());
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, daemonThreads("diffmigrator-case-"));
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (TestCase tc : suite.cases()) {
                futures.add(pool.submit(() -> {
                    runCase(tc, toolchain, artifact, signatures.get(tc.name()), results);
                    return null;
                }));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (ExecutionException e) {
                    String name = suite.cases().get(i).name();
                    log.error("Unexpected failure running case {}", name, e.getCause());
                    if (results.result(name).isEmpty()) {
                        results.record(ExecutionResult.runtimeFailure(name, toolchain.backend(), -1,
                                String.valueOf(e.getCause()), false, 0));
                    }
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        } finally {
            pool.shutdownNow();
        }
    }

    private void runCase(TestCase tc, Toolchain toolchain, CompiledArtifact artifact, OutputSignature signature,
                         ResultSet results) throws InterruptedException {
        Backend backend = toolchain.backend();
        ProcessOutcome outcome;
        try {
            outcome = toolchain.execute(artifact, List.of(tc.name()), executeTimeout);
        } catch (IOException e) {
            results.record(ExecutionResult.runtimeFailure(tc.name(), backend, -1,
                    "cannot start: " + e.getMessage(), false, 0));
            return;
        }
        Map<String, OutputValue> outputs = OutputLineProtocol.parse(outcome.stdout(), Map.of(tc.name(), signature))
                .get(tc.name());
        results.record(toResult(tc.name(), backend, outcome, outputs));
    }

    private void runBatch(TestSuite suite, Toolchain toolchain, CompiledArtifact artifact,
                          Map<String, OutputSignature> signatures, ResultSet results)
            throws InterruptedException {
        Backend backend = toolchain.backend();
        ProcessOutcome outcome;
        try {
            outcome = toolchain.execute(artifact, List.of(), executeTimeout);
        } catch (IOException e) {
            for (TestCase tc : suite.cases()) {
                results.record(ExecutionResult.runtimeFailure(tc.name(), backend, -1,
                        "cannot start: " + e.getMessage(), false, 0));
            }
            return;
        }
        Map<String, Map<String, OutputValue>> parsed = OutputLineProtocol.parse(outcome.stdout(), signatures);
        boolean aborted = outcome.timedOut() || outcome.exitCode() != 0;
        List<TestCase> unreported = new ArrayList<>();
        for (TestCase tc : suite.cases()) {
            Map<String, OutputValue> outputs = parsed.get(tc.name());
            if (outputs != null) {
                // printed before any later crash
                results.record(ExecutionResult.success(tc.name(), backend, outputs, outcome.wallTimeMs()));
            } else if (aborted) {
                unreported.add(tc);
            } else {
                results.record(toResult(tc.name(), backend, outcome, null));
            }
        }
        if (!unreported.isEmpty()) {
            // a dead batch says nothing about the cases it never reached
            log.debug("Batch run on {} ended with exit code {}{}, rerunning {} case(s) individually",
                    backend.role(), outcome.exitCode(), outcome.timedOut() ? " (timed out)" : "", unreported.size());
            for (TestCase tc : unreported) {
                runCase(tc, toolchain, artifact, signatures.get(tc.name()), results);
            }
        }
    }

    private static ExecutionResult toResult(String name, Backend backend, ProcessOutcome outcome,
                                            Map<String, OutputValue> outputs) {
        if (outcome.timedOut()) {
            return ExecutionResult.runtimeFailure(name, backend, -1, outcome.stderr(), true, outcome.wallTimeMs());
        }
        if (outcome.exitCode() != 0) {
            return ExecutionResult.runtimeFailure(name, backend, outcome.exitCode(), outcome.stderr(), false,
                    outcome.wallTimeMs());
        }
        if (outputs == null) {
            return ExecutionResult.runtimeFailure(name, backend, outcome.exitCode(),
                    "no result line printed. " + outcome.stderr(), false, outcome.wallTimeMs());
        }
        return ExecutionResult.success(name, backend, outputs, outcome.wallTimeMs());
    }

    private static Map<String, OutputSignature> signatures(TranslationUnit unit, TestSuite suite) {
        Map<String, OutputSignature> byFunction = new HashMap<>();
        Map<String, OutputSignature> byCase = new LinkedHashMap<>();
        for (TestCase tc : suite.cases()) {
            OutputSignature signature = byFunction.computeIfAbsent(tc.functionName(), name -> {
                FunctionDecl fn = unit.function(name).orElseThrow(() ->
                        new IllegalArgumentException("Unit " + unit.id() + " has no function " + name));
                return OutputSignature.of(fn);
            });
            byCase.put(tc.name(), signature);
        }
        return byCase;
    }

    /**
     * Collects the user headers the units include that exist next to their
     * source files, so the compiler finds them in the workspace.
     */
    static List<SourceFile> headersFor(List<TranslationUnit> units) {
        Map<String, SourceFile> headers = new LinkedHashMap<>();
        for (TranslationUnit unit : units) {
            Path source = Path.of(unit.sourcePath());
            for (IncludeDirective include : unit.includes()) {
                if (include.system() || headers.containsKey(include.name()) || include.name().contains("..")) {
                    continue;
                }
                Path header = source.resolveSibling(include.name());
                if (!Files.isRegularFile(header)) continue;
                try {
                    headers.put(include.name(), new SourceFile(include.name(), Files.readString(header)));
                } catch (IOException e) {
                    log.warn("Cannot read header {} of unit {}: {}", header, unit.id(), e.getMessage());
                }
            }
        }
        return new ArrayList<>(headers.values());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

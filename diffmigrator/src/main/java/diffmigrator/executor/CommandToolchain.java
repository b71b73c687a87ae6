package diffmigrator.executor;

import diffmigrator.exceptions.CompilationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A {@link Toolchain} driven by command-line templates.
 *
 * <p>Templates are token lists. The placeholders are:
 * <ul>
 *   <li>{@code {out}} - artifact path (compile; may be embedded, as in {@code -out:{out}})</li>
 *   <li>{@code {sources}} - expands to one token per source file (compile)</li>
 *   <li>{@code {artifact}} - artifact path (execute; may be embedded)</li>
 *   <li>{@code {args}} - expands to the program arguments (execute)</li>
 * </ul>
 */
public final class CommandToolchain implements Toolchain {

    private static final Logger log = LoggerFactory.getLogger(CommandToolchain.class);

    private final Backend backend;
    private final List<String> compileTemplate;
    private final List<String> executeTemplate;
    private final String artifactName;
    private final ProcessRunner runner;

    public CommandToolchain(Backend backend, List<String> compileTemplate, List<String> executeTemplate,
                            String artifactName, ProcessRunner runner) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.compileTemplate = List.copyOf(compileTemplate);
        this.executeTemplate = List.copyOf(executeTemplate);
        this.artifactName = Objects.requireNonNull(artifactName, "artifactName");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    /** gcc in C99 mode, linked against libm. */
    public static CommandToolchain gcc(ProcessRunner runner) {
        return new CommandToolchain(Backend.C,
                List.of("gcc", "-std=c99", "-O0", "-w", "-o", "{out}", "{sources}", "-lm"),
                List.of("{artifact}", "{args}"),
                "harness", runner);
    }

    /** Mono's C# compiler, with the harness class as entry point, run under mono. */
    public static CommandToolchain mono(ProcessRunner runner) {
        return new CommandToolchain(Backend.CSHARP,
                List.of("mcs", "-nologo", "-warn:0", "-main:" + CSharpHarnessGenerator.HARNESS_CLASS,
                        "-out:{out}", "{sources}"),
                List.of("mono", "{artifact}", "{args}"),
                "harness.exe", runner);
    }

    @Override
    public Backend backend() {
        return backend;
    }

    @Override
    public CompiledArtifact compile(Workspace workspace, List<SourceFile> sources, Duration timeout)
            throws CompilationException, InterruptedException {
        Path out = workspace.resolve(artifactName);
        List<String> command = new ArrayList<>();
        for (String token : compileTemplate) {
            if (token.equals("{sources}")) {
                for (SourceFile source : sources) {
                    command.add(workspace.resolve(source.fileName()).toString());
                }
            } else {
                command.add(token.replace("{out}", out.toString()));
            }
        }

        ProcessOutcome outcome;
        try {
            outcome = runner.run(command, workspace.root(), timeout);
        } catch (IOException e) {
            throw new CompilationException("Cannot start " + backend.role() + " compiler " + command.get(0), e);
        }

        if (outcome.timedOut()) {
            throw new CompilationException(backend.role() + " compilation timed out", outcome.stderr(), true);
        }
        if (outcome.exitCode() != 0) {
            String diagnostics = outcome.stderr().isBlank() ? outcome.stdout() : outcome.stderr();
            throw new CompilationException(backend.role() + " compilation failed with exit code "
                    + outcome.exitCode(), diagnostics, false);
        }
        log.debug("Compiled {} artifact {} in {} ms", backend.role(), out, outcome.wallTimeMs());
        return new CompiledArtifact(backend, out);
    }

    @Override
    public ProcessOutcome execute(CompiledArtifact artifact, List<String> args, Duration timeout)
            throws IOException, InterruptedException {
        List<String> command = new ArrayList<>();
        for (String token : executeTemplate) {
            if (token.equals("{args}")) {
                command.addAll(args);
            } else {
                command.add(token.replace("{artifact}", artifact.path().toString()));
            }
        }
        Path dir = artifact.path().getParent();
        return runner.run(command, dir, timeout);
    }

    @Override
    public String toString() {
        return "CommandToolchain{" + backend + ", compile=" + compileTemplate + '}';
    }
}

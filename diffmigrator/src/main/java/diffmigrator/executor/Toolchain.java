package diffmigrator.executor;

import diffmigrator.exceptions.CompilationException;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * A compiler plus runtime for one backend.
 *
 * <p>The engine does not care which concrete tools fulfil this contract, as
 * long as the program built from a generated harness prints one
 * {@code testId=value1,value2,...} line per executed case.
 *
 * @see CommandToolchain
 */
public interface Toolchain {

    Backend backend();

    /**
     * Compiles sources and harness into an artifact inside the workspace.
     * All files have already been written to the workspace.
     *
     * @param workspace the workspace holding the files
     * @param sources the unit (and dependency) sources, then the harness
     * @param timeout compile timeout
     * @return the artifact
     * @throws CompilationException on a compiler error, a timeout or a tool that cannot be started
     * @throws InterruptedException if interrupted; the compiler is killed
     */
    CompiledArtifact compile(Workspace workspace, List<SourceFile> sources, Duration timeout)
            throws CompilationException, InterruptedException;

    /**
     * Runs a compiled artifact.
     *
     * @param artifact the artifact
     * @param args program arguments, e.g. a single test id
     * @param timeout run timeout
     * @return the outcome; a non-zero exit or timeout is reported, not thrown
     * @throws IOException if the program cannot be started
     * @throws InterruptedException if interrupted; the process tree is killed
     */
    ProcessOutcome execute(CompiledArtifact artifact, List<String> args, Duration timeout)
            throws IOException, InterruptedException;
}

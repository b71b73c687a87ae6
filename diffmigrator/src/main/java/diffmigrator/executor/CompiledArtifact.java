package diffmigrator.executor;

import java.nio.file.Path;

/**
 * The output of a successful compilation: an executable program (or
 * assembly) inside a {@link Workspace}. Valid only while the workspace is open.
 *
 * @param backend the backend that produced it
 * @param path the artifact file
 */
public record CompiledArtifact(Backend backend, Path path) {
}

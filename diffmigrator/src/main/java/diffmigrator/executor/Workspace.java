package diffmigrator.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * A temporary directory for one compile-and-run cycle.
 *
 * <p>Use with try-with-resources: the directory and everything in it is
 * removed on close, whichever way the block is left.
 */
public final class Workspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private final Path root;

    private Workspace(Path root) {
        this.root = root;
    }

    /**
     * Creates a workspace in the system temp directory.
     *
     * @param prefix directory name prefix
     * @throws IOException if the directory cannot be created
     */
    public static Workspace create(String prefix) throws IOException {
        return new Workspace(Files.createTempDirectory(prefix));
    }

    /** Creates a workspace under {@code parent}, mainly for tests. */
    public static Workspace createIn(Path parent, String prefix) throws IOException {
        return new Workspace(Files.createTempDirectory(parent, prefix));
    }

    public Path root() {
        return root;
    }

    public Path resolve(String fileName) {
        return root.resolve(fileName);
    }

    /**
     * Writes a file into the workspace, creating parent directories.
     *
     * @return the written file
     */
    public Path write(SourceFile file) throws IOException {
        Path target = root.resolve(file.fileName()).normalize();
        if (!target.startsWith(root)) {
            throw new IOException("Refusing to write outside the workspace: " + file.fileName());
        }
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.writeString(target, file.text());
    }

    public boolean exists() {
        return Files.exists(root);
    }

    @Override
    public void close() {
        if (!Files.exists(root)) return;
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(Workspace::delete);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to remove workspace {}: {}", root, e.getMessage());
        }
    }

    private static void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String toString() {
        return "Workspace{" + root + '}';
    }
}

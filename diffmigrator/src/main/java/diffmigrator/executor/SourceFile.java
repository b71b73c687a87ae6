package diffmigrator.executor;

import java.util.Objects;

/**
 * A named source text to be written into a workspace and compiled.
 *
 * @param fileName file name relative to the workspace root
 * @param text file contents
 */
public record SourceFile(String fileName, String text) {

    public SourceFile {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(text, "text");
        if (fileName.contains("..")) {
            throw new IllegalArgumentException("File name must stay inside the workspace: " + fileName);
        }
    }
}

package diffmigrator.model;

import diffmigrator.exceptions.MigrationException;

import java.nio.file.Path;

/**
 * Parses a source file into a {@link TranslationUnit}.
 *
 * <p>Parsing is outside the engine; implementations wrap whatever front end
 * the migration uses.
 */
@FunctionalInterface
public interface SourceParser {

    /**
     * @param sourceFile the file to parse
     * @return the parsed unit
     * @throws MigrationException if the file cannot be read or parsed
     */
    TranslationUnit parse(Path sourceFile) throws MigrationException;
}

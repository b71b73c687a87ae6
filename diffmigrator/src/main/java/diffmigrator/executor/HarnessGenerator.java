package diffmigrator.executor;

import diffmigrator.model.TranslationUnit;
import diffmigrator.oracle.TestSuite;

/**
 * Produces the driver program that runs a suite against one backend.
 *
 * <p>A harness embeds every case's inputs, calls the function under test and
 * prints one line per case in the {@link OutputLineProtocol} format. Run
 * without arguments it executes all cases; given a test id as its only
 * argument it executes just that case.
 */
public interface HarnessGenerator {

    Backend backend();

    /** File name the harness is written to. */
    String harnessFileName();

    /** File name a unit's source is written to. */
    default String sourceFileName(String unitId) {
        return unitId + "." + backend().extension();
    }

    /**
     * Adjusts unit source text before it is compiled next to the harness,
     * e.g. removing an entry point that would clash with the harness's own.
     */
    String prepareSource(String sourceText);

    /**
     * Generates the harness source for a suite.
     *
     * @param unit the unit whose functions are called
     * @param suite the cases to embed
     * @return harness source text
     */
    String generate(TranslationUnit unit, TestSuite suite);
}

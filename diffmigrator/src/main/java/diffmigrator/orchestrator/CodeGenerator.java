package diffmigrator.orchestrator;

import diffmigrator.exceptions.GenerationFailureException;

/**
 * Produces C# source for a unit.
 *
 * <p>The generated source must declare a class named
 * {@code CSharpHarnessGenerator.typeNameFor(unitId)} exposing each C function
 * as a public static method of the same name. Pointer and array parameters
 * map to arrays of the element type, {@code char*} to {@code string}.
 *
 * <p>Implementations may be called again for the same unit with feedback from
 * the previous attempt and should respond to interruption.
 */
@FunctionalInterface
public interface CodeGenerator {

    /**
     * Converts one unit.
     *
     * @param request the unit, attempt number and feedback
     * @return the converted source
     * @throws GenerationFailureException if no source could be produced
     * @throws InterruptedException if interrupted while converting
     */
    ConvertedArtifact convert(ConversionRequest request) throws GenerationFailureException, InterruptedException;
}

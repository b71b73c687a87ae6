package diffmigrator.orchestrator;

/**
 * What the orchestrator does when unit dependencies contain cycles.
 */
public enum CyclePolicy {
    /** Fail the run with a {@link diffmigrator.exceptions.CyclicDependencyException}. */
    ABORT,
    /** Sever back edges, log the severed edges and continue. */
    BREAK
}

package diffmigrator.exceptions;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Thrown when translation units cannot be ordered because their dependencies
 * form one or more cycles.
 *
 * <p>The exception names every cycle group so the caller can decide whether
 * to abort the run or sever the cycles.
 *
 * @see diffmigrator.graph.DependencyGraph#topologicalOrder()
 */
public class CyclicDependencyException extends MigrationException {

    private final List<Set<String>> cycles;

    /**
     * @param cycles the detected cycle groups, each a set of unit ids
     */
    public CyclicDependencyException(List<Set<String>> cycles) {
        super(formatMessage(cycles), null, "ordering", null);
        this.cycles = cycles.stream().map(Set::copyOf).toList();
    }

    /** Returns the cycle groups. */
    public List<Set<String>> getCycles() {
        return cycles;
    }

    /** Returns every unit id that takes part in some cycle. */
    public Set<String> getCycleMembers() {
        return cycles.stream().flatMap(Set::stream).collect(Collectors.toUnmodifiableSet());
    }

    private static String formatMessage(List<Set<String>> cycles) {
        String groups = cycles.stream()
                .map(g -> g.stream().sorted().collect(Collectors.joining(", ", "{", "}")))
                .collect(Collectors.joining(" "));
        return "Cyclic dependencies between translation units: " + groups;
    }
}

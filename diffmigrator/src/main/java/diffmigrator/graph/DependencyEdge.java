package diffmigrator.graph;

/**
 * A directed edge: {@code dependent} needs {@code dependency} converted first.
 */
public record DependencyEdge(String dependent, String dependency) {

    @Override
    public String toString() {
        return dependent + " -> " + dependency;
    }
}

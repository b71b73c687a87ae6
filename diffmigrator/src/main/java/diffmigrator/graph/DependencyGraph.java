package diffmigrator.graph;

import diffmigrator.exceptions.CyclicDependencyException;
import diffmigrator.model.ConversionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Directed graph of translation units, ordered so that a unit is converted
 * only after every unit it depends on.
 *
 * <p>The graph is built with {@link #addUnit(String, Collection)}. After
 * construction the only state change is {@link #markConverted(String)}, which
 * unblocks dependents. The set of unblocked units therefore only grows.
 *
 * <p>Edges point from a dependent to its dependency. Dependency ids that were
 * never added as units are registered implicitly with no dependencies.
 *
 * @see diffmigrator.model.ProgramModel#buildGraph()
 */
public final class DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    // unit -> units it depends on
    private final SortedMap<String, SortedSet<String>> dependencies = new TreeMap<>();
    // unit -> units depending on it
    private final SortedMap<String, SortedSet<String>> dependents = new TreeMap<>();

    private final Map<String, Integer> remaining = new HashMap<>();
    private final SortedSet<String> converted = new TreeSet<>();
    private final SortedSet<String> unblocked = new TreeSet<>();

    // ===== construction =====

    /**
     * Adds a unit and its dependency edges. Adding the same unit again merges
     * the edges. Self edges are dropped.
     *
     * @param unitId the unit
     * @param dependencyIds the units it depends on
     */
    public synchronized void addUnit(String unitId, Collection<String> dependencyIds) {
        Objects.requireNonNull(unitId, "unitId");
        register(unitId);
        for (String dep : dependencyIds) {
            if (dep.equals(unitId)) {
                log.debug("Dropping self edge on {}", unitId);
                continue;
            }
            register(dep);
            if (dependencies.get(unitId).add(dep)) {
                dependents.get(dep).add(unitId);
            }
        }
        recomputeRemaining();
    }

    private void register(String unitId) {
        dependencies.computeIfAbsent(unitId, k -> new TreeSet<>());
        dependents.computeIfAbsent(unitId, k -> new TreeSet<>());
    }

    private void recomputeRemaining() {
        for (Map.Entry<String, SortedSet<String>> e : dependencies.entrySet()) {
            int open = 0;
            for (String dep : e.getValue()) {
                if (!converted.contains(dep)) open++;
            }
            remaining.put(e.getKey(), open);
            if (open == 0 && !converted.contains(e.getKey())) {
                unblocked.add(e.getKey());
            } else {
                unblocked.remove(e.getKey());
            }
        }
    }

    // ===== queries =====

    public synchronized SortedSet<String> units() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(dependencies.keySet()));
    }

    public synchronized boolean contains(String unitId) {
        return dependencies.containsKey(unitId);
    }

    public synchronized int size() {
        return dependencies.size();
    }

    public synchronized int edgeCount() {
        return dependencies.values().stream().mapToInt(Set::size).sum();
    }

    /** Returns the units {@code unitId} depends on directly. */
    public synchronized SortedSet<String> dependenciesOf(String unitId) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(
                dependencies.getOrDefault(unitId, Collections.emptySortedSet())));
    }

    /** Returns the units that depend directly on {@code unitId}. */
    public synchronized SortedSet<String> dependentsOf(String unitId) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(
                dependents.getOrDefault(unitId, Collections.emptySortedSet())));
    }

    public synchronized boolean isConverted(String unitId) {
        return converted.contains(unitId);
    }

    public synchronized SortedSet<String> convertedUnits() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(converted));
    }

    /**
     * Returns the units whose dependencies have all been marked converted and
     * which are not converted themselves. Grows monotonically except for units
     * leaving it by being converted.
     */
    public synchronized SortedSet<String> unblockedUnits() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(unblocked));
    }

    // ===== cycles =====

    /**
     * Finds every group of units that depend on each other.
     *
     * <p>Uses a depth-first search with an explicit recursion stack and groups
     * strongly connected nodes, so every unit on a cycle belongs to exactly one
     * group. Self edges never reach the graph, so every group has two or more
     * units.
     *
     * @return cycle groups ordered by their smallest unit id; empty if acyclic
     */
    public synchronized List<Set<String>> detectCycles() {
        SccSearch search = new SccSearch();
        for (String node : dependencies.keySet()) {
            if (!search.index.containsKey(node)) {
                search.visit(node);
            }
        }
        search.groups.sort(Comparator.comparing(g -> g.first()));
        List<Set<String>> result = new ArrayList<>();
        for (SortedSet<String> g : search.groups) {
            result.add(Collections.unmodifiableSortedSet(g));
        }
        return result;
    }

    public boolean hasCycles() {
        return !detectCycles().isEmpty();
    }

    private final class SccSearch {
        final Map<String, Integer> index = new HashMap<>();
        final Map<String, Integer> lowLink = new HashMap<>();
        final Deque<String> stack = new ArrayDeque<>();
        final Set<String> onStack = new HashSet<>();
        final List<SortedSet<String>> groups = new ArrayList<>();
        int counter = 0;

        void visit(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);

            for (String dep : dependencies.get(node)) {
                if (!index.containsKey(dep)) {
                    visit(dep);
                    lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(dep)));
                } else if (onStack.contains(dep)) {
                    lowLink.put(node, Math.min(lowLink.get(node), index.get(dep)));
                }
            }

            if (lowLink.get(node).equals(index.get(node))) {
                SortedSet<String> group = new TreeSet<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    group.add(member);
                } while (!member.equals(node));

                if (group.size() > 1) {
                    groups.add(group);
                }
            }
        }
    }

    /**
     * Removes back edges until the graph is acyclic.
     *
     * <p>Nodes and their dependencies are walked in id order, so the same graph
     * always loses the same edges.
     *
     * @return the severed edges, in the order they were removed
     */
    public synchronized List<DependencyEdge> breakCycles() {
        List<DependencyEdge> severed = new ArrayList<>();
        Set<String> done = new HashSet<>();
        Set<String> path = new LinkedHashSet<>();
        for (String node : dependencies.keySet()) {
            severBackEdges(node, done, path, severed);
        }
        for (DependencyEdge edge : severed) {
            dependencies.get(edge.dependent()).remove(edge.dependency());
            dependents.get(edge.dependency()).remove(edge.dependent());
            log.warn("Severed dependency edge {} to break a cycle", edge);
        }
        recomputeRemaining();
        return severed;
    }

    private void severBackEdges(String node, Set<String> done, Set<String> path,
                                List<DependencyEdge> severed) {
        if (done.contains(node)) return;
        path.add(node);
        for (String dep : dependencies.get(node)) {
            if (path.contains(dep)) {
                severed.add(new DependencyEdge(node, dep));
            } else {
                severBackEdges(dep, done, path, severed);
            }
        }
        path.remove(node);
        done.add(node);
    }

    // ===== ordering =====

    /**
     * Computes a conversion order in which every unit comes after all of its
     * dependencies. Among units that are ready at the same time, the smaller
     * id comes first.
     *
     * @return all units in conversion order
     * @throws CyclicDependencyException if the graph has cycles
     */
    public synchronized List<String> topologicalOrder() throws CyclicDependencyException {
        Map<String, Integer> inDegree = new HashMap<>();
        PriorityQueue<String> queue = new PriorityQueue<>();
        for (Map.Entry<String, SortedSet<String>> e : dependencies.entrySet()) {
            inDegree.put(e.getKey(), e.getValue().size());
            if (e.getValue().isEmpty()) {
                queue.add(e.getKey());
            }
        }

        List<String> order = new ArrayList<>(dependencies.size());
        while (!queue.isEmpty()) {
            String node = queue.poll();
            order.add(node);
            for (String dependent : dependents.get(node)) {
                int left = inDegree.merge(dependent, -1, Integer::sum);
                if (left == 0) {
                    queue.add(dependent);
                }
            }
        }

        if (order.size() < dependencies.size()) {
            throw new CyclicDependencyException(detectCycles());
        }
        return List.copyOf(order);
    }

    /**
     * Returns the units that may start now: still waiting, with every
     * dependency {@code CONVERTED}. Units missing from {@code statuses} count
     * as {@code PENDING}.
     *
     * @param statuses current status per unit
     * @return ready unit ids in id order
     */
    public synchronized SortedSet<String> readySet(Map<String, ConversionStatus> statuses) {
        SortedSet<String> ready = new TreeSet<>();
        for (Map.Entry<String, SortedSet<String>> e : dependencies.entrySet()) {
            ConversionStatus status = statuses.getOrDefault(e.getKey(), ConversionStatus.PENDING);
            if (!status.isWaiting()) continue;
            boolean satisfied = e.getValue().stream()
                    .allMatch(dep -> statuses.get(dep) == ConversionStatus.CONVERTED);
            if (satisfied) {
                ready.add(e.getKey());
            }
        }
        return ready;
    }

    /**
     * Records that a unit has been converted and unblocks its dependents.
     * Repeated calls for the same unit have no further effect.
     *
     * @param unitId the converted unit
     * @throws IllegalArgumentException if the unit is unknown
     */
    public synchronized void markConverted(String unitId) {
        if (!dependencies.containsKey(unitId)) {
            throw new IllegalArgumentException("Unknown unit: " + unitId);
        }
        if (!converted.add(unitId)) return;
        unblocked.remove(unitId);
        for (String dependent : dependents.get(unitId)) {
            int left = remaining.merge(dependent, -1, Integer::sum);
            if (left == 0 && !converted.contains(dependent)) {
                unblocked.add(dependent);
                log.debug("Unit {} unblocked by {}", dependent, unitId);
            }
        }
    }

    // ===== reporting =====

    public synchronized GraphStatistics statistics() {
        int nodes = dependencies.size();
        double progress = nodes == 0 ? 0.0 : 100.0 * converted.size() / nodes;
        return new GraphStatistics(nodes, edgeCount(), converted.size(), detectCycles().size(), progress);
    }

    /**
     * Renders the graph as text: one line per unit with its dependencies and
     * conversion mark, followed by any cycles.
     */
    public synchronized String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Dependency graph: ").append(size()).append(" units, ")
                .append(edgeCount()).append(" edges\n");
        for (Map.Entry<String, SortedSet<String>> e : dependencies.entrySet()) {
            sb.append(converted.contains(e.getKey()) ? "  [x] " : "  [ ] ").append(e.getKey());
            if (!e.getValue().isEmpty()) {
                sb.append(" -> ").append(String.join(", ", e.getValue()));
            }
            sb.append('\n');
        }
        for (Set<String> cycle : detectCycles()) {
            sb.append("  cycle: ").append(String.join(" <-> ", cycle)).append('\n');
        }
        return sb.toString();
    }
}

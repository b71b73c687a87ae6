package diffmigrator.report;

import diffmigrator.graph.DependencyEdge;
import diffmigrator.graph.GraphStatistics;
import diffmigrator.orchestrator.UnitOutcome;

import java.util.*;

/**
 * Outcome of a migration run: one {@link UnitReport} per unit plus run-level
 * facts. Partial success is preserved; converted units are reported even when
 * others failed.
 */
public final class MigrationReport {

    private final Map<String, UnitReport> units;
    private final List<String> conversionOrder;
    private final List<Set<String>> cycles;
    private final List<DependencyEdge> severedEdges;
    private final GraphStatistics graphStatistics;
    private final boolean cancelled;
    private final long durationMs;

    public MigrationReport(Collection<UnitReport> units, List<String> conversionOrder, List<Set<String>> cycles,
                           List<DependencyEdge> severedEdges, GraphStatistics graphStatistics,
                           boolean cancelled, long durationMs) {
        Map<String, UnitReport> byId = new TreeMap<>();
        for (UnitReport u : units) {
            byId.put(u.unitId(), u);
        }
        this.units = Collections.unmodifiableMap(byId);
        this.conversionOrder = List.copyOf(conversionOrder);
        this.cycles = cycles.stream().map(c -> (Set<String>) Collections.unmodifiableSet(new TreeSet<>(c))).toList();
        this.severedEdges = List.copyOf(severedEdges);
        this.graphStatistics = graphStatistics;
        this.cancelled = cancelled;
        this.durationMs = durationMs;
    }

    public Optional<UnitReport> unit(String unitId) {
        return Optional.ofNullable(units.get(unitId));
    }

    /** Unit reports ordered by unit id. */
    public Collection<UnitReport> units() {
        return units.values();
    }

    /** Units in the order they were picked up. */
    public List<String> conversionOrder() {
        return conversionOrder;
    }

    public List<Set<String>> cycles() {
        return cycles;
    }

    /** Edges removed to break cycles, empty unless cycles were broken. */
    public List<DependencyEdge> severedEdges() {
        return severedEdges;
    }

    public GraphStatistics graphStatistics() {
        return graphStatistics;
    }

    public boolean cancelled() {
        return cancelled;
    }

    public long durationMs() {
        return durationMs;
    }

    public List<String> unitsWith(UnitOutcome outcome) {
        return units.values().stream().filter(u -> u.outcome() == outcome).map(UnitReport::unitId).toList();
    }

    public int count(UnitOutcome outcome) {
        return unitsWith(outcome).size();
    }

    public boolean allConverted() {
        return count(UnitOutcome.CONVERTED) == units.size();
    }

    /** Process exit status: 0 when every unit converted, 1 otherwise. */
    public int exitCode() {
        return allConverted() ? 0 : 1;
    }

    /** Format-agnostic nested mapping for report renderers. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        Map<String, Object> totals = new LinkedHashMap<>();
        totals.put("units", units.size());
        for (UnitOutcome outcome : UnitOutcome.values()) {
            totals.put(outcome.name().toLowerCase(Locale.ROOT), count(outcome));
        }
        map.put("totals", totals);
        map.put("durationMs", durationMs);
        map.put("cancelled", cancelled);
        map.put("conversionOrder", conversionOrder);
        map.put("cycles", cycles.stream().map(List::copyOf).toList());
        map.put("severedEdges", severedEdges.stream().map(DependencyEdge::toString).toList());
        if (graphStatistics != null) map.put("graph", graphStatistics.toMap());
        Map<String, Object> perUnit = new LinkedHashMap<>();
        units.forEach((id, u) -> perUnit.put(id, u.toMap()));
        map.put("units", perUnit);
        return map;
    }

    /** Outcome table, one row per unit. */
    public String summary() {
        int width = Math.max(4, units.keySet().stream().mapToInt(String::length).max().orElse(4));
        String row = "%-" + width + "s  %-9s  %8s  %6s  %6s  %s%n";
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, row, "unit", "status", "attempts", "passed", "failed", "reason"));
        for (UnitReport u : units.values()) {
            sb.append(String.format(Locale.ROOT, row, u.unitId(), u.outcome(), u.attempts(),
                    u.passed(), u.failed(), firstLine(u.reason())));
        }
        sb.append(String.format(Locale.ROOT, "%d converted, %d failed, %d skipped in %d ms%s%n",
                count(UnitOutcome.CONVERTED), count(UnitOutcome.FAILED), count(UnitOutcome.SKIPPED),
                durationMs, cancelled ? " (cancelled)" : ""));
        return sb.toString();
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl);
    }

    @Override
    public String toString() {
        return "MigrationReport{converted=" + count(UnitOutcome.CONVERTED) + ", failed="
                + count(UnitOutcome.FAILED) + ", skipped=" + count(UnitOutcome.SKIPPED) + '}';
    }
}

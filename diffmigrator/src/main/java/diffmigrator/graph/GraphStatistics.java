package diffmigrator.graph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of graph size and conversion progress.
 *
 * @param nodes number of units
 * @param edges number of dependency edges
 * @param converted number of units marked converted
 * @param cycles number of cycle groups
 * @param progressPercent converted units as a percentage of all units
 */
public record GraphStatistics(int nodes, int edges, int converted, int cycles, double progressPercent) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("nodes", nodes);
        map.put("edges", edges);
        map.put("converted", converted);
        map.put("cycles", cycles);
        map.put("progressPercent", progressPercent);
        return map;
    }
}

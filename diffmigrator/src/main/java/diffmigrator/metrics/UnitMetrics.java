package diffmigrator.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable timing and volume metrics for the migration of one unit.
 *
 * <p>Phase durations accumulate over all attempts, so a unit converted on its
 * third attempt reports the total time spent converting.
 *
 * @see UnitMetricsCollector
 */
public record UnitMetrics(
        String unitId,
        Instant startTime,
        Instant endTime,
        Map<Phase, Long> phaseDurations,
        long totalDurationMs,
        int attempts,
        int testCases
) {
    /**
     * Pipeline phases for timing breakdown.
     */
    public enum Phase {
        /** Test suite generation */
        GENERATE,
        /** Baseline compile and run */
        BASELINE,
        /** Code generator call */
        CONVERT,
        /** Target compile and run */
        TARGET,
        /** Output comparison */
        VALIDATE
    }

    public UnitMetrics {
        phaseDurations = Collections.unmodifiableMap(phaseDurations.isEmpty()
                ? new EnumMap<>(Phase.class) : new EnumMap<>(phaseDurations));
    }

    /**
     * Returns the duration of a specific phase.
     *
     * @param phase the phase to query
     * @return duration in milliseconds, or 0 if phase not recorded
     */
    public long phaseDuration(Phase phase) {
        return phaseDurations.getOrDefault(phase, 0L);
    }

    public Duration totalDuration() {
        return Duration.ofMillis(totalDurationMs);
    }

    public String summary() {
        return String.format(Locale.ROOT, "%s in %dms | %d attempt(s) | %d case(s) | convert %dms, validate %dms",
                unitId, totalDurationMs, attempts, testCases,
                phaseDuration(Phase.CONVERT), phaseDuration(Phase.VALIDATE));
    }

    /**
     * Converts the metrics to a Map for JSON serialization.
     *
     * @return a map containing all metric values
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("unitId", unitId);
        map.put("startTime", startTime.toString());
        map.put("endTime", endTime.toString());
        map.put("totalDurationMs", totalDurationMs);
        map.put("attempts", attempts);
        map.put("testCases", testCases);
        phaseDurations.forEach((phase, duration) ->
                map.put(phase.name().toLowerCase(Locale.ROOT) + "DurationMs", duration));
        return map;
    }
}

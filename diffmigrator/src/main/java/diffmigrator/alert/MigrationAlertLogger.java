package diffmigrator.alert;

import diffmigrator.config.AlertLevel;
import diffmigrator.metrics.UnitMetrics.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;

/**
 * Structured logging for migration events.
 *
 * <p>Entries go to the {@code migration} logger as an event marker followed
 * by key=value pairs, so log aggregators can parse and alert on them.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs all events</li>
 *   <li>WARNING: logs rejected attempts, skipped units, cycles and errors</li>
 *   <li>ERROR: logs failed units and timeouts only</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * INFO migration - RUN_STARTED units=3
 * INFO migration - UNIT_STARTED unit=math_utils dependencies=0
 * WARN migration - ATTEMPT_REJECTED unit=math_utils attempt=1 mismatched_cases=2
 * INFO migration - UNIT_CONVERTED unit=math_utils attempts=2 cases=18 duration_ms=5400
 * INFO migration - RUN_COMPLETED converted=3 failed=0 skipped=0 duration_ms=16200
 * </pre>
 *
 * <p>Each run owns its own instance, so concurrent runs with different levels
 * do not interfere.
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private final AlertLevel alertLevel;

    public MigrationAlertLogger(AlertLevel alertLevel) {
        this.alertLevel = alertLevel != null ? alertLevel : AlertLevel.WARNING;
    }

    /**
     * Get the alert level of this logger.
     *
     * @return the alert level
     */
    public AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public void runStarted(int units) {
        if (shouldLogInfo()) {
            log.info("RUN_STARTED units={}", units);
        }
    }

    public void unitStarted(String unitId, int dependencies) {
        if (shouldLogInfo()) {
            log.info("UNIT_STARTED unit={} dependencies={}", unitId, dependencies);
        }
    }

    /**
     * Log when a conversion attempt did not pass validation.
     *
     * @param unitId the unit
     * @param attempt the 1-based attempt number
     * @param reason short reason, e.g. the number of mismatched cases or a generator error
     */
    public void attemptRejected(String unitId, int attempt, String reason) {
        if (shouldLogWarn()) {
            log.warn("ATTEMPT_REJECTED unit={} attempt={} reason=\"{}\"", unitId, attempt, reason);
        }
    }

    public void unitConverted(String unitId, int attempts, int cases, long durationMs) {
        if (shouldLogInfo()) {
            log.info("UNIT_CONVERTED unit={} attempts={} cases={} duration_ms={}",
                    unitId, attempts, cases, durationMs);
        }
    }

    public void unitFailed(String unitId, int attempts, String reason) {
        // Always log errors
        log.error("UNIT_FAILED unit={} attempts={} reason=\"{}\"", unitId, attempts, reason);
    }

    public void unitSkipped(String unitId, String reason) {
        if (shouldLogWarn()) {
            log.warn("UNIT_SKIPPED unit={} reason=\"{}\"", unitId, reason);
        }
    }

    /**
     * Log a group of units that depend on each other.
     *
     * @param members the cycle members
     * @param action what the orchestrator does about it (ABORT or BREAK)
     */
    public void cycleDetected(Collection<String> members, String action) {
        if (shouldLogWarn()) {
            log.warn("CYCLE_DETECTED units={} action={}", String.join(",", members), action);
        }
    }

    public void phaseTimeout(String unitId, Phase phase, Duration timeout) {
        // Always log errors
        log.error("PHASE_TIMEOUT unit={} phase={} timeout_ms={}", unitId, phase.name(), timeout.toMillis());
    }

    public void runCompleted(int converted, int failed, int skipped, long durationMs) {
        if (shouldLogInfo()) {
            log.info("RUN_COMPLETED converted={} failed={} skipped={} duration_ms={}",
                    converted, failed, skipped, durationMs);
        }
    }
}

package diffmigrator.config;

/**
 * Alert level for migration event logging.
 *
 * <p>Controls the minimum severity of events written by
 * {@link diffmigrator.alert.MigrationAlertLogger}. Configured via the
 * {@code migration.alert.level} property.
 *
 * <ul>
 *   <li>{@link #DEBUG} - all events: run and unit progress, rejected attempts, warnings, errors</li>
 *   <li>{@link #WARNING} - rejected attempts, skipped units, cycles and errors</li>
 *   <li>{@link #ERROR} - failed units and timeouts only</li>
 * </ul>
 *
 * @see MigrationConfig#alertLevel()
 */
public enum AlertLevel {
    DEBUG,
    WARNING,
    ERROR
}

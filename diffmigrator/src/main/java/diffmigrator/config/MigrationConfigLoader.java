package diffmigrator.config;

import diffmigrator.executor.ExecutionMode;
import diffmigrator.oracle.TestCategory;
import diffmigrator.orchestrator.CyclePolicy;
import diffmigrator.orchestrator.SuiteRegeneration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Loads migration configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code migration.properties} on the classpath</li>
 *   <li>{@code migration.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file-based configuration, using the same
 * keys (e.g., {@code -Dmigration.retry.max=5}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code migration.retry.max} - conversion attempts per unit</li>
 *   <li>{@code migration.retry.suite} - REUSE or REGENERATE_RANDOM</li>
 *   <li>{@code migration.timeout.compile} - timeout in seconds</li>
 *   <li>{@code migration.timeout.execute} - timeout in seconds</li>
 *   <li>{@code migration.timeout.convert} - timeout in seconds, 0 for none</li>
 *   <li>{@code migration.tolerance.float.absolute} - single precision threshold</li>
 *   <li>{@code migration.tolerance.double.absolute} - double precision threshold</li>
 *   <li>{@code migration.tolerance.relative} - relative threshold</li>
 *   <li>{@code migration.tests.max.per.function} - cap on cases per function</li>
 *   <li>{@code migration.tests.random.count} - random cases per function</li>
 *   <li>{@code migration.tests.seed} - generation seed</li>
 *   <li>{@code migration.tests.strategies} - comma separated: boundary, edge, random</li>
 *   <li>{@code migration.executor.mode} - PER_CASE or BATCH</li>
 *   <li>{@code migration.executor.workers} - worker threads for PER_CASE</li>
 *   <li>{@code migration.cycle.policy} - ABORT or BREAK</li>
 *   <li>{@code migration.validation.runtime.failure.parity} - true or false</li>
 *   <li>{@code migration.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see MigrationConfig
 */
public final class MigrationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigrationConfigLoader.class);

    private MigrationConfigLoader() {}

    /**
     * Load from classpath (migration.properties or migration.yml).
     * @throws MigrationConfigException if no config file found
     */
    public static MigrationConfig load() {
        InputStream is = getResource("migration.properties");
        if (is != null) {
            return loadProperties(is, "migration.properties");
        }

        is = getResource("migration.yml");
        if (is != null) {
            return loadYaml(is, "migration.yml");
        }

        throw new MigrationConfigException(
                "Config file required: migration.properties or migration.yml");
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws MigrationConfigException if the configuration is invalid
     */
    public static MigrationConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return MigrationConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static MigrationConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
    }

    private static MigrationConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(is);
        } catch (YAMLException | ClassCastException e) {
            throw new MigrationConfigException("Invalid YAML in " + source, e);
        }
        if (root == null) {
            return parse(new Properties());
        }
        Properties props = new Properties();
        flatten("", root, props);
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val instanceof Iterable<?> items) {
                StringBuilder joined = new StringBuilder();
                for (Object item : items) {
                    if (joined.length() > 0) joined.append(',');
                    joined.append(item);
                }
                props.setProperty(key, joined.toString());
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    private static MigrationConfig parse(Properties props) {
        MigrationConfig.Builder b = MigrationConfig.builder();

        getInt(props, "migration.retry.max").ifPresent(v -> {
            if (v > 0) b.maxRetries(v);
            else log.warn("Invalid retry.max: {}", v);
        });
        getEnum(props, "migration.retry.suite", SuiteRegeneration.class, b::suiteRegeneration);

        getLong(props, "migration.timeout.compile").ifPresent(b::compileTimeoutSeconds);
        getLong(props, "migration.timeout.execute").ifPresent(b::executeTimeoutSeconds);
        getLong(props, "migration.timeout.convert").ifPresent(b::convertTimeoutSeconds);

        getDouble(props, "migration.tolerance.float.absolute").ifPresent(b::floatTolerance);
        getDouble(props, "migration.tolerance.double.absolute").ifPresent(b::doubleTolerance);
        getDouble(props, "migration.tolerance.relative").ifPresent(b::relativeTolerance);

        getInt(props, "migration.tests.max.per.function").ifPresent(v -> {
            if (v > 0) b.maxTestsPerFunction(v);
            else log.warn("Invalid tests.max.per.function: {}", v);
        });
        getInt(props, "migration.tests.random.count").ifPresent(v -> {
            if (v >= 0) b.randomCount(v);
            else log.warn("Invalid tests.random.count: {}", v);
        });
        getLong(props, "migration.tests.seed").ifPresent(b::seed);
        getString(props, "migration.tests.strategies").flatMap(MigrationConfigLoader::parseStrategies)
                .ifPresent(b::strategies);

        getEnum(props, "migration.executor.mode", ExecutionMode.class, b::executionMode);
        getInt(props, "migration.executor.workers").ifPresent(v -> {
            if (v > 0) b.workers(v);
            else log.warn("Invalid executor.workers: {}", v);
        });

        getEnum(props, "migration.cycle.policy", CyclePolicy.class, b::cyclePolicy);
        getString(props, "migration.validation.runtime.failure.parity")
                .ifPresent(v -> b.runtimeFailureParity(Boolean.parseBoolean(v)));
        getEnum(props, "migration.alert.level", AlertLevel.class, b::alertLevel);

        try {
            return b.build();
        } catch (IllegalArgumentException e) {
            throw new MigrationConfigException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static Optional<Set<TestCategory>> parseStrategies(String value) {
        Set<TestCategory> strategies = EnumSet.noneOf(TestCategory.class);
        for (String token : value.split(",")) {
            String name = token.trim();
            if (name.isEmpty()) continue;
            try {
                strategies.add(TestCategory.valueOf(name.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("Unknown test strategy: {}", name);
            }
        }
        if (strategies.isEmpty()) {
            log.warn("No valid test strategies in '{}', keeping defaults", value);
            return Optional.empty();
        }
        return Optional.of(strategies);
    }

    private static <E extends Enum<E>> void getEnum(Properties props, String key, Class<E> type,
                                                    Consumer<E> setter) {
        getString(props, key).ifPresent(v -> {
            try {
                setter.accept(Enum.valueOf(type, v.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid {}: {}", key.substring("migration.".length()), v);
            }
        });
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Integer> getInt(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Double> getDouble(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Double.parseDouble(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}

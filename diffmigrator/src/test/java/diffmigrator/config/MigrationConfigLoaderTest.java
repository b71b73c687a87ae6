package diffmigrator.config;

import diffmigrator.executor.ExecutionMode;
import diffmigrator.oracle.TestCategory;
import diffmigrator.orchestrator.CyclePolicy;
import diffmigrator.orchestrator.SuiteRegeneration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MigrationConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearOverrides() {
        System.clearProperty("migration.retry.max");
    }

    @Test
    void loadFromPropertiesFile() throws IOException {
        Path file = tempDir.resolve("migration.properties");
        Files.writeString(file, """
            migration.retry.max=5
            migration.retry.suite=REGENERATE_RANDOM
            migration.timeout.compile=90
            migration.timeout.convert=0
            migration.tolerance.double.absolute=1e-9
            migration.tests.strategies=boundary, edge
            migration.tests.seed=7
            migration.executor.mode=BATCH
            migration.cycle.policy=BREAK
            migration.validation.runtime.failure.parity=true
            migration.alert.level=ERROR
            """);

        MigrationConfig config = MigrationConfigLoader.loadFromFile(file);

        assertEquals(5, config.maxRetries());
        assertEquals(SuiteRegeneration.REGENERATE_RANDOM, config.suiteRegeneration());
        assertEquals(Duration.ofSeconds(90), config.compileTimeout());
        assertEquals(Duration.ZERO, config.convertTimeout());
        assertEquals(1e-9, config.tolerance().doubleAbsolute());
        assertEquals(EnumSet.of(TestCategory.BOUNDARY, TestCategory.EDGE), config.strategies());
        assertEquals(7L, config.seed());
        assertEquals(ExecutionMode.BATCH, config.executionMode());
        assertEquals(CyclePolicy.BREAK, config.cyclePolicy());
        assertTrue(config.runtimeFailureParity());
        assertEquals(AlertLevel.ERROR, config.alertLevel());
    }

    @Test
    void loadFromYamlFile() throws IOException {
        Path file = tempDir.resolve("migration.yml");
        Files.writeString(file, """
            migration:
              retry:
                max: 2
              timeout:
                execute: 10
              tolerance:
                float:
                  absolute: 0.001
                relative: 0.0
              tests:
                max:
                  per:
                    function: 20
                random:
                  count: 3
                strategies: [random]
              executor:
                workers: 2
            """);

        MigrationConfig config = MigrationConfigLoader.loadFromFile(file);

        assertEquals(2, config.maxRetries());
        assertEquals(Duration.ofSeconds(10), config.executeTimeout());
        assertEquals(0.001, config.tolerance().floatAbsolute());
        assertEquals(0.0, config.tolerance().relative());
        assertEquals(20, config.maxTestsPerFunction());
        assertEquals(3, config.randomCount());
        assertEquals(Set.of(TestCategory.RANDOM), config.strategies());
        assertEquals(2, config.workers());
        // untouched keys keep their defaults
        assertEquals(Duration.ofSeconds(60), config.compileTimeout());
        assertEquals(CyclePolicy.ABORT, config.cyclePolicy());
    }

    @Test
    void caseInsensitiveEnums() throws IOException {
        Path file = tempDir.resolve("test.properties");
        Files.writeString(file, """
            migration.executor.mode=batch
            migration.cycle.policy=Break
            migration.alert.level=debug
            migration.retry.suite=regenerate_random
            """);

        MigrationConfig config = MigrationConfigLoader.loadFromFile(file);

        assertEquals(ExecutionMode.BATCH, config.executionMode());
        assertEquals(CyclePolicy.BREAK, config.cyclePolicy());
        assertEquals(AlertLevel.DEBUG, config.alertLevel());
        assertEquals(SuiteRegeneration.REGENERATE_RANDOM, config.suiteRegeneration());
    }

    @Test
    void invalidValuesUseDefaults() throws IOException {
        Path file = tempDir.resolve("test.properties");
        Files.writeString(file, """
            migration.retry.max=0
            migration.timeout.compile=soon
            migration.tests.random.count=-1
            migration.tests.strategies=fuzz, chaos
            migration.executor.mode=PARALLEL
            migration.executor.workers=0
            """);

        MigrationConfig config = MigrationConfigLoader.loadFromFile(file);
        MigrationConfig defaults = MigrationConfig.DEFAULTS;

        assertEquals(defaults.maxRetries(), config.maxRetries());
        assertEquals(defaults.compileTimeout(), config.compileTimeout());
        assertEquals(defaults.randomCount(), config.randomCount());
        assertEquals(defaults.strategies(), config.strategies());
        assertEquals(defaults.executionMode(), config.executionMode());
        assertEquals(defaults.workers(), config.workers());
    }

    @Test
    void unknownStrategiesAreDroppedFromList() throws IOException {
        Path file = tempDir.resolve("test.properties");
        Files.writeString(file, "migration.tests.strategies=edge,fuzz\n");

        MigrationConfig config = MigrationConfigLoader.loadFromFile(file);

        assertEquals(Set.of(TestCategory.EDGE), config.strategies());
    }

    @Test
    void negativeToleranceIsRejected() throws IOException {
        Path file = tempDir.resolve("test.properties");
        Files.writeString(file, "migration.tolerance.relative=-0.5\n");

        MigrationConfigException e = assertThrows(MigrationConfigException.class,
                () -> MigrationConfigLoader.loadFromFile(file));
        assertTrue(e.getMessage().startsWith("Invalid configuration"));
    }

    @Test
    void invalidYamlThrows() throws IOException {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "migration: [unclosed\n");

        assertThrows(MigrationConfigException.class, () -> MigrationConfigLoader.loadFromFile(file));
    }

    @Test
    void emptyYamlGivesDefaults() throws IOException {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        MigrationConfig config = MigrationConfigLoader.loadFromFile(file);

        assertEquals(MigrationConfig.DEFAULTS.maxRetries(), config.maxRetries());
        assertEquals(MigrationConfig.DEFAULTS.seed(), config.seed());
    }

    @Test
    void systemPropertyOverridesFile() throws IOException {
        Path file = tempDir.resolve("test.properties");
        Files.writeString(file, "migration.retry.max=5\n");
        System.setProperty("migration.retry.max", "8");

        MigrationConfig config = MigrationConfigLoader.loadFromFile(file);

        assertEquals(8, config.maxRetries());
    }

    @Test
    void classpathDefaultsMatchBuilderDefaults() {
        MigrationConfig config = MigrationConfigLoader.load();

        assertEquals(3, config.maxRetries());
        assertEquals(SuiteRegeneration.REUSE, config.suiteRegeneration());
        assertEquals(Duration.ofSeconds(300), config.convertTimeout());
        assertEquals(EnumSet.allOf(TestCategory.class), config.strategies());
        assertEquals(42L, config.seed());
        assertEquals(AlertLevel.WARNING, config.alertLevel());
    }

    @Test
    void nonexistentFileThrows() {
        Path file = tempDir.resolve("nonexistent.properties");
        assertThrows(IOException.class, () -> MigrationConfigLoader.loadFromFile(file));
    }
}

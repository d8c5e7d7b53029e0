package io.leasekeep.config;

import io.leasekeep.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

final class LeaseSettingsTest {

    @Test
    void missingSettingsFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-settings-default-");
        try {
            LeaseSettings settings = LeaseSettings.load(LeaseKeepConfig.fromRoot(root.toString()));

            Assertions.assertEquals(LeaseSettings.defaults(), settings);
            Assertions.assertEquals(30_000L, settings.autoSaveIntervalMs());
            Assertions.assertEquals(7_000L, settings.writeCooldownMs());
            Assertions.assertEquals(8, settings.forceLoadMaxSteps());
            Assertions.assertEquals(1_800_000L, settings.deadLockAssumedAfterMs());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void settingsFileOverridesOnlyTheFieldsItNames() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-settings-file-");
        try {
            LeaseKeepConfig config = LeaseKeepConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), "{\"writeCooldownSeconds\": 2, \"unknownField\": true}");

            LeaseSettings settings = LeaseSettings.load(config);

            Assertions.assertEquals(2, settings.writeCooldownSeconds());
            Assertions.assertEquals(LeaseSettings.DEFAULT_AUTO_SAVE_INTERVAL_SECONDS, settings.autoSaveIntervalSeconds());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void nonPositiveValuesAreRejected() {
        InvalidConfigurationException error = Assertions.assertThrows(
                InvalidConfigurationException.class,
                () -> LeaseSettings.fromJson("{\"forceLoadMaxSteps\": 0, \"issueWindowSeconds\": -5}")
        );
        Assertions.assertTrue(error.getMessage().contains("forceLoadMaxSteps"));
        Assertions.assertTrue(error.getMessage().contains("issueWindowSeconds"));

        Assertions.assertThrows(
                InvalidConfigurationException.class,
                () -> LeaseSettings.fromJson("{\"retryBaseBackoffMs\": 5000, \"retryMaxBackoffMs\": 1000}")
        );
        Assertions.assertThrows(InvalidConfigurationException.class, () -> LeaseSettings.fromJson("{not json"));
    }

    @Test
    void namespaceIsSanitizedIntoItsOwnDirectory() {
        LeaseKeepConfig config = LeaseKeepConfig.fromRoot("/tmp/leasekeep-root", "Tenant A!");

        Assertions.assertEquals("tenant-a-", config.namespace());
        Assertions.assertTrue(config.rootDir().endsWith(Path.of("namespaces", "tenant-a-")));
        Assertions.assertEquals(config.rootDir().resolve("leasekeep.db"), config.dbFile());
        Assertions.assertEquals(config.rootDir().resolve("audit").resolve("audit.log"), config.auditFile());
    }
}

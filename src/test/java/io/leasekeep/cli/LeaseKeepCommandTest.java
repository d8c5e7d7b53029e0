package io.leasekeep.cli;

import io.leasekeep.TestFiles;
import io.leasekeep.config.LeaseKeepConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

final class LeaseKeepCommandTest {

    @Test
    void initCreatesDatabaseAndMissingRecordExitsWithOne() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-cli-init-");
        try {
            Assertions.assertEquals(0, run(root, "init"));
            Assertions.assertTrue(Files.exists(root.resolve("leasekeep.db")));
            Assertions.assertEquals(1, run(root, "view", "alice"));
            Assertions.assertEquals(0, run(root, "settings"));
            Assertions.assertEquals(0, run(root, "audit-tail", "--limit", "5"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void stealCreatesRecordThatViewAndWipeSee() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-cli-steal-");
        try {
            Files.writeString(root.resolve(LeaseKeepConfig.SETTINGS_FILE),
                    "{\"writeCooldownSeconds\": 1, \"tickMillis\": 50}");
            Path template = root.resolve("template.json");
            Files.writeString(template, "{\"coins\": 10}");

            Assertions.assertEquals(0, run(root, "steal", "alice", "--template", template.toString()));
            Assertions.assertEquals(0, run(root, "view", "alice"));
            Assertions.assertEquals(0, run(root, "wipe", "alice"));
            Assertions.assertEquals(1, run(root, "view", "alice"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void nonObjectTemplateIsRejected() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-cli-template-");
        try {
            Path template = root.resolve("template.json");
            Files.writeString(template, "[1]");

            Assertions.assertThrows(IllegalArgumentException.class, () -> LeaseKeepCommand.readTemplate(template));
            Assertions.assertEquals(0, LeaseKeepCommand.readTemplate(null).size());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static int run(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return new CommandLine(new LeaseKeepCommand()).execute(full);
    }
}

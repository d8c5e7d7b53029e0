package io.leasekeep.observability;

import io.leasekeep.MutableClock;
import io.leasekeep.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class HealthMonitorTest {
    private static final long T0 = 1_700_000_000_000L;

    @Test
    void criticalStateIsEnteredOnceAndLeftAfterQuietWindow() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-health-critical-");
        try {
            MutableClock clock = new MutableClock(T0);
            AuditLogger audit = new AuditLogger(root.resolve("audit").resolve("audit.log"), "default", clock);
            HealthMonitor monitor = new HealthMonitor(clock, 5, 60_000L, 120_000L, audit, Runnable::run, (name, failure) -> { });
            List<Boolean> changes = new CopyOnWriteArrayList<>();
            monitor.criticalStateSignal().subscribe(changes::add);

            for (int i = 0; i < 4; i++) {
                monitor.reportIssue("profiles", "alice", "timeout", "slow");
                clock.advance(1_000L);
            }
            Assertions.assertFalse(monitor.isCritical());

            monitor.reportIssue("profiles", "alice", "timeout", "slow");
            monitor.reportIssue("profiles", "alice", "timeout", "slow");
            Assertions.assertTrue(monitor.isCritical());
            Assertions.assertEquals(List.of(true), changes);
            long lastIssueMs = clock.millis();

            clock.advance(61_000L);
            monitor.tick();
            Assertions.assertEquals(0, monitor.snapshot().windowIssues());
            Assertions.assertTrue(monitor.isCritical());

            clock.set(lastIssueMs + 119_999L);
            monitor.tick();
            Assertions.assertTrue(monitor.isCritical());

            clock.set(lastIssueMs + 120_000L);
            monitor.tick();
            monitor.tick();
            Assertions.assertFalse(monitor.isCritical());
            Assertions.assertEquals(List.of(true, false), changes);
            Assertions.assertEquals(6L, monitor.snapshot().issueTotal());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void issuesOlderThanWindowDoNotCount() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-health-window-");
        try {
            MutableClock clock = new MutableClock(T0);
            AuditLogger audit = new AuditLogger(root.resolve("audit").resolve("audit.log"), "default", clock);
            HealthMonitor monitor = new HealthMonitor(clock, 3, 10_000L, 20_000L, audit, Runnable::run, (name, failure) -> { });

            monitor.reportIssue("profiles", "alice", "timeout", "slow");
            monitor.reportIssue("profiles", "alice", "timeout", "slow");
            clock.advance(10_001L);
            monitor.reportIssue("profiles", "alice", "timeout", "slow");

            Assertions.assertFalse(monitor.isCritical());
            Assertions.assertEquals(1, monitor.snapshot().windowIssues());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void corruptionCountsAsIssueAndIsAudited() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-health-corruption-");
        try {
            MutableClock clock = new MutableClock(T0);
            AuditLogger audit = new AuditLogger(root.resolve("audit").resolve("audit.log"), "default", clock);
            HealthMonitor monitor = new HealthMonitor(clock, 3, 10_000L, 20_000L, audit, Runnable::run, (name, failure) -> { });
            List<HealthMonitor.IssueEvent> issues = new CopyOnWriteArrayList<>();
            List<HealthMonitor.CorruptionEvent> corruptions = new CopyOnWriteArrayList<>();
            monitor.issueSignal().subscribe(issues::add);
            monitor.corruptionSignal().subscribe(corruptions::add);

            monitor.reportCorruption("profiles", "bob", "not valid JSON");

            Assertions.assertEquals(1, issues.size());
            Assertions.assertEquals("corruption", issues.get(0).kind());
            Assertions.assertEquals(List.of(new HealthMonitor.CorruptionEvent("profiles", "bob", T0)), corruptions);
            Assertions.assertEquals("store.corruption", audit.tail(1).get(0).path("action").asText());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void auditFailureIsHandedToFailureHandlerAndSignalsStillFire() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-health-audit-broken-");
        try {
            MutableClock clock = new MutableClock(T0);
            Path auditFile = root.resolve("audit").resolve("audit.log");
            AuditLogger audit = new AuditLogger(auditFile, "default", clock);
            Files.delete(auditFile);
            Files.createDirectory(auditFile);
            List<String> failedSources = new CopyOnWriteArrayList<>();
            HealthMonitor monitor = new HealthMonitor(clock, 1, 10_000L, 20_000L, audit, Runnable::run,
                    (name, failure) -> failedSources.add(name));
            List<Boolean> changes = new CopyOnWriteArrayList<>();
            List<HealthMonitor.CorruptionEvent> corruptions = new CopyOnWriteArrayList<>();
            monitor.criticalStateSignal().subscribe(changes::add);
            monitor.corruptionSignal().subscribe(corruptions::add);

            monitor.reportCorruption("profiles", "bob", "not valid JSON");

            Assertions.assertEquals(List.of(true), changes);
            Assertions.assertEquals(1, corruptions.size());
            Assertions.assertEquals(List.of("audit", "audit"), failedSources);
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }
}

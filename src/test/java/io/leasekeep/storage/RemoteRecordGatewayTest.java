package io.leasekeep.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.leasekeep.MutableClock;
import io.leasekeep.TestFiles;
import io.leasekeep.bus.SerializedWriteChannel;
import io.leasekeep.model.ProfileRecord;
import io.leasekeep.model.RecordMetadata;
import io.leasekeep.observability.AuditLogger;
import io.leasekeep.observability.HealthMonitor;
import io.leasekeep.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

final class RemoteRecordGatewayTest {
    private static final long T0 = 1_700_000_000_000L;

    @Test
    void transientFailureIsRetriedAfterBackoff() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-gateway-retry-");
        try {
            Fixture f = new Fixture(root, 4_000_000L);
            f.store.failNext(new TransientStoreException(TransientStoreException.Reason.RATE_LIMITED, "slow down"));

            PersistResult result = f.gateway.persist("profiles", "alice", current -> record(7)).join();

            Assertions.assertTrue(result.written());
            Assertions.assertEquals(7, result.record().orElseThrow().data().get("coins").asInt());
            Assertions.assertEquals(1, f.sleeps.size());
            Assertions.assertTrue(f.sleeps.get(0) >= 100L && f.sleeps.get(0) <= 350L, "backoff " + f.sleeps.get(0));
            Assertions.assertEquals(2, f.store.callCount("alice"));
            Assertions.assertEquals(1L, f.health.snapshot().issueTotal());
            Assertions.assertEquals("rate_limited", f.issues.get(0).kind());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void exhaustedRetriesSurfaceAsStoreUnavailable() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-gateway-exhausted-");
        try {
            Fixture f = new Fixture(root, 4_000_000L);
            for (int i = 0; i < 3; i++) {
                f.store.failNext(new TransientStoreException(TransientStoreException.Reason.TIMEOUT, "timeout"));
            }

            CompletionException error = Assertions.assertThrows(
                    CompletionException.class,
                    () -> f.gateway.fetch("profiles", "alice").join()
            );

            Assertions.assertInstanceOf(StoreUnavailableException.class, error.getCause());
            Assertions.assertInstanceOf(TransientStoreException.class, error.getCause().getCause());
            Assertions.assertEquals(2, f.sleeps.size());
            Assertions.assertEquals(3, f.store.callCount("alice"));
            Assertions.assertEquals(3L, f.health.snapshot().issueTotal());
            Assertions.assertEquals(List.of(true), f.criticalChanges);
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void corruptedRecordIsReportedAndNeverOverwritten() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-gateway-corrupt-");
        try {
            Fixture f = new Fixture(root, 4_000_000L);
            f.store.putRaw("alice", "[1,2,3]");

            CompletionException error = Assertions.assertThrows(
                    CompletionException.class,
                    () -> f.gateway.persist("profiles", "alice", current -> record(1)).join()
            );

            Assertions.assertInstanceOf(DataCorruptionException.class, error.getCause());
            Assertions.assertEquals("alice", ((DataCorruptionException) error.getCause()).key());
            Assertions.assertEquals("[1,2,3]", f.store.rawValue("alice").orElseThrow());
            Assertions.assertEquals(1, f.store.callCount("alice"));
            Assertions.assertEquals(1, f.corruptions.size());
            Assertions.assertEquals(1L, f.health.snapshot().corruptionTotal());
            Assertions.assertTrue(f.sleeps.isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void oversizedPayloadFailsWithoutRetry() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-gateway-too-large-");
        try {
            Fixture f = new Fixture(root, 256L);
            ProfileRecord large = record(1);
            large.data().put("blob", "x".repeat(512));

            CompletionException error = Assertions.assertThrows(
                    CompletionException.class,
                    () -> f.gateway.persist("profiles", "alice", current -> large).join()
            );

            Assertions.assertInstanceOf(PayloadTooLargeException.class, error.getCause());
            Assertions.assertTrue(f.store.rawValue("alice").isEmpty());
            Assertions.assertEquals(1, f.store.callCount("alice"));
            Assertions.assertEquals("payload_too_large", f.issues.get(0).kind());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void updaterDecliningToWriteLeavesStoreUntouched() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-gateway-no-write-");
        try {
            Fixture f = new Fixture(root, 4_000_000L);
            String raw = ProfileCodec.encode(record(3));
            f.store.putRaw("alice", raw);

            PersistResult result = f.gateway.persist("profiles", "alice", current -> null).join();

            Assertions.assertFalse(result.written());
            Assertions.assertEquals(3, result.record().orElseThrow().data().get("coins").asInt());
            Assertions.assertEquals(raw, f.store.rawValue("alice").orElseThrow());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void untypedStoreFailureIsReportedAndSurfacesAsUnavailable() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-gateway-untyped-");
        try {
            Fixture f = new Fixture(root, 4_000_000L);
            f.store.failNext(new IllegalStateException("connection reset"));

            CompletionException error = Assertions.assertThrows(
                    CompletionException.class,
                    () -> f.gateway.fetch("profiles", "alice").join()
            );

            Assertions.assertInstanceOf(StoreUnavailableException.class, error.getCause());
            Assertions.assertInstanceOf(IllegalStateException.class, error.getCause().getCause());
            Assertions.assertEquals(1L, f.health.snapshot().issueTotal());
            Assertions.assertEquals("error", f.issues.get(0).kind());
            Assertions.assertTrue(f.sleeps.isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void brokenAuditLogDoesNotAbortRetry() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-gateway-audit-broken-");
        try {
            MutableClock clock = new MutableClock(T0);
            InMemoryRecordStore store = new InMemoryRecordStore("profiles", clock);
            Path auditFile = root.resolve("audit").resolve("audit.log");
            AuditLogger audit = new AuditLogger(auditFile, "default", clock);
            Files.delete(auditFile);
            Files.createDirectory(auditFile);
            List<String> failedSources = new CopyOnWriteArrayList<>();
            HealthMonitor health = new HealthMonitor(clock, 1, 10_000L, 20_000L, audit, Runnable::run,
                    (name, failure) -> failedSources.add(name));
            RemoteRecordGateway gateway = new RemoteRecordGateway(
                    new SerializedWriteChannel(clock, 0L, Runnable::run),
                    health,
                    new RetryPolicy(3, 100L, 1_000L),
                    4_000_000L,
                    clock::advance
            );
            gateway.registerStore(store);
            store.failNext(new TransientStoreException(TransientStoreException.Reason.RATE_LIMITED, "slow down"));

            PersistResult result = gateway.persist("profiles", "alice", current -> record(5)).join();

            Assertions.assertTrue(result.written());
            Assertions.assertTrue(health.isCritical());
            Assertions.assertEquals(List.of("audit"), failedSources);
            Assertions.assertEquals(5, ProfileCodec.decode("profiles", "alice", store.rawValue("alice").orElseThrow())
                    .data().get("coins").asInt());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void unknownStoreIsRejected() throws Exception {
        Path root = Files.createTempDirectory("leasekeep-test-gateway-unknown-");
        try {
            Fixture f = new Fixture(root, 4_000_000L);

            Assertions.assertThrows(IllegalArgumentException.class, () -> f.gateway.fetch("guilds", "alice"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static ProfileRecord record(int coins) {
        ObjectNode data = Jsons.mapper().createObjectNode().put("coins", coins);
        return new ProfileRecord(data, Jsons.mapper().createObjectNode(), RecordMetadata.fresh(T0));
    }

    private static final class Fixture {
        private final MutableClock clock = new MutableClock(T0);
        private final InMemoryRecordStore store = new InMemoryRecordStore("profiles", clock);
        private final List<Long> sleeps = new CopyOnWriteArrayList<>();
        private final List<HealthMonitor.IssueEvent> issues = new CopyOnWriteArrayList<>();
        private final List<HealthMonitor.CorruptionEvent> corruptions = new CopyOnWriteArrayList<>();
        private final List<Boolean> criticalChanges = new CopyOnWriteArrayList<>();
        private final HealthMonitor health;
        private final RemoteRecordGateway gateway;

        private Fixture(Path root, long payloadMaxBytes) {
            AuditLogger audit = new AuditLogger(root.resolve("audit").resolve("audit.log"), "default", clock);
            this.health = new HealthMonitor(clock, 3, 10_000L, 20_000L, audit, Runnable::run, (name, failure) -> {
                throw new AssertionError("listener failed in " + name, failure);
            });
            health.issueSignal().subscribe(issues::add);
            health.corruptionSignal().subscribe(corruptions::add);
            health.criticalStateSignal().subscribe(criticalChanges::add);
            SerializedWriteChannel channel = new SerializedWriteChannel(clock, 0L, Runnable::run);
            this.gateway = new RemoteRecordGateway(
                    channel,
                    health,
                    new RetryPolicy(3, 100L, 1_000L),
                    payloadMaxBytes,
                    millis -> {
                        sleeps.add(millis);
                        clock.advance(millis);
                    }
            );
            gateway.registerStore(store);
        }
    }
}

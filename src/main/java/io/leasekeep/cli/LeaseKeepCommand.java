package io.leasekeep.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.leasekeep.config.LeaseKeepConfig;
import io.leasekeep.config.LeaseSettings;
import io.leasekeep.lease.ClaimResult;
import io.leasekeep.lease.ForceLoadHandle;
import io.leasekeep.lease.Lease;
import io.leasekeep.lease.LeaseEnd;
import io.leasekeep.model.ProfileRecord;
import io.leasekeep.runtime.LeaseRuntime;
import io.leasekeep.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@Command(
        name = "leasekeep",
        mixinStandardHelpOptions = true,
        description = "Session leases over a shared record store",
        subcommands = {
                LeaseKeepCommand.InitCommand.class,
                LeaseKeepCommand.SettingsCommand.class,
                LeaseKeepCommand.ViewCommand.class,
                LeaseKeepCommand.HoldCommand.class,
                LeaseKeepCommand.StealCommand.class,
                LeaseKeepCommand.WipeCommand.class,
                LeaseKeepCommand.AuditTailCommand.class
        }
)
public final class LeaseKeepCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Namespace (tenant scope)", defaultValue = "default")
    String namespace;

    @Option(names = {"--store"}, description = "Logical record store", defaultValue = LeaseKeepConfig.DEFAULT_STORE)
    String store;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | settings | view | hold | steal | wipe | audit-tail");
    }

    LeaseKeepConfig config() {
        return LeaseKeepConfig.fromRoot(root, namespace);
    }

    LeaseRuntime runtime() {
        LeaseRuntime runtime = new LeaseRuntime(config());
        runtime.init();
        runtime.openStore(store);
        return runtime;
    }

    static ObjectNode readTemplate(Path file) throws IOException {
        if (file == null) {
            return Jsons.mapper().createObjectNode();
        }
        JsonNode node = Jsons.compact().readTree(Files.readString(file));
        if (!node.isObject()) {
            throw new IllegalArgumentException("Template must be a JSON object: " + file);
        }
        return (ObjectNode) node;
    }

    static Map<String, Object> claimView(String store, String key, ClaimResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("store", store);
        out.put("key", key);
        out.put("outcome", result.outcome().name());
        out.put("steps", result.steps());
        if (result.holder() != null) {
            out.put("holder", result.holder().toString());
        }
        if (result.lease() != null) {
            out.put("sessionLoadCount", result.lease().sessionLoadCount());
            out.put("data", result.lease().data());
        }
        if (result.error() != null) {
            out.put("error", result.error().getMessage());
        }
        return out;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        LeaseKeepCommand parent;

        @Override
        public Integer call() {
            try (LeaseRuntime runtime = parent.runtime()) {
                System.out.println("Initialized leasekeep at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "settings", description = "Show effective lease settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        LeaseKeepCommand parent;

        @Override
        public Integer call() {
            LeaseSettings settings = LeaseSettings.load(parent.config());
            System.out.println(Jsons.toJson(settings));
            return 0;
        }
    }

    @Command(name = "view", description = "Show a stored record without taking its lease")
    static final class ViewCommand implements Callable<Integer> {
        @ParentCommand
        LeaseKeepCommand parent;

        @Parameters(index = "0", description = "Record key")
        String key;

        @Override
        public Integer call() {
            try (LeaseRuntime runtime = parent.runtime()) {
                Optional<ProfileRecord> record = runtime.manager().view(parent.store, key).join();
                if (record.isEmpty()) {
                    System.out.println("{\"error\":\"record not found\"}");
                    return 1;
                }
                long nowMs = System.currentTimeMillis();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("store", parent.store);
                out.put("key", key);
                out.put("leased", record.get().metadata().isLeased());
                out.put("leaseAlive", record.get().metadata().isLeaseAlive(nowMs, runtime.settings().deadLockAssumedAfterMs()));
                out.put("record", record.get());
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "hold", description = "Claim a record and keep its lease alive until timeout or shutdown")
    static final class HoldCommand implements Callable<Integer> {
        @ParentCommand
        LeaseKeepCommand parent;

        @Parameters(index = "0", description = "Record key")
        String key;

        @Option(names = {"--seconds"}, defaultValue = "0", description = "Hold duration; 0 holds until interrupted")
        long seconds;

        @Option(names = {"--force"}, defaultValue = "false", description = "Force load when another session holds the lease")
        boolean force;

        @Option(names = {"--template"}, description = "JSON file with default payload fields")
        Path template;

        @Override
        public Integer call() throws Exception {
            ObjectNode defaults = readTemplate(template);
            LeaseRuntime runtime = parent.runtime();
            AtomicBoolean running = new AtomicBoolean(true);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                running.set(false);
                runtime.close();
            }, "leasekeep-shutdown-hook"));
            runtime.start();

            ClaimResult result;
            if (force) {
                ForceLoadHandle handle = runtime.manager().forceLoad(parent.store, key, defaults);
                result = handle.result().join();
            } else {
                result = runtime.manager().claim(parent.store, key, defaults).join();
            }
            System.out.println(Jsons.toJson(claimView(parent.store, key, result)));
            if (!result.isClaimed()) {
                runtime.close();
                return 2;
            }

            Lease lease = result.lease();
            AtomicReference<LeaseEnd> ended = new AtomicReference<>();
            lease.endSignal().subscribe(ended::set);
            long deadlineMs = seconds > 0 ? System.currentTimeMillis() + seconds * 1_000L : Long.MAX_VALUE;
            while (running.get() && lease.isActive() && System.currentTimeMillis() < deadlineMs) {
                Thread.sleep(runtime.settings().tickMillis());
            }
            boolean lost = !lease.isActive() && ended.get() != null && ended.get().reason().isLoss();
            runtime.close();
            if (lost) {
                System.out.println(Jsons.toJson(ended.get()));
                return 3;
            }
            System.out.println(Jsons.toJson(Map.of("store", parent.store, "key", key, "released", true)));
            return 0;
        }
    }

    @Command(name = "steal", description = "Take a record's lease immediately and release it")
    static final class StealCommand implements Callable<Integer> {
        @ParentCommand
        LeaseKeepCommand parent;

        @Parameters(index = "0", description = "Record key")
        String key;

        @Option(names = {"--template"}, description = "JSON file with default payload fields")
        Path template;

        @Override
        public Integer call() throws Exception {
            ObjectNode defaults = readTemplate(template);
            try (LeaseRuntime runtime = parent.runtime()) {
                ClaimResult result = runtime.manager().steal(parent.store, key, defaults).join();
                System.out.println(Jsons.toJson(claimView(parent.store, key, result)));
                return result.isClaimed() ? 0 : 2;
            }
        }
    }

    @Command(name = "wipe", description = "Delete a stored record")
    static final class WipeCommand implements Callable<Integer> {
        @ParentCommand
        LeaseKeepCommand parent;

        @Parameters(index = "0", description = "Record key")
        String key;

        @Override
        public Integer call() {
            try (LeaseRuntime runtime = parent.runtime()) {
                runtime.manager().wipe(parent.store, key).join();
                System.out.println(Jsons.toJson(Map.of("store", parent.store, "key", key, "wiped", true)));
                return 0;
            }
        }
    }

    @Command(name = "audit-tail", description = "Show latest audit log lines")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        LeaseKeepCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Number of latest lines")
        int limit;

        @Override
        public Integer call() {
            try (LeaseRuntime runtime = parent.runtime()) {
                for (JsonNode row : runtime.auditLogger().tail(limit)) {
                    System.out.println(Jsons.toCompactJson(row));
                }
            }
            return 0;
        }
    }
}

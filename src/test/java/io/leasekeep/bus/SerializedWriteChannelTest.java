package io.leasekeep.bus;

import io.leasekeep.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

final class SerializedWriteChannelTest {
    private static final long T0 = 1_700_000_000_000L;

    @Test
    void sameKeyOperationsRunOneAtATimeInSubmissionOrder() {
        MutableClock clock = new MutableClock(T0);
        ManualExecutor executor = new ManualExecutor();
        SerializedWriteChannel channel = new SerializedWriteChannel(clock, 0L, executor);
        List<Integer> order = new ArrayList<>();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();

        List<CompletableFuture<Integer>> results = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            int id = i;
            results.add(channel.submit("profiles", "alice", () -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                order.add(id);
                running.decrementAndGet();
                return id;
            }));
        }
        Assertions.assertEquals(1, executor.queued());
        Assertions.assertEquals(3, channel.pendingCount("profiles", "alice"));

        while (executor.runNext()) {
            Assertions.assertTrue(executor.queued() <= 1);
        }

        Assertions.assertEquals(List.of(1, 2, 3), order);
        Assertions.assertEquals(1, maxRunning.get());
        Assertions.assertEquals(3, results.get(2).join());
        Assertions.assertEquals(0, channel.pendingCount("profiles", "alice"));
    }

    @Test
    void cooldownHoldsNextOperationUntilTick() {
        MutableClock clock = new MutableClock(T0);
        SerializedWriteChannel channel = new SerializedWriteChannel(clock, 1_000L, Runnable::run);

        CompletableFuture<String> first = channel.submit("profiles", "alice", () -> "first");
        CompletableFuture<String> second = channel.submit("profiles", "alice", () -> "second");
        Assertions.assertEquals("first", first.join());
        Assertions.assertFalse(second.isDone());

        clock.advance(999L);
        channel.tick();
        Assertions.assertFalse(second.isDone());

        clock.advance(1L);
        channel.tick();
        Assertions.assertEquals("second", second.join());
    }

    @Test
    void differentKeysDoNotWaitForEachOther() {
        MutableClock clock = new MutableClock(T0);
        SerializedWriteChannel channel = new SerializedWriteChannel(clock, 5_000L, Runnable::run);

        CompletableFuture<String> alice = channel.submit("profiles", "alice", () -> "a");
        CompletableFuture<String> bob = channel.submit("profiles", "bob", () -> "b");
        CompletableFuture<String> otherStore = channel.submit("guilds", "alice", () -> "g");

        Assertions.assertTrue(alice.isDone());
        Assertions.assertTrue(bob.isDone());
        Assertions.assertTrue(otherStore.isDone());
        Assertions.assertEquals(3, channel.queueCount());
    }

    @Test
    void idleQueueIsRemovedAfterCooldownAndRecreatedOnDemand() {
        MutableClock clock = new MutableClock(T0);
        SerializedWriteChannel channel = new SerializedWriteChannel(clock, 1_000L, Runnable::run);

        channel.submit("profiles", "alice", () -> 1).join();
        channel.tick();
        Assertions.assertTrue(channel.hasQueue("profiles", "alice"));

        clock.advance(1_000L);
        channel.tick();
        Assertions.assertFalse(channel.hasQueue("profiles", "alice"));
        Assertions.assertEquals(0, channel.queueCount());

        CompletableFuture<Integer> again = channel.submit("profiles", "alice", () -> 2);
        Assertions.assertEquals(2, again.join());
        Assertions.assertTrue(channel.hasQueue("profiles", "alice"));
    }

    @Test
    void enqueuedRunnablesShareTheKeyQueue() {
        MutableClock clock = new MutableClock(T0);
        SerializedWriteChannel channel = new SerializedWriteChannel(clock, 1_000L, Runnable::run);
        List<String> order = new ArrayList<>();

        channel.enqueue("profiles", "alice", () -> order.add("first"));
        CompletableFuture<String> second = channel.submit("profiles", "alice", () -> {
            order.add("second");
            return "second";
        });
        Assertions.assertEquals(List.of("first"), order);

        clock.advance(1_000L);
        channel.tick();
        Assertions.assertEquals("second", second.join());
        Assertions.assertEquals(List.of("first", "second"), order);
    }

    @Test
    void failedOperationDoesNotBlockTheQueue() {
        MutableClock clock = new MutableClock(T0);
        SerializedWriteChannel channel = new SerializedWriteChannel(clock, 1_000L, Runnable::run);

        CompletableFuture<Object> failing = channel.submit("profiles", "alice", () -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<String> next = channel.submit("profiles", "alice", () -> "ok");

        CompletionException error = Assertions.assertThrows(CompletionException.class, failing::join);
        Assertions.assertInstanceOf(IllegalStateException.class, error.getCause());
        clock.advance(1_000L);
        channel.tick();
        Assertions.assertEquals("ok", next.join());
    }

    @Test
    void rejectedExecutionFailsQueuedOperationsAndDropsTheQueue() {
        MutableClock clock = new MutableClock(T0);
        Executor rejecting = task -> {
            throw new RejectedExecutionException("shut down");
        };
        SerializedWriteChannel channel = new SerializedWriteChannel(clock, 1_000L, rejecting);

        CompletableFuture<String> result = channel.submit("profiles", "alice", () -> "never");

        CompletionException error = Assertions.assertThrows(CompletionException.class, result::join);
        Assertions.assertInstanceOf(RejectedExecutionException.class, error.getCause());
        Assertions.assertEquals(0, channel.queueCount());
    }

    @Test
    void awaitIdleReturnsOnceQueuedWorkDrains() throws Exception {
        MutableClock clock = new MutableClock(T0);
        SerializedWriteChannel channel = new SerializedWriteChannel(clock, 1_000L, Runnable::run);

        channel.submit("profiles", "alice", () -> 1);
        channel.submit("profiles", "alice", () -> 2);
        Assertions.assertFalse(channel.awaitIdle(10L));

        clock.advance(1_000L);
        channel.tick();
        Assertions.assertTrue(channel.awaitIdle(10L));
    }

    private static final class ManualExecutor implements Executor {
        private final Deque<Runnable> tasks = new ArrayDeque<>();

        @Override
        public void execute(Runnable command) {
            tasks.addLast(command);
        }

        int queued() {
            return tasks.size();
        }

        boolean runNext() {
            Runnable task = tasks.pollFirst();
            if (task == null) {
                return false;
            }
            task.run();
            return true;
        }
    }
}

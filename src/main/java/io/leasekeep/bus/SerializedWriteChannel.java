package io.leasekeep.bus;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Per {@code (store, key)} FIFO of remote-store operations.
 *
 * <p>At most one operation per key is in flight, and operations for a key start in submission order.
 * After an operation completes its queue records the completion time; the next one starts only once
 * {@code cooldownMs} has passed since then, either immediately on completion (zero cooldown) or on a
 * later {@link #tick()}. A key with no queue starts its first operation at once.
 *
 * <p>Idle queues are removed by {@link #tick()} once they are empty and the cooldown has elapsed, so the
 * map only holds keys with recent traffic. Operation failures are passed to the returned future and are
 * otherwise not interpreted here.
 */
public final class SerializedWriteChannel {
    private static final long NEVER = Long.MIN_VALUE;

    private final Clock clock;
    private final long cooldownMs;
    private final Executor executor;
    private final Map<ChannelKey, WriteQueue> queues;

    public SerializedWriteChannel(Clock clock, long cooldownMs, Executor executor) {
        this.clock = clock;
        this.cooldownMs = Math.max(0L, cooldownMs);
        this.executor = executor;
        this.queues = new HashMap<>();
    }

    public void enqueue(String store, String key, Runnable operation) {
        submit(store, key, () -> {
            operation.run();
            return null;
        });
    }

    public <T> CompletableFuture<T> submit(String store, String key, Callable<T> operation) {
        CompletableFuture<T> result = new CompletableFuture<>();
        ChannelKey channelKey = new ChannelKey(store, key);
        Dispatch dispatch;
        synchronized (this) {
            WriteQueue queue = queues.computeIfAbsent(channelKey, k -> new WriteQueue());
            queue.pending.addLast(new Operation<>(operation, result));
            dispatch = nextDispatch(channelKey, queue, clock.millis());
        }
        start(dispatch);
        return result;
    }

    public void tick() {
        long nowMs = clock.millis();
        List<Dispatch> ready = new ArrayList<>();
        synchronized (this) {
            Iterator<Map.Entry<ChannelKey, WriteQueue>> it = queues.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<ChannelKey, WriteQueue> entry = it.next();
                WriteQueue queue = entry.getValue();
                Dispatch dispatch = nextDispatch(entry.getKey(), queue, nowMs);
                if (dispatch != null) {
                    ready.add(dispatch);
                } else if (queue.isIdle() && nowMs - queue.lastWriteMs >= cooldownMs) {
                    it.remove();
                }
            }
        }
        for (Dispatch dispatch : ready) {
            start(dispatch);
        }
    }

    public synchronized int queueCount() {
        return queues.size();
    }

    public synchronized boolean hasQueue(String store, String key) {
        return queues.containsKey(new ChannelKey(store, key));
    }

    public synchronized int pendingCount(String store, String key) {
        WriteQueue queue = queues.get(new ChannelKey(store, key));
        if (queue == null) {
            return 0;
        }
        return queue.pending.size() + (queue.inFlight ? 1 : 0);
    }

    /**
     * Waits until no queue has pending or in-flight work. Queued operations still need ticks to start,
     * so callers draining on shutdown keep the tick source running while they wait.
     */
    public synchronized boolean awaitIdle(long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + Math.max(0L, timeoutMs) * 1_000_000L;
        while (!allIdle()) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMs <= 0L) {
                return false;
            }
            wait(remainingMs);
        }
        return true;
    }

    private boolean allIdle() {
        for (WriteQueue queue : queues.values()) {
            if (!queue.isIdle()) {
                return false;
            }
        }
        return true;
    }

    private Dispatch nextDispatch(ChannelKey channelKey, WriteQueue queue, long nowMs) {
        if (queue.inFlight || queue.pending.isEmpty()) {
            return null;
        }
        if (queue.lastWriteMs != NEVER && nowMs - queue.lastWriteMs < cooldownMs) {
            return null;
        }
        queue.inFlight = true;
        return new Dispatch(channelKey, queue, queue.pending.pollFirst());
    }

    private void start(Dispatch dispatch) {
        if (dispatch == null) {
            return;
        }
        try {
            executor.execute(() -> run(dispatch));
        } catch (RejectedExecutionException e) {
            abandon(dispatch, e);
        }
    }

    private void run(Dispatch dispatch) {
        try {
            dispatch.operation().execute();
        } finally {
            complete(dispatch);
        }
    }

    private void complete(Dispatch dispatch) {
        Dispatch next;
        synchronized (this) {
            WriteQueue queue = dispatch.queue();
            queue.inFlight = false;
            queue.lastWriteMs = clock.millis();
            next = nextDispatch(dispatch.channelKey(), queue, queue.lastWriteMs);
            notifyAll();
        }
        start(next);
    }

    private void abandon(Dispatch dispatch, RejectedExecutionException cause) {
        List<Operation<?>> dropped = new ArrayList<>();
        dropped.add(dispatch.operation());
        synchronized (this) {
            WriteQueue queue = dispatch.queue();
            queue.inFlight = false;
            dropped.addAll(queue.pending);
            queue.pending.clear();
            queues.remove(dispatch.channelKey(), queue);
            notifyAll();
        }
        for (Operation<?> operation : dropped) {
            operation.result().completeExceptionally(cause);
        }
    }

    public record ChannelKey(String store, String key) {
    }

    private static final class WriteQueue {
        private final Deque<Operation<?>> pending = new ArrayDeque<>();
        private long lastWriteMs = NEVER;
        private boolean inFlight;

        private boolean isIdle() {
            return !inFlight && pending.isEmpty();
        }
    }

    private record Operation<T>(Callable<T> body, CompletableFuture<T> result) {
        void execute() {
            try {
                result.complete(body.call());
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        }
    }

    private record Dispatch(ChannelKey channelKey, WriteQueue queue, Operation<?> operation) {
    }
}

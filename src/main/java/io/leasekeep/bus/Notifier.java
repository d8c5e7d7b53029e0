package io.leasekeep.bus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Multi-listener broadcast. {@link #fire} hands one task per current listener to the executor and
 * returns without waiting; a listener that throws is reported to the failure handler and does not
 * affect the others.
 */
public final class Notifier<T> {
    private final String name;
    private final Executor executor;
    private final ListenerFailureHandler failureHandler;
    private final Map<Long, Consumer<? super T>> listeners;
    private final AtomicLong nextHandle;

    public Notifier(String name, Executor executor, ListenerFailureHandler failureHandler) {
        this.name = name;
        this.executor = executor;
        this.failureHandler = failureHandler;
        this.listeners = new ConcurrentHashMap<>();
        this.nextHandle = new AtomicLong(0L);
    }

    public Subscription subscribe(Consumer<? super T> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        long handle = nextHandle.incrementAndGet();
        listeners.put(handle, listener);
        return new Subscription(this, handle);
    }

    public void fire(T event) {
        List<Consumer<? super T>> snapshot = new ArrayList<>(listeners.values());
        for (Consumer<? super T> listener : snapshot) {
            try {
                executor.execute(() -> invoke(listener, event));
            } catch (RejectedExecutionException e) {
                failureHandler.onListenerFailure(name, e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void clear() {
        listeners.clear();
    }

    boolean remove(long handle) {
        return listeners.remove(handle) != null;
    }

    boolean contains(long handle) {
        return listeners.containsKey(handle);
    }

    private void invoke(Consumer<? super T> listener, T event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            failureHandler.onListenerFailure(name, e);
        }
    }

    @FunctionalInterface
    public interface ListenerFailureHandler {
        void onListenerFailure(String notifierName, Throwable failure);
    }

    public static final class Subscription {
        private final Notifier<?> owner;
        private final long handle;

        private Subscription(Notifier<?> owner, long handle) {
            this.owner = owner;
            this.handle = handle;
        }

        public boolean isConnected() {
            return owner.contains(handle);
        }

        public void unsubscribe() {
            owner.remove(handle);
        }
    }
}

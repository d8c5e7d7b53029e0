package io.leasekeep.runtime;

import io.leasekeep.lease.Lease;
import io.leasekeep.lease.LeaseLifecycleListener;
import io.leasekeep.lease.SessionLockManager;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Spreads periodic saves of every held lease over the auto-save interval.
 *
 * <p>With {@code n} active leases each one gets a slot of {@code interval / n}; every elapsed slot moves a
 * round-robin cursor one lease forward and saves it. Leases loaded less than one interval ago and leases
 * with a save already running are passed over. A lease whose last successful save is older than two
 * intervals is saved on the next tick regardless of the cursor.
 */
public final class AutoSaveScheduler implements LeaseLifecycleListener {
    private final SessionLockManager manager;
    private final Clock clock;
    private final long intervalMs;
    private final List<Lease> active;
    private int cursor;
    private long lastAutoSaveMs;

    public AutoSaveScheduler(SessionLockManager manager, Clock clock, long intervalMs) {
        this.manager = manager;
        this.clock = clock;
        this.intervalMs = Math.max(1L, intervalMs);
        this.active = new ArrayList<>();
        this.cursor = 0;
        this.lastAutoSaveMs = clock.millis();
    }

    @Override
    public synchronized void onActivated(Lease lease) {
        if (active.contains(lease)) {
            return;
        }
        if (active.isEmpty()) {
            lastAutoSaveMs = clock.millis();
        }
        active.add(lease);
    }

    @Override
    public synchronized void onDeactivated(Lease lease) {
        int index = active.indexOf(lease);
        if (index < 0) {
            return;
        }
        active.remove(index);
        if (index < cursor) {
            cursor--;
        }
        if (cursor >= active.size()) {
            cursor = 0;
        }
    }

    public synchronized int activeCount() {
        return active.size();
    }

    public synchronized boolean isScheduled(Lease lease) {
        return active.contains(lease);
    }

    public void tick() {
        tick(clock.millis());
    }

    public void tick(long nowMs) {
        List<Lease> due = new ArrayList<>();
        synchronized (this) {
            int n = active.size();
            if (n == 0) {
                lastAutoSaveMs = nowMs;
                return;
            }
            for (Lease lease : active) {
                if (lease.isActive() && !lease.isSaveInFlight() && nowMs - lease.lastSavedAtMs() > 2L * intervalMs) {
                    due.add(lease);
                }
            }
            long slotMs = Math.max(1L, intervalMs / n);
            // A long pause (suspended host, stalled ticks) catches up by at most one full rotation.
            if (nowMs - lastAutoSaveMs > intervalMs) {
                lastAutoSaveMs = nowMs - intervalMs;
            }
            while (nowMs - lastAutoSaveMs >= slotMs) {
                lastAutoSaveMs += slotMs;
                Lease next = nextEligible(nowMs);
                if (next != null && !due.contains(next)) {
                    due.add(next);
                }
            }
        }
        for (Lease lease : due) {
            manager.save(lease);
        }
    }

    private Lease nextEligible(long nowMs) {
        int n = active.size();
        for (int i = 0; i < n; i++) {
            int index = (cursor + i) % n;
            Lease lease = active.get(index);
            if (lease.isActive() && !lease.isSaveInFlight() && nowMs - lease.loadedAtMs() >= intervalMs) {
                cursor = (index + 1) % n;
                return lease;
            }
        }
        cursor = (cursor + 1) % n;
        return null;
    }
}

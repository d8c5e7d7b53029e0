package io.leasekeep.lease;

import io.leasekeep.model.SessionId;
import io.leasekeep.storage.DataCorruptionException;
import io.leasekeep.storage.StoreUnavailableException;

import java.util.concurrent.CancellationException;

public record ClaimResult(Outcome outcome, Lease lease, SessionId holder, int steps, RuntimeException error) {
    public enum Outcome {
        CLAIMED,
        SESSION_LOCKED,
        FORCE_LOAD_SUPERSEDED,
        CANCELLED,
        DATA_CORRUPTION,
        STORE_UNAVAILABLE
    }

    public static ClaimResult claimed(Lease lease, int steps) {
        return new ClaimResult(Outcome.CLAIMED, lease, null, steps, null);
    }

    public static ClaimResult locked(SessionId holder) {
        return new ClaimResult(Outcome.SESSION_LOCKED, null, holder, 1, null);
    }

    public static ClaimResult superseded(SessionId holder, int steps) {
        return new ClaimResult(Outcome.FORCE_LOAD_SUPERSEDED, null, holder, steps, null);
    }

    public static ClaimResult cancelled(int steps) {
        return new ClaimResult(Outcome.CANCELLED, null, null, steps, null);
    }

    public static ClaimResult failed(Throwable cause, int steps) {
        if (cause instanceof DataCorruptionException) {
            return new ClaimResult(Outcome.DATA_CORRUPTION, null, null, steps, (DataCorruptionException) cause);
        }
        RuntimeException error = cause instanceof StoreUnavailableException
                ? (StoreUnavailableException) cause
                : new StoreUnavailableException("Claim failed: " + cause.getMessage(), cause);
        return new ClaimResult(Outcome.STORE_UNAVAILABLE, null, null, steps, error);
    }

    public boolean isClaimed() {
        return outcome == Outcome.CLAIMED;
    }

    public Lease orElseThrow(String store, String key) {
        return switch (outcome) {
            case CLAIMED -> lease;
            case SESSION_LOCKED, FORCE_LOAD_SUPERSEDED -> throw new SessionLockedException(store, key, holder);
            case CANCELLED -> throw new CancellationException("Force load cancelled for " + store + "/" + key);
            default -> throw error;
        };
    }
}

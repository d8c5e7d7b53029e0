package io.leasekeep.storage;

public final class TransientStoreException extends RuntimeException {
    public enum Reason { RATE_LIMITED, TIMEOUT, CONTENTION }

    private final Reason reason;

    public TransientStoreException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TransientStoreException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}

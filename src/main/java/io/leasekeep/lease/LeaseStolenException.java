package io.leasekeep.lease;

public final class LeaseStolenException extends RuntimeException {
    public LeaseStolenException(String message) {
        super(message);
    }
}

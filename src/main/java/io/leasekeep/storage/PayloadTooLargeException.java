package io.leasekeep.storage;

public final class PayloadTooLargeException extends RuntimeException {
    private final long bytes;
    private final long maxBytes;

    public PayloadTooLargeException(String storeName, String key, long bytes, long maxBytes) {
        super("Payload too large for " + storeName + "/" + key + ": " + bytes + " bytes, max=" + maxBytes);
        this.bytes = bytes;
        this.maxBytes = maxBytes;
    }

    public long bytes() {
        return bytes;
    }

    public long maxBytes() {
        return maxBytes;
    }
}

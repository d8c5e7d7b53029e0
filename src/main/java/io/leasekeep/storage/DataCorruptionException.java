package io.leasekeep.storage;

public final class DataCorruptionException extends RuntimeException {
    private final String storeName;
    private final String key;

    public DataCorruptionException(String storeName, String key, String message, Throwable cause) {
        super("Corrupted record " + storeName + "/" + key + ": " + message, cause);
        this.storeName = storeName;
        this.key = key;
    }

    public String storeName() {
        return storeName;
    }

    public String key() {
        return key;
    }
}

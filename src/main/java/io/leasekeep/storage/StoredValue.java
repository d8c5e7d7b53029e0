package io.leasekeep.storage;

public record StoredValue(String key, String value, long version, long updatedAtMs) {
}

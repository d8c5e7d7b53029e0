package io.leasekeep.storage;

import io.leasekeep.model.ProfileRecord;

import java.util.Optional;

public record PersistResult(Optional<ProfileRecord> record, boolean written) {
}

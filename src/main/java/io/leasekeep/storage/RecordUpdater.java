package io.leasekeep.storage;

import io.leasekeep.model.ProfileRecord;

@FunctionalInterface
public interface RecordUpdater {
    ProfileRecord apply(ProfileRecord current);
}

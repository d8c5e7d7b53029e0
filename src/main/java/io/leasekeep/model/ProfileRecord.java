package io.leasekeep.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

public record ProfileRecord(ObjectNode data, ObjectNode metaTags, RecordMetadata metadata) {
    public ProfileRecord {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(metaTags, "metaTags");
        Objects.requireNonNull(metadata, "metadata");
    }

    public ProfileRecord withMetadata(RecordMetadata newMetadata) {
        return new ProfileRecord(data, metaTags, newMetadata);
    }
}

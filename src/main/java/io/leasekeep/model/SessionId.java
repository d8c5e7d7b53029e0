package io.leasekeep.model;

import java.util.Objects;

public record SessionId(String processId, String jobId) {
    public SessionId {
        Objects.requireNonNull(processId, "processId");
        Objects.requireNonNull(jobId, "jobId");
    }

    @Override
    public String toString() {
        return processId + "/" + jobId;
    }
}

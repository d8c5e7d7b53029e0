package io.leasekeep.lease;

public record LeaseEnd(String store, String key, Reason reason, long atMs) {
    public enum Reason {
        RELEASED,
        RELEASE_FAILED,
        STOLEN,
        FORCE_LOAD_REQUESTED;

        public boolean isLoss() {
            return this == STOLEN || this == FORCE_LOAD_REQUESTED;
        }
    }
}

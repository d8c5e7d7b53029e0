package io.leasekeep.model;

public enum LeaseState {
    UNCLAIMED,
    CLAIMING,
    ACTIVE,
    RELEASING,
    STOLEN,
    FORCE_LOADING,
    TERMINAL;

    public boolean isFinal() {
        return this == STOLEN || this == TERMINAL;
    }
}

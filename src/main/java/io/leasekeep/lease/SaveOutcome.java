package io.leasekeep.lease;

public enum SaveOutcome {
    SAVED,
    HANDED_OVER,
    STOLEN,
    SKIPPED,
    FAILED
}

package io.leasekeep.model;

public record RecordMetadata(
        SessionId activeSession,
        SessionId forceLoadSession,
        long sessionLoadCount,
        long profileCreateTime,
        long lastUpdate
) {
    public static RecordMetadata fresh(long nowMs) {
        return new RecordMetadata(null, null, 0L, nowMs, nowMs);
    }

    public boolean isLeased() {
        return activeSession != null;
    }

    public boolean isLeaseAlive(long nowMs, long deadLockAssumedAfterMs) {
        return activeSession != null && (nowMs - lastUpdate) < deadLockAssumedAfterMs;
    }

    public RecordMetadata withActiveSession(SessionId session) {
        return new RecordMetadata(session, forceLoadSession, sessionLoadCount, profileCreateTime, lastUpdate);
    }

    public RecordMetadata withForceLoadSession(SessionId session) {
        return new RecordMetadata(activeSession, session, sessionLoadCount, profileCreateTime, lastUpdate);
    }

    public RecordMetadata withLastUpdate(long nowMs) {
        return new RecordMetadata(activeSession, forceLoadSession, sessionLoadCount, profileCreateTime, nowMs);
    }

    public RecordMetadata claimedBy(SessionId session, long nowMs) {
        return new RecordMetadata(session, null, sessionLoadCount + 1L, profileCreateTime, nowMs);
    }
}

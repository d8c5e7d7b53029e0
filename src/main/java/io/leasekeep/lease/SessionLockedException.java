package io.leasekeep.lease;

import io.leasekeep.model.SessionId;

public final class SessionLockedException extends RuntimeException {
    private final SessionId holder;

    public SessionLockedException(String store, String key, SessionId holder) {
        super("Profile " + store + "/" + key + " is locked by " + holder);
        this.holder = holder;
    }

    public SessionId holder() {
        return holder;
    }
}

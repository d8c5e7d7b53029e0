package io.leasekeep.storage;

import java.util.concurrent.ThreadLocalRandom;

public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        baseBackoffMs = Math.max(1L, baseBackoffMs);
        maxBackoffMs = Math.max(baseBackoffMs, maxBackoffMs);
    }

    public long backoffMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitter = ThreadLocalRandom.current().nextLong(0L, 251L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }
}

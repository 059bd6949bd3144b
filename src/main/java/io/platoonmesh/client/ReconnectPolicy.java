package io.platoonmesh.client;

/**
 * Bounded exponential backoff: the base delay doubles per attempt up to the cap.
 */
public record ReconnectPolicy(long baseBackoffMs, long maxBackoffMs, int maxAttempts) {
    public ReconnectPolicy {
        if (baseBackoffMs <= 0L || maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException("invalid backoff bounds: base=" + baseBackoffMs + ", max=" + maxBackoffMs);
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative: " + maxAttempts);
        }
    }

    public long delayMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        return Math.min(backoff, maxBackoffMs);
    }

    public boolean exhausted(int attempt) {
        return attempt > maxAttempts;
    }
}

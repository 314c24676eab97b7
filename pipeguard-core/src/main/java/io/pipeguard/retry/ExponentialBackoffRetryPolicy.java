package io.pipeguard.retry;

import java.time.Duration;

/**
 * Deterministic exponential backoff: {@code min(base * 2^(n-1), cap)}.
 *
 * <p>The first {@code immediateAttempts} attempts wait zero. The in-process executor uses
 * none, giving 5s, 10s, 20s, 40s, 60s for base 5s and cap 60s; the stuck-document scanner
 * makes its first republish immediately, giving 0, 10, 20, 40, 60 minutes for base 5min
 * and cap 60min.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final int immediateAttempts;

    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        this(baseDelayMs, maxDelayMs, 0);
    }

    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, int immediateAttempts) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs");
        }
        if (immediateAttempts < 0) {
            throw new IllegalArgumentException("immediateAttempts must be >= 0");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.immediateAttempts = immediateAttempts;
    }

    /** In-process schedule: every retry waits. */
    public static ExponentialBackoffRetryPolicy inProcess(Duration base, Duration cap) {
        return new ExponentialBackoffRetryPolicy(base.toMillis(), cap.toMillis(), 0);
    }

    /** Scanner schedule: the first republish of a stuck entity is immediate. */
    public static ExponentialBackoffRetryPolicy scanner(Duration base, Duration cap) {
        return new ExponentialBackoffRetryPolicy(base.toMillis(), cap.toMillis(), 1);
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0 || attempts <= immediateAttempts) {
            return 0L;
        }
        int shift = attempts - 1;
        // base << 62 already overflows for any base >= 2
        if (shift >= 62) {
            return maxDelayMs;
        }
        long multiplier = 1L << shift;
        if (baseDelayMs > maxDelayMs / multiplier) {
            return maxDelayMs;
        }
        return Math.min(baseDelayMs * multiplier, maxDelayMs);
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }
}

package io.pipeguard.retry;

/**
 * Computes the wait before the next attempt.
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * @param attempts attempts made so far (1 after the first failure)
     * @return delay in milliseconds, never negative
     */
    long computeDelayMs(int attempts);
}

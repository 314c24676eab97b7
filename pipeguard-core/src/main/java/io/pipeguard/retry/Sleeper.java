package io.pipeguard.retry;

/**
 * Blocks the handling thread between attempts. Replaced in tests to avoid real waits.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}

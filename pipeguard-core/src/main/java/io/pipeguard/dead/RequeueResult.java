package io.pipeguard.dead;

/**
 * Outcome of {@link FailedQueueConsole#requeue}. In a dry run {@code requeued} counts the
 * messages that would have been republished.
 */
public record RequeueResult(String queue, String targetRoutingKey, int requeued, int skipped, boolean dryRun) {
}

package io.pipeguard.dead;

/**
 * Outcome of {@link FailedQueueConsole#purge}. In a dry run {@code purged} counts the messages
 * that would have been deleted.
 */
public record PurgeResult(String queue, int purged, boolean dryRun) {
}

package io.pipeguard.dead;

import java.nio.file.Path;

/**
 * Outcome of {@link FailedQueueConsole#export}.
 *
 * @param exported number of messages written to {@code file}
 * @param drained  number of exported messages removed from the queue
 */
public record ExportResult(String queue, Path file, int totalInQueue, int exported, int drained) {
}

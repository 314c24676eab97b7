package io.pipeguard.model;

import io.pipeguard.idempotency.IdempotencyContract;
import io.pipeguard.schema.PipelineEvents;

import java.util.List;
import java.util.Optional;

/**
 * The pipeline's tracked collections with their default attempt ceilings.
 */
public final class TrackedCollections {
    public static final TrackedCollection ARCHIVES =
            new TrackedCollection("archives", 3, PipelineEvents.ARCHIVE_INGESTED, IdempotencyContract.UNIQUE_INSERT);
    public static final TrackedCollection MESSAGES =
            new TrackedCollection("messages", 3, PipelineEvents.JSON_PARSED, IdempotencyContract.UNIQUE_INSERT);
    public static final TrackedCollection CHUNKS =
            new TrackedCollection("chunks", 5, PipelineEvents.CHUNKS_PREPARED, IdempotencyContract.CHECK_BEFORE_WRITE);
    public static final TrackedCollection THREADS =
            new TrackedCollection("threads", 5, PipelineEvents.SUMMARIZATION_REQUESTED,
                    IdempotencyContract.CHECK_BEFORE_WRITE);

    private static final List<TrackedCollection> STANDARD = List.of(ARCHIVES, MESSAGES, CHUNKS, THREADS);

    private TrackedCollections() {
    }

    public static List<TrackedCollection> standard() {
        return STANDARD;
    }

    public static Optional<TrackedCollection> byName(String name) {
        return STANDARD.stream().filter(c -> c.name().equals(name)).findFirst();
    }
}

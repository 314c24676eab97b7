package io.pipeguard.stage;

import java.util.List;
import java.util.Optional;

import static io.pipeguard.schema.PipelineEvents.ARCHIVE_INGESTED;
import static io.pipeguard.schema.PipelineEvents.ARCHIVE_INGESTION_FAILED;
import static io.pipeguard.schema.PipelineEvents.CHUNKING_FAILED;
import static io.pipeguard.schema.PipelineEvents.CHUNKS_PREPARED;
import static io.pipeguard.schema.PipelineEvents.EMBEDDINGS_GENERATED;
import static io.pipeguard.schema.PipelineEvents.EMBEDDING_GENERATION_FAILED;
import static io.pipeguard.schema.PipelineEvents.JSON_PARSED;
import static io.pipeguard.schema.PipelineEvents.ORCHESTRATION_FAILED;
import static io.pipeguard.schema.PipelineEvents.PARSING_FAILED;
import static io.pipeguard.schema.PipelineEvents.REPORT_DELIVERY_FAILED;
import static io.pipeguard.schema.PipelineEvents.SUMMARIZATION_FAILED;
import static io.pipeguard.schema.PipelineEvents.SUMMARIZATION_REQUESTED;
import static io.pipeguard.schema.PipelineEvents.SUMMARY_COMPLETE;

/**
 * Stages of the document pipeline, in derivation order.
 */
public final class PipelineStages {
    public static final StageDescriptor INGESTION =
            new StageDescriptor("Ingestion", null, ARCHIVE_INGESTION_FAILED, "source_name");
    public static final StageDescriptor PARSING =
            new StageDescriptor("Parsing", ARCHIVE_INGESTED, PARSING_FAILED, "archive_id");
    public static final StageDescriptor CHUNKING =
            new StageDescriptor("Chunking", JSON_PARSED, CHUNKING_FAILED, "archive_id");
    public static final StageDescriptor EMBEDDING =
            new StageDescriptor("Embedding", CHUNKS_PREPARED, EMBEDDING_GENERATION_FAILED, "message_doc_id");
    public static final StageDescriptor ORCHESTRATION =
            new StageDescriptor("Orchestration", EMBEDDINGS_GENERATED, ORCHESTRATION_FAILED, "embedding_batch_id");
    public static final StageDescriptor SUMMARIZATION =
            new StageDescriptor("Summarization", SUMMARIZATION_REQUESTED, SUMMARIZATION_FAILED, "thread_id");
    public static final StageDescriptor REPORTING =
            new StageDescriptor("Reporting", SUMMARY_COMPLETE, REPORT_DELIVERY_FAILED, "summary_id");

    private static final List<StageDescriptor> STANDARD = List.of(
            INGESTION, PARSING, CHUNKING, EMBEDDING, ORCHESTRATION, SUMMARIZATION, REPORTING);

    private PipelineStages() {
    }

    public static List<StageDescriptor> standard() {
        return STANDARD;
    }

    public static Optional<StageDescriptor> forFailedRoutingKey(List<StageDescriptor> stages, String routingKey) {
        for (StageDescriptor stage : stages) {
            if (stage.failedEvent().routingKey().equals(routingKey)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }
}

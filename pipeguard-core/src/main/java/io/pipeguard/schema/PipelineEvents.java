package io.pipeguard.schema;

import io.pipeguard.EventType;

import java.util.Optional;

import static io.pipeguard.schema.FieldType.ARRAY;
import static io.pipeguard.schema.FieldType.INTEGER;
import static io.pipeguard.schema.FieldType.NUMBER;
import static io.pipeguard.schema.FieldType.OBJECT;
import static io.pipeguard.schema.FieldType.STRING;
import static io.pipeguard.schema.FieldType.TIMESTAMP;

/**
 * The document pipeline's event catalogue: every event type, its routing key and the schema
 * of its data. All entries are version {@code 1.0}.
 *
 * <p>Every {@code *Failed} event carries {@code original_data}, {@code error_message},
 * {@code error_type}, {@code retry_count}, {@code failed_at} and the failing stage's entity id.
 */
public enum PipelineEvents implements EventType {
    ARCHIVE_INGESTED("ArchiveIngested", "archive.ingested", EventSchema.builder()
            .required("archive_id", STRING)
            .required("source_name", STRING)
            .optionalEnum("source_type", "rsync", "imap", "http", "local")
            .optional("source_url", STRING)
            .required("file_path", STRING)
            .optional("file_size_bytes", INTEGER)
            .optional("file_hash_sha256", STRING)
            .optional("ingestion_started_at", TIMESTAMP)
            .optional("ingestion_completed_at", TIMESTAMP)
            .build()),
    ARCHIVE_INGESTION_FAILED("ArchiveIngestionFailed", "archive.ingestion.failed", failed("source_name")),

    JSON_PARSED("JSONParsed", "json.parsed", EventSchema.builder()
            .required("archive_id", STRING)
            .required("message_count", INTEGER)
            .optionalArrayOf("parsed_message_ids", STRING)
            .optional("thread_count", INTEGER)
            .optionalArrayOf("thread_ids", STRING)
            .optional("parsing_duration_seconds", NUMBER)
            .build()),
    PARSING_FAILED("ParsingFailed", "parsing.failed", failed("archive_id")),

    CHUNKS_PREPARED("ChunksPrepared", "chunks.prepared", EventSchema.builder()
            .required("message_doc_id", STRING)
            .requiredArrayOf("chunk_ids", STRING)
            .required("chunk_count", INTEGER)
            .optional("archive_id", STRING)
            .build()),
    CHUNKING_FAILED("ChunkingFailed", "chunking.failed", failed("archive_id")),

    EMBEDDINGS_GENERATED("EmbeddingsGenerated", "embeddings.generated", EventSchema.builder()
            .requiredArrayOf("chunk_ids", STRING)
            .required("embedding_count", INTEGER)
            .optional("embedding_model", STRING)
            .optional("embedding_backend", STRING)
            .build()),
    EMBEDDING_GENERATION_FAILED("EmbeddingGenerationFailed", "embedding.generation.failed",
            failed("message_doc_id")),

    SUMMARIZATION_REQUESTED("SummarizationRequested", "summarization.requested", EventSchema.builder()
            .requiredArrayOf("thread_ids", STRING)
            .optional("archive_id", STRING)
            .optional("top_k", INTEGER)
            .optional("prompt_template", STRING)
            .build()),
    ORCHESTRATION_FAILED("OrchestrationFailed", "orchestration.failed", failed("embedding_batch_id")),

    SUMMARY_COMPLETE("SummaryComplete", "summary.complete", EventSchema.builder()
            .required("summary_id", STRING)
            .required("thread_id", STRING)
            .optional("summary_markdown", STRING)
            .optionalArrayOf("citations", OBJECT)
            .optional("llm_backend", STRING)
            .optional("llm_model", STRING)
            .optional("tokens_prompt", INTEGER)
            .optional("tokens_completion", INTEGER)
            .optional("latency_ms", INTEGER)
            .build()),
    SUMMARIZATION_FAILED("SummarizationFailed", "summarization.failed", failed("thread_id")),

    REPORT_PUBLISHED("ReportPublished", "report.published", EventSchema.builder()
            .required("report_id", STRING)
            .required("thread_id", STRING)
            .optional("summary_id", STRING)
            .optionalEnum("format", "markdown", "html", "json")
            .build()),
    REPORT_DELIVERY_FAILED("ReportDeliveryFailed", "report.delivery.failed", failed("summary_id"));

    private final String typeName;
    private final String routingKey;
    private final EventSchema schema;

    PipelineEvents(String typeName, String routingKey, EventSchema schema) {
        this.typeName = typeName;
        this.routingKey = routingKey;
        this.schema = schema;
    }

    /**
     * Schema shared by every {@code *Failed} event.
     *
     * @param idField name of the failing stage's entity id field
     */
    public static EventSchema failed(String idField) {
        return EventSchema.builder()
                .required(idField, STRING)
                .required("original_data", OBJECT)
                .required("error_message", STRING)
                .required("error_type", STRING)
                .required("retry_count", INTEGER)
                .required("failed_at", TIMESTAMP)
                .build();
    }

    /**
     * Returns a new registry holding every catalogue entry.
     */
    public static SchemaRegistry registry() {
        SchemaRegistry registry = new SchemaRegistry();
        for (PipelineEvents event : values()) {
            registry.register(event.typeName, event.version(), event.schema);
        }
        return registry;
    }

    public static Optional<PipelineEvents> forType(String typeName) {
        for (PipelineEvents event : values()) {
            if (event.typeName.equals(typeName)) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }

    public static Optional<PipelineEvents> forRoutingKey(String routingKey) {
        for (PipelineEvents event : values()) {
            if (event.routingKey.equals(routingKey)) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public String routingKey() {
        return routingKey;
    }

    public EventSchema schema() {
        return schema;
    }
}

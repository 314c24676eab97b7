package io.pipeguard.dead;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipeguard.Envelope;
import io.pipeguard.EventType;
import io.pipeguard.bus.Delivery;
import io.pipeguard.bus.EventPublisher;
import io.pipeguard.bus.MessageBus;
import io.pipeguard.schema.EnvelopeCodec;
import io.pipeguard.schema.SchemaRegistry;
import io.pipeguard.schema.ValidationException;
import io.pipeguard.spi.MetricsExporter;
import io.pipeguard.stage.StageDescriptor;
import io.pipeguard.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator actions on the failed queues: list, inspect, export, requeue and purge.
 *
 * <p>Failed queues are the queues bound to the {@code .failed} routing key of a known stage.
 * Requeue unwraps {@code original_data} from each failure envelope and republishes it as the
 * stage's input event through a validating publisher, so a replay cannot inject a malformed
 * event. Every destructive operation claims messages first and acknowledges them only once
 * the operation on that message succeeded.
 */
public final class FailedQueueConsole {
    private static final Logger logger = Logger.getLogger(FailedQueueConsole.class.getName());

    static final String CONSUMER_ID = "pipeguard-console";

    private final MessageBus bus;
    private final EventPublisher publisher;
    private final SchemaRegistry registry;
    private final EnvelopeCodec codec;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final Map<String, StageDescriptor> stagesByQueue = new LinkedHashMap<>();

    public FailedQueueConsole(MessageBus bus, EventPublisher publisher, SchemaRegistry registry,
                              List<StageDescriptor> stages) {
        this(bus, publisher, registry, new EnvelopeCodec(), stages, MetricsExporter.NOOP, Clock.systemUTC());
    }

    /**
     * @param registry the registry {@code publisher} validates against; dry runs use it to
     *                 predict which replays the publisher would refuse
     */
    public FailedQueueConsole(MessageBus bus, EventPublisher publisher, SchemaRegistry registry, EnvelopeCodec codec,
                              List<StageDescriptor> stages, MetricsExporter metrics, Clock clock) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
        this.clock = clock != null ? clock : Clock.systemUTC();
        for (StageDescriptor stage : Objects.requireNonNull(stages, "stages")) {
            for (String queue : bus.topology().queuesFor(stage.failedEvent().routingKey())) {
                stagesByQueue.putIfAbsent(queue, stage);
            }
        }
    }

    /**
     * Returns the message count of every known failed queue, in stage order.
     */
    public Map<String, Integer> list() {
        Map<String, Integer> depths = new LinkedHashMap<>();
        for (String queue : stagesByQueue.keySet()) {
            depths.put(queue, bus.depth(queue));
        }
        return depths;
    }

    public StageDescriptor stageFor(String queue) {
        StageDescriptor stage = stagesByQueue.get(queue);
        if (stage == null) {
            throw new UnknownFailedQueueException(queue);
        }
        return stage;
    }

    /**
     * Returns up to {@code limit} messages without removing them.
     */
    public List<FailedMessage> inspect(String queue, int limit) {
        stageFor(queue);
        List<FailedMessage> messages = new ArrayList<>();
        for (Delivery delivery : bus.peek(queue, effectiveLimit(queue, limit))) {
            messages.add(toFailedMessage(delivery));
        }
        return messages;
    }

    /**
     * Writes up to {@code limit} messages to {@code target} as one JSON document. The file is
     * written to a temporary sibling, forced to disk and moved into place. With {@code drain}
     * the exported messages are removed from the queue, but only after the file is in place.
     *
     * @throws UncheckedIOException if the file cannot be written; no message is removed then
     */
    public ExportResult export(String queue, Path target, int limit, boolean drain) {
        stageFor(queue);
        Objects.requireNonNull(target, "target");
        int total = bus.depth(queue);
        int max = effectiveLimit(queue, limit);
        List<Delivery> deliveries = drain ? bus.fetch(queue, CONSUMER_ID, max) : bus.peek(queue, max);

        ArrayNode messages = Jsons.mapper().createArrayNode();
        for (Delivery delivery : deliveries) {
            messages.add(toJson(toFailedMessage(delivery)));
        }
        ObjectNode document = Jsons.object();
        document.put("queue", queue);
        document.put("export_timestamp",
                DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS)));
        document.put("total_messages_in_queue", total);
        document.put("messages_exported", deliveries.size());
        document.set("messages", messages);

        try {
            writeAtomically(target, Jsons.mapper().writerWithDefaultPrettyPrinter().writeValueAsBytes(document));
        } catch (IOException e) {
            if (drain) {
                deliveries.forEach(d -> bus.nack(d, true));
            }
            throw new UncheckedIOException("Failed to export " + queue + " to " + target, e);
        }

        int drained = 0;
        if (drain) {
            for (Delivery delivery : deliveries) {
                bus.ack(delivery);
                drained++;
            }
            metrics.incrementFailedQueueAction(queue, "export_drain", drained);
        }
        logger.log(Level.INFO, "Exported " + deliveries.size() + " messages from " + queue + " to " + target
                + (drain ? " (drained " + drained + ")" : ""));
        return new ExportResult(queue, target, total, deliveries.size(), drained);
    }

    /**
     * Replays up to {@code limit} failure envelopes into the stage's input routing key.
     * Messages that cannot be decoded, lack {@code original_data}, or fail validation stay in
     * the failed queue and are counted as skipped.
     *
     * @throws IllegalArgumentException if the stage has no input event
     */
    public RequeueResult requeue(String queue, int limit, boolean dryRun) {
        StageDescriptor stage = stageFor(queue);
        EventType input = stage.input().orElseThrow(() -> new IllegalArgumentException(
                "Failures of stage " + stage.name() + " cannot be requeued: it has no input event"));
        int max = effectiveLimit(queue, limit);
        int requeued = 0;
        int skipped = 0;

        if (dryRun) {
            for (Delivery delivery : bus.peek(queue, max)) {
                try {
                    registry.validate(replayEnvelope(input, delivery));
                    requeued++;
                } catch (ValidationException e) {
                    skipped++;
                }
            }
            logger.log(Level.INFO, "[DRY RUN] Would requeue " + requeued + " messages from " + queue + " to "
                    + input.routingKey() + " (" + skipped + " not replayable)");
            return new RequeueResult(queue, input.routingKey(), requeued, skipped, true);
        }

        for (Delivery delivery : bus.fetch(queue, CONSUMER_ID, max)) {
            try {
                publisher.publish(input.routingKey(), replayEnvelope(input, delivery));
                bus.ack(delivery);
                requeued++;
            } catch (RuntimeException e) {
                bus.nack(delivery, true);
                skipped++;
                logger.log(Level.WARNING, "Leaving message " + delivery.messageId() + " in " + queue + ": "
                        + e.getMessage());
            }
        }
        metrics.incrementFailedQueueAction(queue, "requeue", requeued);
        logger.log(Level.INFO, "Requeued " + requeued + " messages from " + queue + " to " + input.routingKey()
                + " (" + skipped + " skipped)");
        return new RequeueResult(queue, input.routingKey(), requeued, skipped, false);
    }

    /**
     * Deletes up to {@code limit} messages.
     *
     * @throws PurgeNotConfirmedException unless {@code confirm} or {@code dryRun} is set
     */
    public PurgeResult purge(String queue, int limit, boolean confirm, boolean dryRun) {
        stageFor(queue);
        int max = effectiveLimit(queue, limit);
        if (dryRun) {
            int count = bus.peek(queue, max).size();
            logger.log(Level.INFO, "[DRY RUN] Would purge " + count + " messages from " + queue);
            return new PurgeResult(queue, count, true);
        }
        if (!confirm) {
            throw new PurgeNotConfirmedException(queue);
        }
        int purged = 0;
        for (Delivery delivery : bus.fetch(queue, CONSUMER_ID, max)) {
            bus.ack(delivery);
            purged++;
        }
        metrics.incrementFailedQueueAction(queue, "purge", purged);
        logger.log(Level.WARNING, "Purged " + purged + " messages from " + queue);
        return new PurgeResult(queue, purged, false);
    }

    private Envelope replayEnvelope(EventType input, Delivery delivery) {
        Envelope failure = codec.decode(delivery.body());
        JsonNode original = failure.data().get("original_data");
        if (!(original instanceof ObjectNode originalData)) {
            throw new ValidationException(failure.type(), failure.version(),
                    List.of("original_data: required field is missing"));
        }
        return Envelope.builder(input).data(originalData).build();
    }

    private FailedMessage toFailedMessage(Delivery delivery) {
        try {
            Envelope envelope = codec.decode(delivery.body());
            return new FailedMessage(delivery.messageId(), delivery.routingKey(), delivery.deliveryCount(),
                    delivery.enqueuedAt(), envelope, delivery.body(), null);
        } catch (ValidationException e) {
            return new FailedMessage(delivery.messageId(), delivery.routingKey(), delivery.deliveryCount(),
                    delivery.enqueuedAt(), null, delivery.body(), e.getMessage());
        }
    }

    /**
     * JSON view of a failed message as used by export and the CLI.
     */
    public ObjectNode toJson(FailedMessage message) {
        ObjectNode node = Jsons.object();
        node.put("message_id", message.messageId());
        node.put("routing_key", message.routingKey());
        node.put("delivery_count", message.deliveryCount());
        Instant enqueuedAt = message.enqueuedAt();
        node.put("enqueued_at", enqueuedAt == null ? null : DateTimeFormatter.ISO_INSTANT.format(enqueuedAt));
        if (message.isDecoded()) {
            node.set("message", codec.toNode(message.envelope()));
        } else {
            ObjectNode raw = node.putObject("message");
            raw.put("raw_body", message.rawBody());
            raw.put("decode_error", message.decodeError());
        }
        return node;
    }

    private int effectiveLimit(String queue, int limit) {
        return limit > 0 ? limit : Math.max(bus.depth(queue), 1);
    }

    private static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, "." + absolute.getFileName(), ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, absolute, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}

package io.pipeguard.dead;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipeguard.Envelope;
import io.pipeguard.bus.Delivery;
import io.pipeguard.bus.InMemoryMessageBus;
import io.pipeguard.bus.Topology;
import io.pipeguard.bus.ValidatingPublisher;
import io.pipeguard.schema.EnvelopeCodec;
import io.pipeguard.schema.PipelineEvents;
import io.pipeguard.spi.MetricsExporter;
import io.pipeguard.stage.PipelineStages;
import io.pipeguard.util.Jsons;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FailedQueueConsoleTest {
  private final InMemoryMessageBus bus = new InMemoryMessageBus(Topology.standard());
  private final EnvelopeCodec codec = new EnvelopeCodec();
  private final FailedQueueConsole console = new FailedQueueConsole(bus,
      new ValidatingPublisher(bus, PipelineEvents.registry()), PipelineEvents.registry(), codec,
      PipelineStages.standard(),
      MetricsExporter.NOOP, Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));

  @TempDir
  Path tempDir;

  private void parsingFailed(String archiveId) {
    ObjectNode original = Jsons.object();
    original.put("archive_id", archiveId);
    original.put("source_name", "list-archive");
    original.put("file_path", "/data/" + archiveId + ".mbox");
    ObjectNode data = Jsons.object();
    data.put("archive_id", archiveId);
    data.set("original_data", original);
    data.put("error_message", "corrupt");
    data.put("error_type", "IllegalStateException");
    data.put("retry_count", 3);
    data.put("failed_at", "2025-01-01T00:00:00Z");
    bus.publish("parsing.failed", codec.encode(Envelope.of(PipelineEvents.PARSING_FAILED, data)));
  }

  @Test
  void listsEveryFailedQueue() {
    parsingFailed("a1");
    parsingFailed("a2");

    Map<String, Integer> queues = console.list();

    assertEquals(7, queues.size());
    assertEquals(2, queues.get("parsing.failed"));
    assertEquals(0, queues.get("archive.ingestion.failed"));
  }

  @Test
  void unknownQueueIsRejected() {
    assertThrows(UnknownFailedQueueException.class, () -> console.inspect("json.parsed", 10));
  }

  @Test
  void inspectDoesNotConsume() {
    parsingFailed("a1");
    bus.publish("parsing.failed", "garbage");

    List<FailedMessage> messages = console.inspect("parsing.failed", 10);

    assertEquals(2, messages.size());
    assertTrue(messages.get(0).isDecoded());
    assertFalse(messages.get(1).isDecoded());
    assertNotNull(messages.get(1).decodeError());
    assertEquals(2, bus.depth("parsing.failed"));
  }

  @Test
  void requeueReplaysOriginalDataAsInputEvent() {
    parsingFailed("a1");
    bus.publish("parsing.failed", "garbage");

    RequeueResult result = console.requeue("parsing.failed", 0, false);

    assertEquals(1, result.requeued());
    assertEquals(1, result.skipped());
    assertEquals("archive.ingested", result.targetRoutingKey());
    assertEquals(1, bus.depth("parsing.failed"));
    Delivery replayed = bus.fetch("archive.ingested", "test", 1).get(0);
    Envelope envelope = codec.decode(replayed.body());
    assertEquals("ArchiveIngested", envelope.type());
    assertEquals("a1", envelope.text("archive_id"));
  }

  @Test
  void requeueDryRunChangesNothing() {
    parsingFailed("a1");

    RequeueResult result = console.requeue("parsing.failed", 0, true);

    assertTrue(result.dryRun());
    assertEquals(1, result.requeued());
    assertEquals(1, bus.depth("parsing.failed"));
    assertEquals(0, bus.depth("archive.ingested"));
  }

  @Test
  void dryRunPredictsSchemaRejectionOfReplay() {
    parsingFailed("a1");
    ObjectNode incomplete = Jsons.object();
    incomplete.put("archive_id", "a2");
    incomplete.put("source_name", "list-archive");
    ObjectNode data = Jsons.object();
    data.put("archive_id", "a2");
    data.set("original_data", incomplete);
    data.put("error_message", "corrupt");
    data.put("error_type", "IllegalStateException");
    data.put("retry_count", 3);
    data.put("failed_at", "2025-01-01T00:00:00Z");
    bus.publish("parsing.failed", codec.encode(Envelope.of(PipelineEvents.PARSING_FAILED, data)));

    RequeueResult preview = console.requeue("parsing.failed", 0, true);
    RequeueResult actual = console.requeue("parsing.failed", 0, false);

    assertEquals(1, preview.requeued());
    assertEquals(1, preview.skipped());
    assertEquals(preview.requeued(), actual.requeued());
    assertEquals(preview.skipped(), actual.skipped());
    assertEquals(1, bus.depth("parsing.failed"));
    assertEquals(1, bus.depth("archive.ingested"));
  }

  @Test
  void ingestionFailuresCannotBeRequeued() {
    assertThrows(IllegalArgumentException.class, () -> console.requeue("archive.ingestion.failed", 0, false));
  }

  @Test
  void purgeRequiresConfirmation() {
    parsingFailed("a1");

    assertThrows(PurgeNotConfirmedException.class, () -> console.purge("parsing.failed", 0, false, false));
    assertEquals(1, bus.depth("parsing.failed"));

    PurgeResult preview = console.purge("parsing.failed", 0, false, true);
    assertEquals(1, preview.purged());
    assertEquals(1, bus.depth("parsing.failed"));

    PurgeResult purged = console.purge("parsing.failed", 0, true, false);
    assertEquals(1, purged.purged());
    assertEquals(0, bus.depth("parsing.failed"));
  }

  @Test
  void purgeHonoursLimit() {
    parsingFailed("a1");
    parsingFailed("a2");
    parsingFailed("a3");

    assertEquals(2, console.purge("parsing.failed", 2, true, false).purged());
    assertEquals(1, bus.depth("parsing.failed"));
  }

  @Test
  void exportWritesDocumentAndKeepsMessages() throws Exception {
    parsingFailed("a1");
    Path file = tempDir.resolve("out/parsing-failed.json");

    ExportResult result = console.export("parsing.failed", file, 0, false);

    assertEquals(1, result.exported());
    assertEquals(0, result.drained());
    assertEquals(1, bus.depth("parsing.failed"));
    JsonNode document = Jsons.mapper().readTree(Files.readString(file));
    assertEquals("parsing.failed", document.get("queue").asText());
    assertEquals("2025-01-01T00:00:00Z", document.get("export_timestamp").asText());
    assertEquals(1, document.get("total_messages_in_queue").asInt());
    assertEquals(1, document.get("messages_exported").asInt());
    assertEquals("ParsingFailed", document.get("messages").get(0).get("message").get("type").asText());
  }

  @Test
  void exportWithDrainRemovesMessagesAfterWriting() throws Exception {
    parsingFailed("a1");
    parsingFailed("a2");
    Path file = tempDir.resolve("drain.json");

    ExportResult result = console.export("parsing.failed", file, 0, true);

    assertEquals(2, result.drained());
    assertEquals(0, bus.depth("parsing.failed"));
    assertTrue(Files.exists(file));
  }

  @Test
  void failedExportKeepsMessages() throws Exception {
    parsingFailed("a1");
    Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");

    assertThrows(java.io.UncheckedIOException.class,
        () -> console.export("parsing.failed", blocker.resolve("out.json"), 0, true));
    assertEquals(1, bus.depth("parsing.failed"));
    assertEquals(1, bus.fetch("parsing.failed", "test", 5).size());
  }
}

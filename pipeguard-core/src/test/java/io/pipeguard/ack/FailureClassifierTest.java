package io.pipeguard.ack;

import io.pipeguard.DocumentNotFoundException;
import io.pipeguard.FailureKind;
import io.pipeguard.PermanentFailureException;
import io.pipeguard.TransientFailureException;
import io.pipeguard.schema.ValidationException;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

  @Test
  void buildWithoutFallbackFails() {
    assertThrows(IllegalStateException.class, () -> FailureClassifier.builder()
        .transientOnInfrastructureErrors()
        .build());
  }

  @Test
  void infrastructureErrorsAreTransient() {
    FailureClassifier classifier = FailureClassifier.builder()
        .transientOnInfrastructureErrors()
        .otherwise(FailureKind.PERMANENT)
        .build();

    assertEquals(FailureKind.TRANSIENT, classifier.classify(new ConnectException("refused")));
    assertEquals(FailureKind.TRANSIENT, classifier.classify(new SocketTimeoutException("slow")));
    assertEquals(FailureKind.TRANSIENT, classifier.classify(new SQLTransientConnectionException("pool")));
    assertEquals(FailureKind.PERMANENT, classifier.classify(new IllegalStateException("bug")));
  }

  @Test
  void documentNotFoundPresetRetriesLateVisibleDocuments() {
    FailureClassifier classifier = FailureClassifier.builder()
        .transientOnDocumentNotFound()
        .otherwise(FailureKind.PERMANENT)
        .build();
    FailureClassifier without = FailureClassifier.builder().otherwise(FailureKind.PERMANENT).build();

    DocumentNotFoundException missing = new DocumentNotFoundException("messages", "9f86d081884c7d65");
    assertEquals(FailureKind.TRANSIENT, classifier.classify(missing));
    assertEquals(FailureKind.PERMANENT, without.classify(missing));
    assertEquals("messages", missing.collection());
  }

  @Test
  void causeChainIsInspected() {
    FailureClassifier classifier = FailureClassifier.builder()
        .transientOnInfrastructureErrors()
        .otherwise(FailureKind.PERMANENT)
        .build();

    RuntimeException wrapped = new RuntimeException("outer",
        new UncheckedIOException(new java.io.IOException("io", new ConnectException("refused"))));

    assertEquals(FailureKind.TRANSIENT, classifier.classify(wrapped));
  }

  @Test
  void builtInExceptionsMapToTheirKind() {
    FailureClassifier classifier = FailureClassifier.builder()
        .otherwise(FailureKind.TRANSIENT)
        .build();

    assertEquals(FailureKind.MALFORMED,
        classifier.classify(new ValidationException("JSONParsed", "1.0", List.of("archive_id: required field is missing"))));
    assertEquals(FailureKind.PERMANENT, classifier.classify(new PermanentFailureException("gone")));
    assertEquals(FailureKind.TRANSIENT, classifier.classify(new TransientFailureException("busy")));
  }

  @Test
  void firstMatchingRuleWins() {
    FailureClassifier classifier = FailureClassifier.builder()
        .permanentOn(IllegalArgumentException.class)
        .transientOn(RuntimeException.class)
        .otherwise(FailureKind.PERMANENT)
        .build();

    assertEquals(FailureKind.PERMANENT, classifier.classify(new NumberFormatException("x")));
    assertEquals(FailureKind.TRANSIENT, classifier.classify(new IllegalStateException("x")));
    assertEquals(FailureKind.PERMANENT, classifier.classify(new Exception("checked")));
  }
}

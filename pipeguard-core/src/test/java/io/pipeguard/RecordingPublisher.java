package io.pipeguard;

import io.pipeguard.bus.EventPublisher;

import java.util.ArrayList;
import java.util.List;

/**
 * Captures published envelopes; optionally fails every publish.
 */
public class RecordingPublisher implements EventPublisher {
  public record Published(String routingKey, Envelope envelope) {
  }

  private final List<Published> published = new ArrayList<>();
  private RuntimeException failWith;

  public void failWith(RuntimeException error) {
    this.failWith = error;
  }

  @Override
  public synchronized void publish(String routingKey, Envelope envelope) {
    if (failWith != null) {
      throw failWith;
    }
    published.add(new Published(routingKey, envelope));
  }

  public synchronized List<Published> published() {
    return List.copyOf(published);
  }

  public synchronized List<Envelope> publishedTo(String routingKey) {
    List<Envelope> out = new ArrayList<>();
    for (Published p : published) {
      if (p.routingKey().equals(routingKey)) {
        out.add(p.envelope());
      }
    }
    return out;
  }
}

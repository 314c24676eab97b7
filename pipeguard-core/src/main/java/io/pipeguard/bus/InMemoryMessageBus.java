package io.pipeguard.bus;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single-process {@link MessageBus}. Suitable for tests and embedded pipelines.
 *
 * <p>A requeued message goes back to the head of its queue. Claimed messages that are never
 * acknowledged stay claimed until {@link #recoverUnacked(String)} is called, which simulates a
 * consumer connection dropping.
 */
public final class InMemoryMessageBus implements MessageBus {

    private record Message(String id, String routingKey, String body, Instant enqueuedAt, int deliveries) {
        Message delivered() {
            return new Message(id, routingKey, body, enqueuedAt, deliveries + 1);
        }
    }

    private final Topology topology;
    private final Map<String, Deque<Message>> ready = new HashMap<>();
    private final Map<String, Map<String, Message>> unacked = new HashMap<>();

    public InMemoryMessageBus(Topology topology) {
        this.topology = Objects.requireNonNull(topology, "topology");
        for (String queue : topology.queues()) {
            ready.put(queue, new ArrayDeque<>());
            unacked.put(queue, new HashMap<>());
        }
    }

    @Override
    public synchronized int publish(String routingKey, String body) {
        List<String> queues = topology.queuesFor(routingKey);
        Instant now = Instant.now();
        for (String queue : queues) {
            ready.get(queue).addLast(new Message(UlidCreator.getMonotonicUlid().toString(), routingKey, body, now, 0));
        }
        return queues.size();
    }

    @Override
    public synchronized List<Delivery> fetch(String queue, String consumerId, int limit) {
        Deque<Message> messages = readyQueue(queue);
        List<Delivery> out = new ArrayList<>();
        while (out.size() < limit && !messages.isEmpty()) {
            Message message = messages.pollFirst().delivered();
            unacked.get(queue).put(message.id(), message);
            out.add(toDelivery(queue, message));
        }
        return out;
    }

    @Override
    public synchronized void ack(Delivery delivery) {
        unackedQueue(delivery.queue()).remove(delivery.messageId());
    }

    @Override
    public synchronized void nack(Delivery delivery, boolean requeue) {
        Message message = unackedQueue(delivery.queue()).remove(delivery.messageId());
        if (message != null && requeue) {
            ready.get(delivery.queue()).addFirst(message);
        }
    }

    @Override
    public synchronized List<Delivery> peek(String queue, int limit) {
        List<Delivery> out = new ArrayList<>();
        Iterator<Message> it = readyQueue(queue).iterator();
        while (out.size() < limit && it.hasNext()) {
            out.add(toDelivery(queue, it.next()));
        }
        return out;
    }

    @Override
    public synchronized int depth(String queue) {
        return readyQueue(queue).size() + unackedQueue(queue).size();
    }

    @Override
    public Topology topology() {
        return topology;
    }

    /**
     * Returns every claimed but unacknowledged message of the queue to the ready list.
     *
     * @return number of messages made visible again
     */
    public synchronized int recoverUnacked(String queue) {
        Map<String, Message> pending = unackedQueue(queue);
        int recovered = pending.size();
        pending.values().forEach(message -> ready.get(queue).addFirst(message));
        pending.clear();
        return recovered;
    }

    private Deque<Message> readyQueue(String queue) {
        Deque<Message> messages = ready.get(queue);
        if (messages == null) {
            throw new MessageBusException("Unknown queue: " + queue);
        }
        return messages;
    }

    private Map<String, Message> unackedQueue(String queue) {
        Map<String, Message> messages = unacked.get(queue);
        if (messages == null) {
            throw new MessageBusException("Unknown queue: " + queue);
        }
        return messages;
    }

    private static Delivery toDelivery(String queue, Message message) {
        return new Delivery(message.id(), queue, message.routingKey(), message.body(),
                message.deliveries(), message.enqueuedAt());
    }
}

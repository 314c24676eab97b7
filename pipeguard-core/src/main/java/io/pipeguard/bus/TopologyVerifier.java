package io.pipeguard.bus;

import io.pipeguard.EventType;
import io.pipeguard.stage.StageDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Detects drift between the event catalogue and the bus bindings: a success event nobody
 * can receive, or a stage whose failures would vanish.
 */
public final class TopologyVerifier {

    private TopologyVerifier() {
    }

    /**
     * @return one message per problem, empty when the topology is complete
     */
    public static List<String> verify(Topology topology, Collection<? extends EventType> events,
                                      Collection<StageDescriptor> stages) {
        List<String> problems = new ArrayList<>();
        for (EventType event : events) {
            if (!event.isFailure() && !topology.isBound(event.routingKey())) {
                problems.add("No queue bound for " + event.typeName() + " (" + event.routingKey() + ")");
            }
        }
        for (StageDescriptor stage : stages) {
            String failedKey = stage.failedEvent().routingKey();
            if (!topology.isBound(failedKey)) {
                problems.add("Stage " + stage.name() + " has no failed queue bound for " + failedKey);
            }
            if (stage.inputEvent() != null && !topology.isBound(stage.inputEvent().routingKey())) {
                problems.add("Stage " + stage.name() + " input " + stage.inputEvent().routingKey() + " is not bound");
            }
        }
        return problems;
    }

    /**
     * @throws IllegalStateException listing every problem found
     */
    public static void requireComplete(Topology topology, Collection<? extends EventType> events,
                                       Collection<StageDescriptor> stages) {
        List<String> problems = verify(topology, events, stages);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Bus topology is incomplete: " + String.join("; ", problems));
        }
    }
}

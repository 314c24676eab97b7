package io.pipeguard.bus;

import io.pipeguard.EventHandler;
import io.pipeguard.EventType;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe map from envelope type to its single handler.
 */
public final class HandlerRegistry {
    private final Map<String, EventHandler> handlers = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if the type already has a handler
     */
    public HandlerRegistry register(String eventType, EventHandler handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        if (handlers.putIfAbsent(eventType, handler) != null) {
            throw new IllegalStateException("Handler already registered for " + eventType);
        }
        return this;
    }

    public HandlerRegistry register(EventType eventType, EventHandler handler) {
        return register(eventType.typeName(), handler);
    }

    /**
     * @return the handler, or {@code null} if none is registered
     */
    public EventHandler handlerFor(String eventType) {
        return handlers.get(eventType);
    }
}

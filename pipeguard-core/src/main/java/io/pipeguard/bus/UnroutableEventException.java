package io.pipeguard.bus;

/**
 * No handler is registered for a validated envelope's type. Treated as a permanent failure.
 */
public class UnroutableEventException extends RuntimeException {

    public UnroutableEventException(String message) {
        super(message);
    }
}

package io.pipeguard.ack;

import io.pipeguard.HandlerResult;

import java.util.Objects;

/**
 * Maps a classified handler outcome to an acknowledgment.
 *
 * <table>
 *   <caption>Decisions</caption>
 *   <tr><th>Outcome</th><th>Acknowledgement</th></tr>
 *   <tr><td>{@code Done}</td><td>{@link Acknowledgement#ACK}</td></tr>
 *   <tr><td>{@code Failed(MALFORMED)}</td><td>{@link Acknowledgement#DROP}</td></tr>
 *   <tr><td>{@code Failed(PERMANENT)}</td><td>{@link Acknowledgement#DROP}</td></tr>
 *   <tr><td>{@code Failed(TRANSIENT)}</td><td>{@link Acknowledgement#REQUEUE}</td></tr>
 * </table>
 */
public final class AcknowledgmentPolicy {

    public static final AcknowledgmentPolicy STANDARD = new AcknowledgmentPolicy();

    private AcknowledgmentPolicy() {
    }

    public Acknowledgement decide(HandlerResult result) {
        Objects.requireNonNull(result, "result");
        if (result instanceof HandlerResult.Failed failed) {
            return switch (failed.kind()) {
                case TRANSIENT -> Acknowledgement.REQUEUE;
                case MALFORMED, PERMANENT -> Acknowledgement.DROP;
            };
        }
        return Acknowledgement.ACK;
    }
}

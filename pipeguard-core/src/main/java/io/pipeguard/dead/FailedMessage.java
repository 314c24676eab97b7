package io.pipeguard.dead;

import io.pipeguard.Envelope;

import java.time.Instant;

/**
 * A message sitting in a failed queue, decoded when possible.
 *
 * @param envelope    decoded envelope, or {@code null} if the body could not be decoded
 * @param decodeError reason decoding failed, or {@code null}
 */
public record FailedMessage(String messageId, String routingKey, int deliveryCount, Instant enqueuedAt,
                            Envelope envelope, String rawBody, String decodeError) {

    public boolean isDecoded() {
        return envelope != null;
    }
}

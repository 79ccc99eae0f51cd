package tech.notifyrelay.notify.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * A single change notification observed on a relayed channel.
 *
 * <p>Events carry no sequence number: duplicates and gaps are both possible and
 * tolerated. Two events are the same only if channel and payload match.</p>
 */
public record ChangeEvent(
        String channel,
        JsonNode payload,
        Instant observedAt
) {

    public ChangeEvent {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(observedAt, "observedAt");
    }

    public static ChangeEvent of(String channel, JsonNode payload) {
        return new ChangeEvent(channel, payload, Instant.now());
    }
}

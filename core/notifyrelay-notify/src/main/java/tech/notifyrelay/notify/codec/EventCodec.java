package tech.notifyrelay.notify.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jboss.logging.Logger;
import tech.notifyrelay.notify.model.ChangeEvent;

import java.util.Optional;

/**
 * JSON codec for NOTIFY payloads and the bus envelope.
 *
 * <p>Every relayed event travels on a single bus channel wrapped as
 * {@code {"channel": "<name>", "payload": <json>}}. Malformed input is logged and
 * skipped; decoding never throws.</p>
 */
public class EventCodec {

    private static final Logger LOG = Logger.getLogger(EventCodec.class);

    static final String FIELD_CHANNEL = "channel";
    static final String FIELD_PAYLOAD = "payload";

    private static final int LOG_PREVIEW_CHARS = 100;

    private final ObjectMapper objectMapper;

    public EventCodec() {
        this(new ObjectMapper());
    }

    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses the text payload of a database notification.
     *
     * @return the event, or empty if the payload is blank or not JSON
     */
    public Optional<ChangeEvent> decodeNotification(String channel, String rawPayload) {
        if (rawPayload == null || rawPayload.isBlank()) {
            LOG.warnf("Empty payload received on channel=%s", channel);
            return Optional.empty();
        }
        try {
            JsonNode payload = objectMapper.readTree(rawPayload.strip());
            return Optional.of(ChangeEvent.of(channel, payload));
        } catch (JsonProcessingException e) {
            LOG.errorf("Failed to decode payload on channel=%s: %s (payload=%s)",
                channel, e.getOriginalMessage(), preview(rawPayload));
            return Optional.empty();
        }
    }

    public String encodeEnvelope(String channel, JsonNode payload) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put(FIELD_CHANNEL, channel);
        envelope.set(FIELD_PAYLOAD, payload);
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode bus envelope for channel " + channel, e);
        }
    }

    /**
     * @return the event carried by a bus message, or empty if the envelope is malformed
     */
    public Optional<ChangeEvent> decodeEnvelope(String message) {
        try {
            JsonNode envelope = objectMapper.readTree(message);
            JsonNode channel = envelope.get(FIELD_CHANNEL);
            if (channel == null || !channel.isTextual() || channel.asText().isEmpty()) {
                LOG.warnf("Bus message without channel ignored: %s", preview(message));
                return Optional.empty();
            }
            JsonNode payload = envelope.get(FIELD_PAYLOAD);
            if (payload == null) {
                payload = objectMapper.nullNode();
            }
            return Optional.of(ChangeEvent.of(channel.asText(), payload));
        } catch (JsonProcessingException e) {
            LOG.errorf("Failed to decode bus message: %s (message=%s)", e.getOriginalMessage(), preview(message));
            return Optional.empty();
        }
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    private static String preview(String text) {
        if (text == null) {
            return "null";
        }
        return text.length() <= LOG_PREVIEW_CHARS ? text : text.substring(0, LOG_PREVIEW_CHARS) + "...";
    }
}

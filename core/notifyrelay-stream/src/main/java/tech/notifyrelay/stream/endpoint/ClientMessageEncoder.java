package tech.notifyrelay.stream.endpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import tech.notifyrelay.notify.model.ChangeEvent;

/**
 * Renders a change event as the JSON text frame sent to streaming clients:
 * {@code {"channel": ..., "payload": ..., "observedAt": ...}}.
 */
public class ClientMessageEncoder {

    private final ObjectMapper objectMapper;

    public ClientMessageEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ChangeEvent event) throws JsonProcessingException {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("channel", event.channel());
        message.set("payload", event.payload());
        message.put("observedAt", event.observedAt().toString());
        return objectMapper.writeValueAsString(message);
    }
}

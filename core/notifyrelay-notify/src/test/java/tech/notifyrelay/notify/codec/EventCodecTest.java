package tech.notifyrelay.notify.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import tech.notifyrelay.notify.model.ChangeEvent;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EventCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EventCodec codec = new EventCodec(objectMapper);

    @Test
    void shouldDecodeJsonNotificationPayload() {
        Optional<ChangeEvent> event = codec.decodeNotification("match_change",
            "  {\"table\": \"match\", \"operation\": \"UPDATE\", \"data\": {\"id\": 42}}\n");

        assertTrue(event.isPresent());
        assertEquals("match_change", event.get().channel());
        assertEquals(42, event.get().payload().path("data").path("id").asInt());
        assertNotNull(event.get().observedAt());
    }

    @Test
    void shouldSkipBlankPayload() {
        assertTrue(codec.decodeNotification("match_change", "").isEmpty());
        assertTrue(codec.decodeNotification("match_change", "   ").isEmpty());
        assertTrue(codec.decodeNotification("match_change", null).isEmpty());
    }

    @Test
    void shouldSkipMalformedPayload() {
        assertTrue(codec.decodeNotification("match_change", "{not json").isEmpty());
    }

    @Test
    void shouldWrapEventInEnvelope() throws Exception {
        JsonNode payload = objectMapper.readTree("{\"match_id\": 123, \"data\": \"test\"}");

        String message = codec.encodeEnvelope("player_match_change", payload);

        JsonNode envelope = objectMapper.readTree(message);
        assertEquals("player_match_change", envelope.get("channel").asText());
        assertEquals(payload, envelope.get("payload"));

        ChangeEvent decoded = codec.decodeEnvelope(message).orElseThrow();
        assertEquals("player_match_change", decoded.channel());
        assertEquals(payload, decoded.payload());
    }

    @Test
    void shouldIgnoreEnvelopeWithoutChannel() {
        assertTrue(codec.decodeEnvelope("{\"payload\": {}}").isEmpty());
        assertTrue(codec.decodeEnvelope("{\"channel\": 5, \"payload\": {}}").isEmpty());
        assertTrue(codec.decodeEnvelope("garbage").isEmpty());
    }

    @Test
    void shouldTreatMissingPayloadAsJsonNull() {
        ChangeEvent event = codec.decodeEnvelope("{\"channel\": \"match_change\"}").orElseThrow();

        assertTrue(event.payload().isNull());
    }
}

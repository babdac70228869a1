package com.signals.arena.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.signals.arena.support.ArenaTestFixture;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ArenaMessageCodecTest {

    private final ArenaMessageCodec codec = new ArenaMessageCodec(ArenaTestFixture.OBJECT_MAPPER);

    @Test
    void encode_writesTypePayloadAndEpochMillisTimestamp() throws Exception {
        String text = codec.encode(ArenaEventType.QUEUE_UPDATE, new ArenaEventPayloads.QueueUpdate(4),
                Instant.ofEpochMilli(1_700_000_000_123L));

        JsonNode node = ArenaTestFixture.OBJECT_MAPPER.readTree(text);
        assertEquals("QUEUE_UPDATE", node.get("type").asText());
        assertEquals(4, node.get("payload").get("queueSize").asInt());
        assertEquals(1_700_000_000_123L, node.get("timestamp").asLong());
    }

    @Test
    void decode_knownTypesCaseInsensitively() {
        InboundMessage message = codec.decode("{\"type\":\"commit_choice\",\"payload\":{\"matchId\":\"12\",\"commitHash\":\"0xab\"}}");

        assertEquals(InboundMessageType.COMMIT_CHOICE, message.type());
        assertEquals(12L, message.requireLong("matchId"));
        assertEquals("0xab", message.requireText("commitHash"));
    }

    @Test
    void decode_missingPayloadIsAnEmptyObject() {
        InboundMessage message = codec.decode("{\"type\":\"PING\"}");

        assertEquals(InboundMessageType.PING, message.type());
        assertEquals("missing_field", assertThrows(ProtocolException.class, () -> message.requireText("x")).getCode());
    }

    @Test
    void decode_rejectsMalformedFramesWithStableCodes() {
        assertEquals("malformed_message", assertThrows(ProtocolException.class, () -> codec.decode("{nope")).getCode());
        assertEquals("malformed_message", assertThrows(ProtocolException.class, () -> codec.decode("[1,2]")).getCode());
        assertEquals("missing_field", assertThrows(ProtocolException.class, () -> codec.decode("{}")).getCode());
        assertEquals("unknown_type", assertThrows(ProtocolException.class,
                () -> codec.decode("{\"type\":\"HACK\"}")).getCode());
        assertEquals("unknown_type", assertThrows(ProtocolException.class,
                () -> codec.decode("{\"type\":\"DISCONNECT\"}")).getCode());
        assertEquals("malformed_message", assertThrows(ProtocolException.class,
                () -> codec.decode("{\"type\":\"PING\",\"payload\":3}")).getCode());
    }

    @Test
    void requireAmount_rejectsFractionalAmounts() {
        InboundMessage message = codec.decode("{\"type\":\"PLACE_BET\",\"payload\":{\"amount\":\"12.5\",\"other\":100}}");

        assertEquals("invalid_field", assertThrows(ProtocolException.class,
                () -> message.requireAmount("amount")).getCode());
        assertEquals(100L, message.requireAmount("other").longValue());
    }
}

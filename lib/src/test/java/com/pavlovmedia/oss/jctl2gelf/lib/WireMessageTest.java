package com.pavlovmedia.oss.jctl2gelf.lib;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

class WireMessageTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testRequiredFields() throws Exception {
        // Given
        GelfMessage message = new GelfMessage("h1", "disk full").setLevel(SystemLevel.ERROR);

        // When
        JsonNode json = mapper.readTree(new WireMessage(message).toGelf());

        // Then
        assertEquals("1.1", json.get("version").asText());
        assertEquals("h1", json.get("host").asText());
        assertEquals("disk full", json.get("short_message").asText());
        assertEquals(3, json.get("level").asInt());
        assertTrue(json.get("level").isInt());
        assertFalse(json.has("full_message"));
        assertFalse(json.has("team"));
        assertFalse(json.has("service"));
    }

    @Test
    void testMetadataRoundTrip() throws Exception {
        // Given
        ObjectNode nested = JsonNodeFactory.instance.objectNode().put("a", 1);
        GelfMessage message = new GelfMessage("h1", "hello");
        message.setMetadata("PID", new TextNode("123"));
        message.setMetadata("nested", nested);
        message.setMetadata("id", new TextNode("nope"));

        // When
        JsonNode json = mapper.readTree(new WireMessage(message).toGelf());

        // Then
        assertEquals("123", json.get("_PID").asText());
        assertEquals(nested, json.get("_nested"));
        assertFalse(json.has("_id"));
        assertFalse(json.has("id"));
        assertEquals(message.getLevel().getCode(), json.get("level").asInt());
    }

    @Test
    void testOptionalFields() throws Exception {
        GelfMessage message = new GelfMessage("h1", "hello")
                .setFullMessage("hello\nworld")
                .setTimestamp(1700000000.123456);

        JsonNode json = mapper.readTree(
                new WireMessage(message, Optional.of("platform"), Optional.of("billing")).toGelf());

        assertEquals("hello\nworld", json.get("full_message").asText());
        assertEquals(1700000000.123456, json.get("timestamp").asDouble(), 1e-6);
        assertEquals("platform", json.get("team").asText());
        assertEquals("billing", json.get("service").asText());
    }

    @Test
    void testTimestampFilledAtEncodeTime() throws Exception {
        GelfMessage message = new GelfMessage("h1", "hello");
        WireMessage wire = new WireMessage(message);

        double before = System.currentTimeMillis() / 1000d;
        JsonNode json = mapper.readTree(wire.toGelf());
        double after = System.currentTimeMillis() / 1000d;

        double timestamp = json.get("timestamp").asDouble();
        assertTrue(timestamp >= before - 0.001, "timestamp before encode");
        assertTrue(timestamp <= after + 0.001, "timestamp after encode");
        assertFalse(message.getTimestamp().isPresent());
    }

    @Test
    void testHostAndShortMessageAreTrimmed() throws Exception {
        GelfMessage message = new GelfMessage("\"h1\" ", " \"quoted text\"");

        JsonNode json = mapper.readTree(new WireMessage(message).toGelf());

        assertEquals("h1", json.get("host").asText());
        assertEquals("quoted text", json.get("short_message").asText());
    }

    @Test
    void testTrim() {
        assertEquals("", WireMessageSerializer.trim("\"\" "));
        assertEquals("a \"b\" c", WireMessageSerializer.trim(" a \"b\" c\""));
        assertEquals("plain", WireMessageSerializer.trim("plain"));
    }

    @Test
    void testToChunkedMessage() throws Exception {
        GelfMessage message = new GelfMessage("h1", "hello");

        ChunkedMessage chunked = new WireMessage(message).toChunkedMessage(ChunkSize.WAN, MessageCompression.NONE);

        assertEquals(1, chunked.getChunkCount());
        JsonNode json = mapper.readTree(chunked.iterator().next());
        assertEquals("hello", json.get("short_message").asText());
    }

    @Test
    void testToChunkedMessageTooLarge() {
        StringBuilder sb = new StringBuilder();
        while (sb.length() < 129 * ChunkSize.WAN.getBodySize()) {
            sb.append("0123456789abcdef");
        }
        GelfMessage message = new GelfMessage("h1", sb.toString());

        GelfException e = assertThrows(GelfException.class,
                () -> new WireMessage(message).toChunkedMessage(ChunkSize.WAN, MessageCompression.NONE));
        assertEquals(GelfException.ErrorKind.INTERNAL_FAILURE, e.getKind());
    }
}

package com.relay.network.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.common.exception.ErrorCode;
import com.relay.common.exception.NetworkException;
import com.relay.common.model.Envelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class JsonEnvelopeCodecTest {

    private JsonEnvelopeCodec codec;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        codec = new JsonEnvelopeCodec();
    }

    @Test
    void testEncodeWritesAllFields() throws Exception {
        String json = codec.encode(Envelope.data("prices", "{\"price\":9.99}"));

        JsonNode node = mapper.readTree(json);
        assertEquals("prices", node.get("topic").asText());
        assertEquals("data", node.get("type").asText());
        assertEquals("{\"price\":9.99}", node.get("payload").asText());
        assertFalse(node.get("silent").asBoolean());
        assertEquals(4, node.size());
    }

    @Test
    void testDecodeWireMessage() throws Exception {
        byte[] wire = "{\"topic\":\"orders\",\"type\":\"data\",\"payload\":\"abc\",\"silent\":false}"
                .getBytes(StandardCharsets.UTF_8);

        Envelope envelope = codec.decode(wire);

        assertEquals(Envelope.data("orders", "abc"), envelope);
    }

    @Test
    void testDecodeDefaultsMissingPayloadAndSilent() throws Exception {
        Envelope envelope = codec.decode("{\"topic\":\"orders\",\"type\":\"presence\"}");

        assertEquals("", envelope.getPayload());
        assertFalse(envelope.isSilent());
        assertEquals("presence", envelope.getType());
    }

    @Test
    void testDecodeIgnoresUnknownFields() throws Exception {
        Envelope envelope = codec.decode("{\"topic\":\"t\",\"type\":\"sub\",\"silent\":true,\"extra\":42}");

        assertTrue(envelope.isSubscribe());
        assertTrue(envelope.isSilent());
    }

    @Test
    void testDecodeRejectsMalformedJson() {
        NetworkException ex = assertThrows(NetworkException.class,
                () -> codec.decode("not json at all".getBytes(StandardCharsets.UTF_8)));

        assertEquals(ErrorCode.NETWORK_DECODING_ERROR, ex.getErrorCode());
    }

    @Test
    void testDecodeRejectsNonObject() {
        assertThrows(NetworkException.class, () -> codec.decode("[1,2,3]"));
        assertThrows(NetworkException.class, () -> codec.decode("\"just a string\""));
    }

    @Test
    void testDecodeRejectsMissingTopic() {
        NetworkException ex = assertThrows(NetworkException.class,
                () -> codec.decode("{\"type\":\"data\",\"payload\":\"x\"}"));

        assertTrue(ex.getMessage().contains("topic"));
    }

    @Test
    void testDecodeRejectsNonStringPayload() {
        assertThrows(NetworkException.class,
                () -> codec.decode("{\"topic\":\"t\",\"type\":\"data\",\"payload\":{\"a\":1}}"));
    }

    @Test
    void testDecodeRejectsOversizedMessage() {
        JsonEnvelopeCodec small = new JsonEnvelopeCodec(new ObjectMapper(), 16);
        byte[] wire = "{\"topic\":\"orders\",\"type\":\"data\"}".getBytes(StandardCharsets.UTF_8);

        NetworkException ex = assertThrows(NetworkException.class, () -> small.decode(wire));
        assertEquals(ErrorCode.NETWORK_DECODING_ERROR, ex.getErrorCode());
    }

    @Test
    void testEncodeRejectsMissingType() {
        NetworkException ex = assertThrows(NetworkException.class,
                () -> codec.encode(new Envelope("t", null, "", false)));

        assertEquals(ErrorCode.NETWORK_ENCODING_ERROR, ex.getErrorCode());
    }
}

package com.elevance.cloudmock.util;

import com.elevance.cloudmock.exception.MockApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonPayloadsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void parse_withValidObject_shouldReturnTree() {
        JsonNode node = JsonPayloads.parse(objectMapper, "{\"name\":\"demo\"}");

        assertEquals("demo", node.path("name").asText());
    }

    @Test
    void parse_withMalformedJson_shouldThrowBadRequest() {
        MockApiException e = assertThrows(MockApiException.class,
                () -> JsonPayloads.parse(objectMapper, "{\"name\":"));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatus());
        assertEquals("Invalid JSON payload", e.getMessage());
    }

    @Test
    void parse_withTrailingGarbage_shouldThrowBadRequest() {
        assertThrows(MockApiException.class, () -> JsonPayloads.parse(objectMapper, "{} trailing"));
    }

    @Test
    void parse_withBlankOrMissingBody_shouldThrowBadRequest() {
        assertThrows(MockApiException.class, () -> JsonPayloads.parse(objectMapper, null));
        assertThrows(MockApiException.class, () -> JsonPayloads.parse(objectMapper, "   "));
    }

    @Test
    void optionalText_shouldOnlyAcceptStrings() throws Exception {
        // Arrange
        JsonNode payload = objectMapper.readTree(
                "{\"text\":\"value\",\"number\":42,\"flag\":true,\"nothing\":null,\"object\":{}}");

        // Act & Assert
        assertEquals(Optional.of("value"), JsonPayloads.optionalText(payload, "text"));
        assertTrue(JsonPayloads.optionalText(payload, "number").isEmpty());
        assertTrue(JsonPayloads.optionalText(payload, "flag").isEmpty());
        assertTrue(JsonPayloads.optionalText(payload, "nothing").isEmpty());
        assertTrue(JsonPayloads.optionalText(payload, "object").isEmpty());
        assertTrue(JsonPayloads.optionalText(payload, "missing").isEmpty());
    }

    @Test
    void stringified_shouldRenderNonStringValuesAndSkipNull() throws Exception {
        // Arrange
        JsonNode payload = objectMapper.readTree("{\"text\":\"abc\",\"number\":42,\"empty\":\"\",\"nothing\":null}");

        // Act & Assert
        assertEquals(Optional.of("abc"), JsonPayloads.stringified(payload, "text"));
        assertEquals(Optional.of("42"), JsonPayloads.stringified(payload, "number"));
        assertEquals(Optional.of(""), JsonPayloads.stringified(payload, "empty"));
        assertTrue(JsonPayloads.stringified(payload, "nothing").isEmpty());
        assertTrue(JsonPayloads.stringified(payload, "missing").isEmpty());
    }

    @Test
    void optionalText_onNonObjectPayload_shouldBeEmpty() throws Exception {
        JsonNode payload = objectMapper.readTree("[1, 2, 3]");

        assertTrue(JsonPayloads.optionalText(payload, "name").isEmpty());
    }
}

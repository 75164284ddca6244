package com.elevance.cloudmock.util;

import com.elevance.cloudmock.exception.MockApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.http.HttpStatus;

import java.util.Optional;

/**
 * Request body parsing and optional field decoding.
 */
public final class JsonPayloads {

    public static final String INVALID_JSON_MESSAGE = "Invalid JSON payload";

    private JsonPayloads() {
    }

    /**
     * Parses a raw request body, rejecting blank bodies and trailing garbage with a 400.
     */
    public static JsonNode parse(ObjectMapper objectMapper, String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new MockApiException(HttpStatus.BAD_REQUEST, INVALID_JSON_MESSAGE);
        }
        ObjectReader reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        try {
            return reader.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new MockApiException(HttpStatus.BAD_REQUEST, INVALID_JSON_MESSAGE, e);
        }
    }

    /**
     * The field's text when it is present and a JSON string; empty for any other type or when missing.
     */
    public static Optional<String> optionalText(JsonNode payload, String field) {
        JsonNode value = payload.path(field);
        return value.isTextual() ? Optional.of(value.asText()) : Optional.empty();
    }

    /**
     * The field rendered as a string: the text of a JSON string, the JSON text of anything else.
     * Empty when the field is missing or JSON null.
     */
    public static Optional<String> stringified(JsonNode payload, String field) {
        JsonNode value = payload.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(value.isTextual() ? value.asText() : value.toString());
    }
}

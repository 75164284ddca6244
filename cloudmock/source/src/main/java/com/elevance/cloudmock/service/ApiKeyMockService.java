package com.elevance.cloudmock.service;

import com.elevance.cloudmock.exception.MockApiException;
import com.elevance.cloudmock.model.ApiKey;
import com.elevance.cloudmock.model.KeyDeleteResponse;
import com.elevance.cloudmock.util.JsonPayloads;
import com.elevance.cloudmock.util.MockIdGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Service that generates mock API key responses.
 * There is no key store: reads echo the requested id and deletes always succeed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApiKeyMockService {

    static final String DEFAULT_KEY_NAME = "Unnamed Key";
    static final String KEY_ID_REQUIRED_MESSAGE = "API Key ID is required";
    static final String SECRET_PREFIX = "mock_api_key_";
    static final String MOCK_USER_ID = "user_mock_123";

    private final ObjectMapper objectMapper;
    private final MockIdGenerator idGenerator;

    public ApiKey getKey(String keyId) {
        log.info("Generating mock API key for id: {}", keyId);

        return ApiKey.builder()
                .id(keyId)
                .name("Mock API Key")
                .description("Mock API key for integration testing")
                .userId(MOCK_USER_ID)
                .creationDate("2024-01-01T00:00:00Z")
                .build();
    }

    /**
     * Issues a new key. Each optional field falls back independently when missing or not a string;
     * the secret is only ever returned here.
     */
    public ApiKey createKey(String rawBody) {
        JsonNode payload = JsonPayloads.parse(objectMapper, rawBody);

        ApiKey key = ApiKey.builder()
                .id(idGenerator.prefixedId("key", 8))
                .name(JsonPayloads.optionalText(payload, "name").orElse(DEFAULT_KEY_NAME))
                .description(JsonPayloads.optionalText(payload, "description").orElse(null))
                .userId(MOCK_USER_ID)
                .creationDate(idGenerator.currentTimestamp())
                .expirationDate(JsonPayloads.optionalText(payload, "expiration_date").orElse(null))
                .apiKey(idGenerator.secretToken(SECRET_PREFIX))
                .build();

        log.info("Generated API key - id: {}, name: {}", key.getId(), key.getName());
        return key;
    }

    public KeyDeleteResponse deleteKey(String keyId) {
        if (keyId == null || keyId.isEmpty()) {
            throw new MockApiException(HttpStatus.BAD_REQUEST, KEY_ID_REQUIRED_MESSAGE);
        }

        log.info("Invalidating mock API key: {}", keyId);
        return KeyDeleteResponse.builder()
                .found(true)
                .invalidated(true)
                .build();
    }
}

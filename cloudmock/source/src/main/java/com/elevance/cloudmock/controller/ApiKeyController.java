package com.elevance.cloudmock.controller;

import com.elevance.cloudmock.model.ApiKey;
import com.elevance.cloudmock.model.KeyDeleteResponse;
import com.elevance.cloudmock.service.ApiKeyMockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Mock API key endpoints.
 * The trailing-slash routes carry an empty key id: reads accept it, deletes reject it.
 */
@RestController
@RequestMapping(value = "/api/v1/users/auth/keys", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(name = "cloudmock.mock-mode", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ApiKeyController {

    private final ApiKeyMockService apiKeyMockService;

    @GetMapping({"/{keyId}", "/"})
    public ResponseEntity<ApiKey> getKey(@PathVariable(value = "keyId", required = false) String keyId) {
        log.info("Received API key read request - keyId: {}", keyId);
        return ResponseEntity.ok(apiKeyMockService.getKey(keyId == null ? "" : keyId));
    }

    @PostMapping
    public ResponseEntity<ApiKey> createKey(
            @RequestBody(required = false) String rawBody,
            @RequestHeader(value = "X-Correlation-Id", required = false) String correlationId) {

        log.info("Received API key create request - correlationId: {}", correlationId);
        log.debug("Request body: {}", rawBody);

        return ResponseEntity.ok(apiKeyMockService.createKey(rawBody));
    }

    @DeleteMapping({"/{keyId}", "/"})
    public ResponseEntity<KeyDeleteResponse> deleteKey(
            @PathVariable(value = "keyId", required = false) String keyId) {

        log.info("Received API key delete request - keyId: {}", keyId);
        return ResponseEntity.ok(apiKeyMockService.deleteKey(keyId));
    }
}

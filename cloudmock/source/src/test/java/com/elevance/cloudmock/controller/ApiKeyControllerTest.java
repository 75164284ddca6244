package com.elevance.cloudmock.controller;

import com.elevance.cloudmock.exception.MockApiException;
import com.elevance.cloudmock.model.ApiKey;
import com.elevance.cloudmock.model.KeyDeleteResponse;
import com.elevance.cloudmock.service.ApiKeyMockService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for ApiKeyController
 */
@ExtendWith(MockitoExtension.class)
class ApiKeyControllerTest {

    @Mock
    private ApiKeyMockService apiKeyMockService;

    @InjectMocks
    private ApiKeyController apiKeyController;

    @Test
    void getKey_shouldDelegateWithPathId() {
        // Arrange
        ApiKey key = ApiKey.builder().id("key_123").name("Mock API Key").build();
        when(apiKeyMockService.getKey("key_123")).thenReturn(key);

        // Act
        ResponseEntity<ApiKey> response = apiKeyController.getKey("key_123");

        // Assert
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(key, response.getBody());
    }

    @Test
    void getKey_withoutPathId_shouldPassEmptyId() {
        // Arrange
        when(apiKeyMockService.getKey("")).thenReturn(ApiKey.builder().id("").build());

        // Act
        ResponseEntity<ApiKey> response = apiKeyController.getKey(null);

        // Assert
        assertEquals(HttpStatus.OK, response.getStatusCode());
        verify(apiKeyMockService).getKey("");
    }

    @Test
    void createKey_shouldReturnCreatedKey() {
        // Arrange
        String body = "{\"name\":\"foo\"}";
        ApiKey key = ApiKey.builder().id("key_1a2b3c4d").name("foo").apiKey("mock_api_key_x").build();
        when(apiKeyMockService.createKey(body)).thenReturn(key);

        // Act
        ResponseEntity<ApiKey> response = apiKeyController.createKey(body, "corr-1");

        // Assert
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("mock_api_key_x", response.getBody().getApiKey());
    }

    @Test
    void deleteKey_shouldReturnInvalidatedResult() {
        // Arrange
        when(apiKeyMockService.deleteKey("key_123"))
                .thenReturn(KeyDeleteResponse.builder().found(true).invalidated(true).build());

        // Act
        ResponseEntity<KeyDeleteResponse> response = apiKeyController.deleteKey("key_123");

        // Assert
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().isFound());
        assertTrue(response.getBody().isInvalidated());
    }

    @Test
    void deleteKey_whenServiceRejects_shouldPropagateException() {
        // Arrange
        when(apiKeyMockService.deleteKey(null))
                .thenThrow(new MockApiException(HttpStatus.BAD_REQUEST, "API Key ID is required"));

        // Act & Assert
        assertThrows(MockApiException.class, () -> apiKeyController.deleteKey(null));
    }
}

package com.elevance.cloudmock.exception;

import org.springframework.http.HttpStatus;

/**
 * Request rejected by a mock handler. Rendered as the api_error envelope with the carried status.
 */
public class MockApiException extends RuntimeException {

    private final HttpStatus status;

    public MockApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public MockApiException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}

package com.elevance.cloudmock.exception;

import com.elevance.cloudmock.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps every failure to the api_error envelope.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String UNEXPECTED_ERROR_MESSAGE = "An unexpected error occurred";

    @ExceptionHandler(MockApiException.class)
    public ResponseEntity<ErrorResponse> handleMockApiException(MockApiException e) {
        log.warn("Rejected request with {}: {}", e.getStatus().value(), e.getMessage());
        return errorResponse(e.getStatus(), e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        // Routing failures (no handler, wrong method, bad media type) keep their own 4xx status
        if (e instanceof org.springframework.web.ErrorResponse) {
            HttpStatusCode status = ((org.springframework.web.ErrorResponse) e).getStatusCode();
            log.warn("Request failed with {}: {}", status.value(), e.getMessage());
            return errorResponse(status, reasonFor(status, e));
        }

        log.error("Unexpected error while handling request", e);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, UNEXPECTED_ERROR_MESSAGE);
    }

    /**
     * Builds an error response with the given status and the api_error envelope as a JSON body.
     * The preset content type is written as-is, whatever the request's Accept header asked for.
     */
    public static ResponseEntity<ErrorResponse> errorResponse(HttpStatusCode status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ErrorResponse.of(message));
    }

    private static String reasonFor(HttpStatusCode status, Exception e) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved != null ? resolved.getReasonPhrase() : e.getMessage();
    }
}

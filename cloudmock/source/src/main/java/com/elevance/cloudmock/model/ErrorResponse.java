package com.elevance.cloudmock.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of every error response: {"error": {"type": "api_error", "message": "..."}}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    public static final String API_ERROR_TYPE = "api_error";

    private ErrorDetail error;

    public static ErrorResponse of(String message) {
        return ErrorResponse.builder()
                .error(ErrorDetail.builder()
                        .type(API_ERROR_TYPE)
                        .message(message)
                        .build())
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorDetail {
        private String type;
        private String message;
    }
}

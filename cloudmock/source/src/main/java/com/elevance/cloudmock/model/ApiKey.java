package com.elevance.cloudmock.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * API key as returned by the key endpoints. The secret {@code api_key} is only set on
 * the create response; optional fields that are null are left out of the JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiKey {
    private String id;
    private String name;
    private String description;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("creation_date")
    private String creationDate;

    @JsonProperty("expiration_date")
    private String expirationDate;

    @JsonProperty("api_key")
    private String apiKey;
}

package com.elevance.cloudmock.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationsResponse {
    private List<Organization> organizations;

    // Always serialized; null means there is no further page
    @JsonProperty("next_page")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String nextPage;
}

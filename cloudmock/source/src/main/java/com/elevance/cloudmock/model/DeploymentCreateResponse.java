package com.elevance.cloudmock.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentCreateResponse {
    private boolean created;
    private String id;
    private String name;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String alias;

    private List<DeploymentResource> resources;
}

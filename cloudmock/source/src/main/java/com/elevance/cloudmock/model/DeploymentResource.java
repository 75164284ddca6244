package com.elevance.cloudmock.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentResource {
    private String id;
    private String kind;
    private String region;
    private String refId;
}

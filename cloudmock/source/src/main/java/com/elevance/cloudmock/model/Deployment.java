package com.elevance.cloudmock.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Deployment {
    private String id;
    private String name;
    private String region;
    private String status;
    private List<DeploymentResource> resources;
}

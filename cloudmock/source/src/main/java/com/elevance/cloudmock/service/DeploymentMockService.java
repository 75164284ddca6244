package com.elevance.cloudmock.service;

import com.elevance.cloudmock.exception.MockApiException;
import com.elevance.cloudmock.model.*;
import com.elevance.cloudmock.util.JsonPayloads;
import com.elevance.cloudmock.util.MockIdGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service that generates mock deployment responses
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeploymentMockService {

    static final String NAME_REQUIRED_MESSAGE = "Deployment name is required";

    private static final String DEFAULT_REGION = "us-east-1";

    private final ObjectMapper objectMapper;
    private final MockIdGenerator idGenerator;

    /**
     * Two fixed deployments, neither with resources attached.
     */
    public DeploymentsResponse listDeployments() {
        log.info("Generating mock deployment list");

        return DeploymentsResponse.builder()
                .deployments(List.of(
                        Deployment.builder()
                                .id("dep_production_123")
                                .name("production")
                                .region(DEFAULT_REGION)
                                .status("running")
                                .resources(List.of())
                                .build(),
                        Deployment.builder()
                                .id("dep_staging_123")
                                .name("staging")
                                .region("eu-west-1")
                                .status("stopped")
                                .resources(List.of())
                                .build()
                ))
                .build();
    }

    /**
     * Validates the create payload and echoes it back as a created deployment.
     * The id is derived from the name, so creating the same name twice yields the same id.
     */
    public DeploymentCreateResponse createDeployment(String rawBody) {
        JsonNode payload = JsonPayloads.parse(objectMapper, rawBody);

        String name = JsonPayloads.stringified(payload, "name")
                .filter(value -> !value.isEmpty())
                .orElseThrow(() -> new MockApiException(HttpStatus.BAD_REQUEST, NAME_REQUIRED_MESSAGE));
        String alias = JsonPayloads.optionalText(payload, "alias").orElse(null);

        log.info("Generating CREATED deployment - name: {}, alias: {}", name, alias);

        return DeploymentCreateResponse.builder()
                .created(true)
                .id(idGenerator.deploymentId(name))
                .name(name)
                .alias(alias)
                .resources(List.of(
                        DeploymentResource.builder()
                                .id("res_elasticsearch_123")
                                .kind("elasticsearch")
                                .region(DEFAULT_REGION)
                                .refId("main-elasticsearch")
                                .build()
                ))
                .build();
    }

    /**
     * The query is parsed for well-formedness only; the result set never changes.
     */
    public DeploymentSearchResponse searchDeployments(String rawBody) {
        JsonNode query = JsonPayloads.parse(objectMapper, rawBody);
        log.debug("Ignoring search query: {}", query);

        List<DeploymentSearchResponse.SearchHit> hits = listDeployments().getDeployments().stream()
                .map(deployment -> DeploymentSearchResponse.SearchHit.builder()
                        .id(deployment.getId())
                        .name(deployment.getName())
                        .healthy(false)
                        .resources(DeploymentSearchResponse.ResourceBreakdown.empty())
                        .build())
                .toList();

        return DeploymentSearchResponse.builder()
                .deployments(hits)
                .returnCount(hits.size())
                .matchCount(hits.size())
                .build();
    }
}

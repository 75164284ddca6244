package com.elevance.cloudmock.controller;

import com.elevance.cloudmock.model.DeploymentCreateResponse;
import com.elevance.cloudmock.model.DeploymentSearchResponse;
import com.elevance.cloudmock.model.DeploymentsResponse;
import com.elevance.cloudmock.service.DeploymentMockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Mock deployment endpoints.
 * Bodies are taken raw so malformed JSON is reported in the api_error envelope.
 */
@RestController
@RequestMapping(value = "/api/v1/deployments", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(name = "cloudmock.mock-mode", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DeploymentController {

    private final DeploymentMockService deploymentMockService;

    @GetMapping
    public ResponseEntity<DeploymentsResponse> listDeployments() {
        log.info("Received deployment list request");
        return ResponseEntity.ok(deploymentMockService.listDeployments());
    }

    /**
     * POST /api/v1/deployments
     */
    @PostMapping
    public ResponseEntity<DeploymentCreateResponse> createDeployment(
            @RequestBody(required = false) String rawBody,
            @RequestHeader(value = "X-Correlation-Id", required = false) String correlationId) {

        log.info("Received deployment create request - correlationId: {}", correlationId);
        log.debug("Request body: {}", rawBody);

        return ResponseEntity.ok(deploymentMockService.createDeployment(rawBody));
    }

    /**
     * POST /api/v1/deployments/_search
     */
    @PostMapping("/_search")
    public ResponseEntity<DeploymentSearchResponse> searchDeployments(
            @RequestBody(required = false) String rawBody) {

        log.info("Received deployment search request");
        log.debug("Request body: {}", rawBody);

        return ResponseEntity.ok(deploymentMockService.searchDeployments(rawBody));
    }
}

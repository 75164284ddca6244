package com.elevance.cloudmock.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of POST /deployments/_search. Counts are reported alongside the page of matches.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentSearchResponse {
    private List<SearchHit> deployments;
    private int returnCount;
    private int matchCount;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SearchHit {
        private String id;
        private String name;
        private boolean healthy;
        private ResourceBreakdown resources;
    }

    /**
     * Resources of a deployment grouped by kind.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResourceBreakdown {
        private List<DeploymentResource> elasticsearch;
        private List<DeploymentResource> kibana;
        private List<DeploymentResource> apm;
        private List<DeploymentResource> appsearch;

        @JsonProperty("enterprise_search")
        private List<DeploymentResource> enterpriseSearch;

        @JsonProperty("integrations_server")
        private List<DeploymentResource> integrationsServer;

        public static ResourceBreakdown empty() {
            return ResourceBreakdown.builder()
                    .elasticsearch(List.of())
                    .kibana(List.of())
                    .apm(List.of())
                    .appsearch(List.of())
                    .enterpriseSearch(List.of())
                    .integrationsServer(List.of())
                    .build();
        }
    }
}

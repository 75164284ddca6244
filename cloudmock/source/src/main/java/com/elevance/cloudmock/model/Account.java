package com.elevance.cloudmock.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account {
    private String id;
    private Trust trust;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Trust {
        @JsonProperty("direct_trust")
        private boolean directTrust;

        @JsonProperty("external_trust")
        private boolean externalTrust;

        @JsonProperty("trust_all")
        private boolean trustAll;
    }
}

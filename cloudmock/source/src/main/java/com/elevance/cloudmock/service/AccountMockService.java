package com.elevance.cloudmock.service;

import com.elevance.cloudmock.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Canned account and organization responses. Both are fixed so repeated reads are identical.
 */
@Service
@Slf4j
public class AccountMockService {

    static final String ACCOUNT_ID = "acc_mock_123";

    public Account getAccount() {
        log.info("Generating mock account");

        return Account.builder()
                .id(ACCOUNT_ID)
                .trust(Account.Trust.builder()
                        .directTrust(true)
                        .externalTrust(false)
                        .trustAll(false)
                        .build())
                .build();
    }

    public OrganizationsResponse listOrganizations() {
        log.info("Generating mock organization list");

        return OrganizationsResponse.builder()
                .organizations(List.of(
                        Organization.builder()
                                .id("org_mock_001")
                                .name("Mock Organization")
                                .type("standard")
                                .createdAt("2024-01-01T00:00:00Z")
                                .updatedAt("2024-01-01T00:00:00Z")
                                .build(),
                        Organization.builder()
                                .id("org_mock_002")
                                .name("Mock Enterprise")
                                .type("enterprise")
                                .createdAt("2024-02-01T00:00:00Z")
                                .updatedAt("2024-03-01T00:00:00Z")
                                .build()
                ))
                .nextPage(null)
                .build();
    }
}

package com.elevance.cloudmock.controller;

import com.elevance.cloudmock.model.Account;
import com.elevance.cloudmock.model.OrganizationsResponse;
import com.elevance.cloudmock.service.AccountMockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Mock account and organization endpoints
 */
@RestController
@RequestMapping(value = "/api/v1", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(name = "cloudmock.mock-mode", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountMockService accountMockService;

    /**
     * GET /api/v1/account
     */
    @GetMapping("/account")
    public ResponseEntity<Account> getAccount() {
        log.info("Received account request");
        return ResponseEntity.ok(accountMockService.getAccount());
    }

    /**
     * GET /api/v1/organizations
     */
    @GetMapping("/organizations")
    public ResponseEntity<OrganizationsResponse> listOrganizations() {
        log.info("Received organization list request");
        return ResponseEntity.ok(accountMockService.listOrganizations());
    }
}

package com.elevance.cloudmock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Cloud Mock API
 * 
 * Stands in for the cloud-platform management API (deployments, organizations,
 * account, API keys) while client code is integration tested. Every response is
 * synthesized per request; nothing is provisioned or persisted.
 * 
 * Set cloudmock.mock-mode=false to switch the /api/v1 routes off when clients
 * are pointed at a live upstream instead.
 */
@SpringBootApplication
public class CloudMockApplication {

    public static void main(String[] args) {
        SpringApplication.run(CloudMockApplication.class, args);
    }
}

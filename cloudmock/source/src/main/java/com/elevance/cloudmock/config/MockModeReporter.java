package com.elevance.cloudmock.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs whether the mock routes are active once the application is up.
 */
@Component
@Slf4j
public class MockModeReporter {

    // Same test @ConditionalOnProperty(havingValue = "true") applies to the /api/v1 controllers
    @Value("${cloudmock.mock-mode:true}")
    private String mockModeSetting;

    @Value("${cloudmock.upstream-url:}")
    private String upstreamUrl;

    @EventListener(ApplicationReadyEvent.class)
    public void reportMode() {
        if (isMockMode()) {
            log.info("Cloud mock API active - serving synthetic responses under /api/v1");
        } else {
            log.warn("Mock mode disabled - /api/v1 routes are not registered, clients should use upstream: {}",
                    upstreamUrl.isEmpty() ? "<not configured>" : upstreamUrl);
        }
    }

    public boolean isMockMode() {
        return "true".equalsIgnoreCase(mockModeSetting);
    }
}

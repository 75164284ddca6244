package com.elevance.cloudmock.util;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Synthetic identifiers and timestamps for mock responses.
 * Nothing issued here is remembered, so uniqueness is only as good as the UUID source.
 */
@Component
public class MockIdGenerator {

    private static final int SECRET_HEX_LENGTH = 32;

    /**
     * Random identifier of the form {@code <prefix>_<hexLength hex chars>}, e.g. {@code key_1a2b3c4d}.
     */
    public String prefixedId(String prefix, int hexLength) {
        if (hexLength < 1 || hexLength > SECRET_HEX_LENGTH) {
            throw new IllegalArgumentException("hexLength must be between 1 and " + SECRET_HEX_LENGTH);
        }
        return prefix + "_" + randomHex().substring(0, hexLength);
    }

    /**
     * Secret value: the prefix followed by 32 fresh hex chars.
     */
    public String secretToken(String prefix) {
        return prefix + randomHex();
    }

    /**
     * Deployment ids are derived from the name rather than generated.
     */
    public String deploymentId(String name) {
        return "dep_" + name.toLowerCase(Locale.ROOT) + "_123";
    }

    public String currentTimestamp() {
        return Instant.now().toString();
    }

    private String randomHex() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}

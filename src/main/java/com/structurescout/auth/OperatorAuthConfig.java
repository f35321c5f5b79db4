package com.structurescout.auth;

import com.structurescout.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Operator token settings, bound from {@code structurescout.auth.*}.
 * The secret is the HS256 signing key and must be at least 32 bytes.
 */
@Data
@Component
@ConfigurationProperties(prefix = "structurescout.auth")
public class OperatorAuthConfig {

    private static final int MIN_SECRET_BYTES = 32;

    private String tokenSecret;
    private long tokenTtlMinutes = 30;
    private String issuer = "structurescout";

    @PostConstruct
    public void validate() {
        if (tokenSecret == null || tokenSecret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new ConfigurationException(
                    "structurescout.auth.token-secret", "<redacted>", "must be at least 32 bytes");
        }
        if (tokenTtlMinutes <= 0) {
            throw new ConfigurationException("structurescout.auth.token-ttl-minutes", tokenTtlMinutes, "must be positive");
        }
    }
}

package com.structurescout.auth;

import com.structurescout.domain.enums.OperatorScope;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies operator tokens for the privileged operations: phase advance, phase
 * downgrade and halt resume.
 *
 * <p>Tokens are HS256-signed JWTs carrying the operator as subject and a single {@code scope}
 * claim. A token authorizes exactly one scope; a phase:advance token cannot resume a halt.
 * Expiry is checked against the caller's {@code now}, not the wall clock.
 */
@Service
public class OperatorAuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(OperatorAuthorizationService.class);

    static final String SCOPE_CLAIM = "scope";

    private final SecretKey secretKey;
    private final Duration tokenTtl;
    private final String issuer;

    public OperatorAuthorizationService(OperatorAuthConfig operatorAuthConfig) {
        this.secretKey = new SecretKeySpec(
                operatorAuthConfig.getTokenSecret().getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.tokenTtl = Duration.ofMinutes(operatorAuthConfig.getTokenTtlMinutes());
        this.issuer = operatorAuthConfig.getIssuer();
    }

    /**
     * Issues a token for {@code operator} limited to {@code scope}, valid from {@code now} for the
     * configured lifetime.
     */
    public String issueToken(String operator, OperatorScope scope, Instant now) {
        log.info("Issuing {} token for operator '{}'", scope.getClaim(), operator);
        return Jwts.builder()
                .subject(operator)
                .issuer(issuer)
                .claim(SCOPE_CLAIM, scope.getClaim())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(tokenTtl)))
                .signWith(secretKey)
                .compact();
    }

    /**
     * Verifies a token for the given scope.
     *
     * @return the operator (token subject) if the token is well-signed, unexpired at {@code now},
     *     issued by this engine and carries {@code scope}; empty otherwise
     */
    public Optional<String> authorize(String token, OperatorScope scope, Instant now) {
        if (token == null || token.isBlank()) {
            log.warn("Missing operator token for {}", scope.getClaim());
            return Optional.empty();
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(now))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Rejected operator token for {}: {}", scope.getClaim(), e.getMessage());
            return Optional.empty();
        }

        String granted = claims.get(SCOPE_CLAIM, String.class);
        if (!scope.getClaim().equals(granted)) {
            log.warn(
                    "Operator '{}' token has scope '{}', '{}' required",
                    claims.getSubject(),
                    granted,
                    scope.getClaim());
            return Optional.empty();
        }
        return Optional.ofNullable(claims.getSubject());
    }
}

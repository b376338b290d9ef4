package com.demo.chat.service;

import com.demo.chat.domain.AuthResult;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;

/**
 * HMAC-signed JWT validation.
 *
 * The token subject is the user id. When the token carries a
 * {@code username} claim it must match the username the client announced;
 * the claim wins as display name.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "chat.auth.mode", havingValue = "jwt")
public class JwtCredentialValidator implements CredentialValidator {

    static final String USERNAME_CLAIM = "username";

    private final SecretKey secretKey;
    private final long tokenExpirationMs;
    private final MetricsService metricsService;
    private final Clock clock;

    public JwtCredentialValidator(
            @Value("${chat.auth.jwt.secret:default-secret-key-change-this-in-production-minimum-256-bits}") String secret,
            @Value("${chat.auth.jwt.expiration-ms:3600000}") long tokenExpirationMs,
            MetricsService metricsService,
            Clock clock) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenExpirationMs = tokenExpirationMs;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    @Override
    public AuthResult validateCredential(String token, String username) {
        try {
            if (token == null || token.isEmpty()) {
                log.warn("Empty token provided for username: {}", username);
                return reject("Token is required");
            }

            if (token.startsWith("Bearer ")) {
                token = token.substring(7);
            }

            Claims claims = extractAllClaims(token);

            String userId = claims.getSubject();
            if (userId == null || userId.isBlank()) {
                log.warn("Token without subject for username: {}", username);
                return reject("Token has no subject");
            }

            String claimedName = claims.get(USERNAME_CLAIM, String.class);
            if (claimedName != null && !claimedName.equalsIgnoreCase(username)) {
                log.warn("Username mismatch: announced={}, token={}", username, claimedName);
                return reject("Username does not match token");
            }

            metricsService.recordAuthenticationAttempt(true);
            return AuthResult.success(userId, claimedName != null ? claimedName : username);

        } catch (ExpiredJwtException e) {
            log.warn("Expired JWT token: {}", e.getMessage());
            return reject("Token expired");
        } catch (SignatureException e) {
            log.warn("Invalid JWT signature: {}", e.getMessage());
            return reject("Invalid token signature");
        } catch (MalformedJwtException e) {
            log.warn("Malformed JWT token: {}", e.getMessage());
            return reject("Malformed token");
        } catch (UnsupportedJwtException e) {
            log.warn("Unsupported JWT token: {}", e.getMessage());
            return reject("Unsupported token");
        } catch (IllegalArgumentException e) {
            log.warn("JWT claims string is empty: {}", e.getMessage());
            return reject("Invalid token");
        } catch (JwtException e) {
            log.warn("Rejected JWT token: {}", e.getMessage());
            return reject("Invalid token");
        }
    }

    private AuthResult reject(String reason) {
        metricsService.recordAuthenticationAttempt(false);
        return AuthResult.failure(reason);
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parser()
            .verifyWith(secretKey)
            .clock(() -> Date.from(clock.instant()))
            .build()
            .parseSignedClaims(token)
            .getPayload();
    }

    /**
     * Generate JWT token (for testing/development)
     */
    public String generateToken(String userId, String username) {
        Date now = Date.from(clock.instant());
        return Jwts.builder()
            .subject(userId)
            .claim(USERNAME_CLAIM, username)
            .issuedAt(now)
            .expiration(new Date(now.getTime() + tokenExpirationMs))
            .signWith(secretKey)
            .compact();
    }
}

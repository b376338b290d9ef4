package com.demo.chat.service;

import com.demo.chat.domain.AuthResult;
import com.demo.chat.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class JwtCredentialValidatorTest {

    private static final String SECRET = "test-secret-key-that-is-long-enough-for-hmac-sha-256";

    private MutableClock clock;
    private MetricsService metricsService;
    private JwtCredentialValidator validator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.now());
        metricsService = new MetricsService(new SimpleMeterRegistry());
        validator = new JwtCredentialValidator(SECRET, 60_000, metricsService, clock);
    }

    @Test
    void acceptsOwnTokenAndUsesSubjectAsUserId() {
        String token = validator.generateToken("user-42", "alice");

        AuthResult result = validator.validateCredential(token, "alice");

        assertThat(result.isValid()).isTrue();
        assertThat(result.getUserId()).isEqualTo("user-42");
        assertThat(result.getDisplayName()).isEqualTo("alice");
        assertThat(metricsService.getCounterValue("chat.auth.attempts")).isEqualTo(1.0);
    }

    @Test
    void acceptsBearerPrefix() {
        String token = validator.generateToken("user-42", "alice");

        assertThat(validator.validateCredential("Bearer " + token, "alice").isValid()).isTrue();
    }

    @Test
    void rejectsUsernameMismatch() {
        String token = validator.generateToken("user-42", "alice");

        AuthResult result = validator.validateCredential(token, "mallory");

        assertThat(result.isValid()).isFalse();
        assertThat(result.getReason()).contains("does not match");
    }

    @Test
    void rejectsExpiredToken() {
        String token = validator.generateToken("user-42", "alice");
        clock.advance(Duration.ofMinutes(5));

        assertThat(validator.validateCredential(token, "alice").getReason()).isEqualTo("Token expired");
    }

    @Test
    void rejectsTokenSignedWithAnotherKey() {
        JwtCredentialValidator other = new JwtCredentialValidator(
            "another-secret-key-that-is-also-long-enough-for-hmac", 60_000, metricsService, clock);
        String token = other.generateToken("user-42", "alice");

        assertThat(validator.validateCredential(token, "alice").isValid()).isFalse();
    }

    @Test
    void rejectsGarbage() {
        assertThat(validator.validateCredential("not-a-jwt", "alice").isValid()).isFalse();
        assertThat(validator.validateCredential("", "alice").isValid()).isFalse();
    }
}

package com.demo.chat.controller;

import com.demo.chat.service.JwtCredentialValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * Issues signed tokens for local development. Only registered when JWT mode
 * and {@code chat.auth.dev-tokens} are both on.
 */
@RestController
@RequestMapping("/api/dev")
@Slf4j
@ConditionalOnExpression("'${chat.auth.mode:trusted}' == 'jwt' and ${chat.auth.dev-tokens:false}")
public class DevTokenController {

    private final JwtCredentialValidator jwtCredentialValidator;

    public DevTokenController(JwtCredentialValidator jwtCredentialValidator) {
        this.jwtCredentialValidator = jwtCredentialValidator;
    }

    @PostMapping("/token")
    public ResponseEntity<Map<String, String>> issueToken(@RequestBody Map<String, String> request) {
        String username = request.get("username");
        if (username == null || username.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "username is required"));
        }
        String userId = request.getOrDefault("userId", "user-" + UUID.randomUUID());
        log.info("Issuing development token: userId={}, username={}", userId, username);
        String token = jwtCredentialValidator.generateToken(userId, username);
        return ResponseEntity.ok(Map.of("userId", userId, "username", username, "token", token));
    }
}

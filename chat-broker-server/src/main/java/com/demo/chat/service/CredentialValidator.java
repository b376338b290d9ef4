package com.demo.chat.service;

import com.demo.chat.domain.AuthResult;

/**
 * Resolves a client credential to a user identity. Implementations may
 * block; the dispatcher calls them off the socket thread.
 */
public interface CredentialValidator {

    AuthResult validateCredential(String token, String username);
}

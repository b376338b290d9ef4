package com.demo.chat.domain;

import lombok.Value;

/**
 * Outcome of a credential check.
 */
@Value
public class AuthResult {

    boolean valid;
    String userId;
    String displayName;
    String reason;

    public static AuthResult success(String userId, String displayName) {
        return new AuthResult(true, userId, displayName, null);
    }

    public static AuthResult failure(String reason) {
        return new AuthResult(false, null, null, reason);
    }
}

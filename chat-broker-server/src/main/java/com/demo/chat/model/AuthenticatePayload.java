package com.demo.chat.model;

import com.demo.chat.domain.ValidationResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthenticatePayload implements ActionPayload {

    private static final int MAX_USERNAME_LENGTH = 50;

    private String token;
    private String username;
    private String userAgent;

    @Override
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        if (ActionPayload.isBlank(token)) {
            errors.add("token is required");
        }
        if (ActionPayload.isBlank(username)) {
            errors.add("username is required");
        } else if (username.length() > MAX_USERNAME_LENGTH) {
            errors.add("username must be at most " + MAX_USERNAME_LENGTH + " characters");
        }
        return ValidationResult.of(errors);
    }
}

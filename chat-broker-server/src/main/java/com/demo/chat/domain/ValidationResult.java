package com.demo.chat.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Outcome of checking a request payload. Invalid results carry every
 * problem found, joined into one message for the ERROR frame.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    List<String> errors;

    public static ValidationResult success() {
        return VALID;
    }

    public static ValidationResult failure(String error) {
        return new ValidationResult(List.of(error));
    }

    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? VALID : new ValidationResult(List.copyOf(errors));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public String getErrorMessage() {
        return isValid() ? null : String.join("; ", errors);
    }
}

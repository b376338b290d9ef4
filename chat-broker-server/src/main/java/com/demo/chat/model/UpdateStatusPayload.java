package com.demo.chat.model;

import com.demo.chat.domain.UserStatus;
import com.demo.chat.domain.ValidationResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateStatusPayload implements ActionPayload {

    private UserStatus status;

    @Override
    public ValidationResult validate() {
        if (status == null) {
            return ValidationResult.failure("status is required");
        }
        if (status == UserStatus.OFFLINE) {
            return ValidationResult.failure("status must be one of online, away, busy");
        }
        return ValidationResult.success();
    }
}

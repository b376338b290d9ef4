package com.demo.chat.model;

import com.demo.chat.domain.ValidationResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PingPayload implements ActionPayload {

    private Long timestamp;

    @Override
    public ValidationResult validate() {
        return ValidationResult.success();
    }
}

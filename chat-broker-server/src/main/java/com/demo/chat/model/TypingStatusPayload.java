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
public class TypingStatusPayload implements ActionPayload {

    private String roomId;
    private Boolean isTyping;

    @Override
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        ActionPayload.requireRoomId(roomId, errors);
        if (isTyping == null) {
            errors.add("isTyping is required");
        }
        return ValidationResult.of(errors);
    }
}

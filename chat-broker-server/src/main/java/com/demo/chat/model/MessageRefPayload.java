package com.demo.chat.model;

import com.demo.chat.domain.ValidationResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Payload of DELETE_MESSAGE.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MessageRefPayload implements ActionPayload {

    private String roomId;
    private Long messageId;

    @Override
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        ActionPayload.requireRoomId(roomId, errors);
        if (messageId == null) {
            errors.add("messageId is required");
        }
        return ValidationResult.of(errors);
    }
}

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
public class EditMessagePayload implements ActionPayload {

    private String roomId;
    private Long messageId;
    private String content;

    @Override
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        ActionPayload.requireRoomId(roomId, errors);
        if (messageId == null) {
            errors.add("messageId is required");
        }
        SendMessagePayload.validateContent(content, errors);
        return ValidationResult.of(errors);
    }
}

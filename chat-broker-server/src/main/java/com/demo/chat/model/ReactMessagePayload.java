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
public class ReactMessagePayload implements ActionPayload {

    private static final int MAX_EMOJI_LENGTH = 32;

    private String roomId;
    private Long messageId;
    private String emoji;

    @Override
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        ActionPayload.requireRoomId(roomId, errors);
        if (messageId == null) {
            errors.add("messageId is required");
        }
        if (ActionPayload.isBlank(emoji)) {
            errors.add("emoji is required");
        } else if (emoji.length() > MAX_EMOJI_LENGTH) {
            errors.add("emoji must be at most " + MAX_EMOJI_LENGTH + " characters");
        }
        return ValidationResult.of(errors);
    }
}

package com.demo.chat.model;

import com.demo.chat.domain.MessageKind;
import com.demo.chat.domain.ValidationResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SendMessagePayload implements ActionPayload {

    public static final int MAX_CONTENT_LENGTH = 4000;

    private String roomId;
    private String content;
    private MessageKind kind;
    private Map<String, Object> metadata;

    @Override
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        ActionPayload.requireRoomId(roomId, errors);
        validateContent(content, errors);
        if (kind == MessageKind.SYSTEM) {
            errors.add("system messages cannot be sent by clients");
        }
        return ValidationResult.of(errors);
    }

    static void validateContent(String content, List<String> errors) {
        if (ActionPayload.isBlank(content)) {
            errors.add("content must not be blank");
        } else if (content.length() > MAX_CONTENT_LENGTH) {
            errors.add("content must be at most " + MAX_CONTENT_LENGTH + " characters");
        }
    }

    public MessageKind kindOrDefault() {
        return kind != null ? kind : MessageKind.TEXT;
    }
}

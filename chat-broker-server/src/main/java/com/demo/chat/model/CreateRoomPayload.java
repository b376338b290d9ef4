package com.demo.chat.model;

import com.demo.chat.domain.RoomVisibility;
import com.demo.chat.domain.ValidationResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateRoomPayload implements ActionPayload {

    private static final int MAX_NAME_LENGTH = 100;
    private static final int MAX_DESCRIPTION_LENGTH = 500;

    private String roomId;
    private String name;
    private String description;
    private RoomVisibility visibility;

    @Override
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        if (roomId != null) {
            ActionPayload.requireRoomId(roomId, errors);
        }
        if (ActionPayload.isBlank(name)) {
            errors.add("name is required");
        } else if (name.length() > MAX_NAME_LENGTH) {
            errors.add("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            errors.add("description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return ValidationResult.of(errors);
    }
}

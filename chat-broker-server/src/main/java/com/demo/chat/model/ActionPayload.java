package com.demo.chat.model;

import com.demo.chat.domain.ValidationResult;

import java.util.List;

/**
 * Typed payload of a client action. Field-level rules beyond what Jackson
 * already enforces live in {@link #validate()}.
 */
public interface ActionPayload {

    int MAX_ROOM_ID_LENGTH = 100;

    ValidationResult validate();

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static void requireRoomId(String roomId, List<String> errors) {
        if (isBlank(roomId)) {
            errors.add("roomId is required");
        } else if (roomId.length() > MAX_ROOM_ID_LENGTH) {
            errors.add("roomId must be at most " + MAX_ROOM_ID_LENGTH + " characters");
        }
    }
}

package com.demo.chat.model;

import com.demo.chat.domain.ValidationResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Payload of JOIN_ROOM and LEAVE_ROOM.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoomPayload implements ActionPayload {

    private String roomId;

    @Override
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        ActionPayload.requireRoomId(roomId, errors);
        return ValidationResult.of(errors);
    }
}

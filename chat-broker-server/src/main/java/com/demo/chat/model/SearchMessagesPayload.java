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
public class SearchMessagesPayload implements ActionPayload {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    private String roomId;
    private String query;
    private Integer limit;

    @Override
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        ActionPayload.requireRoomId(roomId, errors);
        if (ActionPayload.isBlank(query)) {
            errors.add("query must not be blank");
        }
        if (limit != null && (limit < 1 || limit > MAX_LIMIT)) {
            errors.add("limit must be between 1 and " + MAX_LIMIT);
        }
        return ValidationResult.of(errors);
    }

    public int limitOrDefault() {
        return limit != null ? limit : DEFAULT_LIMIT;
    }
}

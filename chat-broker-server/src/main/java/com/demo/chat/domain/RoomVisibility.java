package com.demo.chat.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RoomVisibility {
    PUBLIC,
    PRIVATE,
    DIRECT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RoomVisibility fromValue(String value) {
        for (RoomVisibility visibility : values()) {
            if (visibility.getValue().equalsIgnoreCase(value)) {
                return visibility;
            }
        }
        throw new IllegalArgumentException("Unknown room type: " + value);
    }
}

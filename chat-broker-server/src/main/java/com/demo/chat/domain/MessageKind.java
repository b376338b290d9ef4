package com.demo.chat.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageKind {
    TEXT,
    IMAGE,
    FILE,
    SYSTEM;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageKind fromValue(String value) {
        for (MessageKind kind : values()) {
            if (kind.getValue().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + value);
    }
}

package com.demo.chat.domain;

import java.util.Optional;

/**
 * Client to server frame types.
 */
public enum ActionType {
    AUTHENTICATE,
    JOIN_ROOM,
    LEAVE_ROOM,
    SEND_MESSAGE,
    TYPING_STATUS,
    PING,
    CREATE_ROOM,
    GET_ROOM_HISTORY,
    SEARCH_MESSAGES,
    UPDATE_STATUS,
    EDIT_MESSAGE,
    DELETE_MESSAGE,
    REACT_MESSAGE;

    public boolean requiresAuthentication() {
        return this != AUTHENTICATE && this != PING;
    }

    public static Optional<ActionType> fromWire(String type) {
        for (ActionType action : values()) {
            if (action.name().equals(type)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}

package com.demo.chat.domain;

/**
 * Server to client frame types.
 */
public enum EventType {
    AUTH_SUCCESS,
    ROOM_JOINED,
    ROOM_LEFT,
    ROOM_CREATED,
    USER_JOINED,
    USER_LEFT,
    NEW_MESSAGE,
    MESSAGE_UPDATED,
    MESSAGE_DELETED,
    TYPING_UPDATE,
    USER_STATUS_CHANGED,
    STATUS_UPDATED,
    ROOM_HISTORY,
    SEARCH_RESULTS,
    PONG,
    ERROR
}

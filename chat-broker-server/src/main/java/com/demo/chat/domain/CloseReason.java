package com.demo.chat.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why the broker closed a connection, with the WebSocket close code it maps to.
 */
@Getter
@RequiredArgsConstructor
public enum CloseReason {
    NORMAL(1000, "Normal closure"),
    SHUTDOWN(1001, "Server is shutting down"),
    STALE(1001, "Heartbeat timeout"),
    AUTHENTICATION_FAILED(1008, "Authentication failed"),
    SERVER_ERROR(1011, "Internal server error");

    private final int code;
    private final String description;
}

package com.demo.chat.domain;

import lombok.Value;

/**
 * Inbound envelope after the type and payload have been validated.
 */
@Value
public class ClientFrame {

    ActionType action;
    Object payload;
    String requestId;

    public <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}

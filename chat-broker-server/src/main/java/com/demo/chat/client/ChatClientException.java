package com.demo.chat.client;

import lombok.Getter;

/**
 * An {@code ERROR} frame received in reply to a client request.
 */
@Getter
public class ChatClientException extends RuntimeException {

    private final String code;

    public ChatClientException(String code, String message) {
        super(code + ": " + message);
        this.code = code;
    }
}

package com.demo.chat.domain;

public class ConnectionNotFoundException extends RuntimeException {

    public ConnectionNotFoundException(String connectionId) {
        super("Connection not found: " + connectionId);
    }
}

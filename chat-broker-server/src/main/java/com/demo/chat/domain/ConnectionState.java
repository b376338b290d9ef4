package com.demo.chat.domain;

public enum ConnectionState {
    CONNECTED,
    AUTHENTICATED,
    CLOSED
}

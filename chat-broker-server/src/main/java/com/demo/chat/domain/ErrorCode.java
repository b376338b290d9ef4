package com.demo.chat.domain;

/**
 * Codes carried in the payload of an {@code ERROR} frame.
 */
public enum ErrorCode {
    INVALID_MESSAGE,
    UNAUTHORIZED,
    RATE_LIMIT_EXCEEDED,
    ROOM_NOT_FOUND,
    NOT_A_MEMBER,
    ROOM_ALREADY_EXISTS,
    MESSAGE_NOT_FOUND,
    FORBIDDEN,
    AUTHENTICATION_FAILED,
    INTERNAL_ERROR
}

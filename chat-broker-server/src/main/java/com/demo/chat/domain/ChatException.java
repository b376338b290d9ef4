package com.demo.chat.domain;

import lombok.Getter;

/**
 * Protocol-level failure of a single client action. The dispatcher turns it
 * into an {@code ERROR} frame for the sender and keeps the connection open,
 * except for {@link ErrorCode#AUTHENTICATION_FAILED}.
 */
@Getter
public class ChatException extends RuntimeException {

    private final ErrorCode code;

    public ChatException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public static ChatException roomNotFound(String roomId) {
        return new ChatException(ErrorCode.ROOM_NOT_FOUND, "Room not found: " + roomId);
    }

    public static ChatException notAMember(String roomId) {
        return new ChatException(ErrorCode.NOT_A_MEMBER, "Not a member of room: " + roomId);
    }

    public static ChatException messageNotFound(long messageId) {
        return new ChatException(ErrorCode.MESSAGE_NOT_FOUND, "Message not found: " + messageId);
    }
}

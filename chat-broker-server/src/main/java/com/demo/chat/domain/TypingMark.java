package com.demo.chat.domain;

import lombok.Value;

import java.time.Instant;

@Value
public class TypingMark {
    String roomId;
    String userId;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt.isBefore(now);
    }
}

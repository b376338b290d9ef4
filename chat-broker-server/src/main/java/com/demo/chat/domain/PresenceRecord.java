package com.demo.chat.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class PresenceRecord {

    String userId;
    String displayName;
    UserStatus status;
    Instant lastSeenAt;

    public static PresenceRecord unknown(String userId) {
        return PresenceRecord.builder()
            .userId(userId)
            .status(UserStatus.OFFLINE)
            .build();
    }

    public boolean isOnline() {
        return status != UserStatus.OFFLINE;
    }
}

package com.demo.chat.model;

import com.demo.chat.domain.PresenceRecord;
import com.demo.chat.domain.UserStatus;
import lombok.Value;

import java.time.Instant;

@Value
public class MemberSummary {

    String userId;
    String username;
    UserStatus status;
    Instant lastSeenAt;

    public static MemberSummary from(PresenceRecord presence) {
        return new MemberSummary(presence.getUserId(), presence.getDisplayName(),
            presence.getStatus(), presence.getLastSeenAt());
    }
}

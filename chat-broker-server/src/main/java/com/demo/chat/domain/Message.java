package com.demo.chat.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable chat message. Edits, deletes and reactions produce a new copy
 * with the same id through {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Message {

    long id;
    String roomId;
    String senderId;
    String senderDisplayName;
    String content;
    @Builder.Default
    MessageKind kind = MessageKind.TEXT;
    Instant createdAt;
    @Builder.Default
    Map<String, Object> metadata = Map.of();
    @Builder.Default
    List<Reaction> reactions = List.of();
    Instant editedAt;
    boolean deleted;

    public boolean isSentBy(String userId) {
        return senderId != null && senderId.equals(userId);
    }
}

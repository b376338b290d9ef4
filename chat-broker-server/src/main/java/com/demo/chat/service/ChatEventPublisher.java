package com.demo.chat.service;

import com.demo.chat.domain.Message;
import com.demo.chat.domain.PresenceRecord;
import com.demo.chat.domain.Room;

/**
 * Outbound domain events for downstream consumers (audit, analytics).
 * Publication is fire-and-forget and never fails the chat action.
 */
public interface ChatEventPublisher {

    void publishMessage(String eventType, Message message);

    void publishRoomCreated(Room room);

    void publishRoomDeleted(String roomId);

    void publishPresence(PresenceRecord presence);
}

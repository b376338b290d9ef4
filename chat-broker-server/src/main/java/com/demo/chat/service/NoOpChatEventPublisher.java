package com.demo.chat.service;

import com.demo.chat.domain.Message;
import com.demo.chat.domain.PresenceRecord;
import com.demo.chat.domain.Room;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "chat.events.kafka.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpChatEventPublisher implements ChatEventPublisher {

    @Override
    public void publishMessage(String eventType, Message message) {
    }

    @Override
    public void publishRoomCreated(Room room) {
    }

    @Override
    public void publishRoomDeleted(String roomId) {
    }

    @Override
    public void publishPresence(PresenceRecord presence) {
    }
}

package com.demo.chat.service;

import com.demo.chat.domain.Message;
import com.demo.chat.domain.PresenceRecord;
import com.demo.chat.domain.Room;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Publishes chat domain events to Kafka.
 *
 * Enable with: chat.events.kafka.enabled=true
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "chat.events.kafka.enabled", havingValue = "true")
public class KafkaChatEventPublisher implements ChatEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MetricsService metricsService;
    private final Clock clock;
    private final String chatEventsTopic;

    public KafkaChatEventPublisher(KafkaTemplate<String, Object> kafkaTemplate,
                                   MetricsService metricsService,
                                   Clock clock,
                                   @Value("${chat.events.kafka.topic:chat-events}") String chatEventsTopic) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsService = metricsService;
        this.clock = clock;
        this.chatEventsTopic = chatEventsTopic;
    }

    @Override
    public void publishMessage(String eventType, Message message) {
        Map<String, Object> event = baseEvent(eventType);
        event.put("roomId", message.getRoomId());
        event.put("messageId", message.getId());
        event.put("senderId", message.getSenderId());
        event.put("kind", message.getKind().getValue());
        event.put("deleted", message.isDeleted());
        publishEvent(message.getRoomId(), event);
    }

    @Override
    public void publishRoomCreated(Room room) {
        Map<String, Object> event = baseEvent("ROOM_CREATED");
        event.put("roomId", room.getRoomId());
        event.put("name", room.getName());
        event.put("visibility", room.getVisibility().getValue());
        event.put("createdBy", room.getCreatedBy());
        publishEvent(room.getRoomId(), event);
    }

    @Override
    public void publishRoomDeleted(String roomId) {
        Map<String, Object> event = baseEvent("ROOM_DELETED");
        event.put("roomId", roomId);
        publishEvent(roomId, event);
    }

    @Override
    public void publishPresence(PresenceRecord presence) {
        Map<String, Object> event = baseEvent("PRESENCE_CHANGED");
        event.put("userId", presence.getUserId());
        event.put("status", presence.getStatus().getValue());
        if (presence.getLastSeenAt() != null) {
            event.put("lastSeenAt", presence.getLastSeenAt().toString());
        }
        publishEvent(presence.getUserId(), event);
    }

    private Map<String, Object> baseEvent(String eventType) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", clock.instant().toString());
        return event;
    }

    private void publishEvent(String key, Map<String, Object> event) {
        Object eventType = event.get("eventType");
        try {
            kafkaTemplate.send(chatEventsTopic, key, event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish event: type={}, key={}", eventType, key, ex);
                        metricsService.recordError("KAFKA_PUBLISH_FAILED", "event-publisher");
                    } else {
                        log.debug("Event published: type={}, key={}, offset={}",
                            eventType, key, result.getRecordMetadata().offset());
                    }
                });
        } catch (RuntimeException e) {
            log.error("Error publishing event: type={}, key={}", eventType, key, e);
            metricsService.recordError("KAFKA_PUBLISH_FAILED", "event-publisher");
        }
    }
}

package com.demo.chat.infrastructure;

import com.demo.chat.domain.Message;
import com.demo.chat.service.MessageArchive;
import com.demo.chat.service.MetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Room history archived as one capped Redis list per room.
 *
 * Enable with: chat.archive.redis.enabled=true
 */
@Repository
@Slf4j
@ConditionalOnProperty(name = "chat.archive.redis.enabled", havingValue = "true")
public class RedisMessageArchive implements MessageArchive {

    private static final String HISTORY_KEY_PREFIX = "chat:history:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;
    private final int capacity;

    public RedisMessageArchive(StringRedisTemplate redisTemplate,
                               ObjectMapper objectMapper,
                               MetricsService metricsService,
                               @Value("${chat.history.max-messages-per-room:1000}") int capacity) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.capacity = capacity;
    }

    @Override
    public void append(Message message) {
        String key = historyKey(message.getRoomId());
        try {
            redisTemplate.opsForList().rightPush(key, objectMapper.writeValueAsString(message));
            redisTemplate.opsForList().trim(key, -capacity, -1);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize message: roomId={}, messageId={}", message.getRoomId(), message.getId(), e);
            metricsService.recordError("ARCHIVE_SERIALIZATION", "redis-archive");
        } catch (DataAccessException e) {
            log.error("Failed to archive message: roomId={}, messageId={}", message.getRoomId(), message.getId(), e);
            metricsService.recordError("ARCHIVE_WRITE", "redis-archive");
        }
    }

    @Override
    public void replace(Message message) {
        String key = historyKey(message.getRoomId());
        try {
            List<String> entries = redisTemplate.opsForList().range(key, 0, -1);
            if (entries == null) {
                return;
            }
            for (int index = entries.size() - 1; index >= 0; index--) {
                if (archivedId(entries.get(index)) == message.getId()) {
                    redisTemplate.opsForList().set(key, index, objectMapper.writeValueAsString(message));
                    return;
                }
            }
            log.debug("Amended message no longer archived: roomId={}, messageId={}",
                message.getRoomId(), message.getId());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize message: roomId={}, messageId={}", message.getRoomId(), message.getId(), e);
            metricsService.recordError("ARCHIVE_SERIALIZATION", "redis-archive");
        } catch (DataAccessException e) {
            log.error("Failed to archive amendment: roomId={}, messageId={}", message.getRoomId(), message.getId(), e);
            metricsService.recordError("ARCHIVE_WRITE", "redis-archive");
        }
    }

    @Override
    public List<Message> load(String roomId, int limit) {
        List<Message> messages = new ArrayList<>();
        try {
            List<String> entries = redisTemplate.opsForList().range(historyKey(roomId), -limit, -1);
            if (entries == null) {
                return messages;
            }
            for (String entry : entries) {
                try {
                    messages.add(objectMapper.readValue(entry, Message.class));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping unreadable archived message: roomId={}, error={}", roomId, e.getOriginalMessage());
                }
            }
        } catch (DataAccessException e) {
            log.error("Failed to load archived history: roomId={}", roomId, e);
            metricsService.recordError("ARCHIVE_READ", "redis-archive");
        }
        return messages;
    }

    @Override
    public void purge(String roomId) {
        try {
            redisTemplate.delete(historyKey(roomId));
        } catch (DataAccessException e) {
            log.error("Failed to purge archived history: roomId={}", roomId, e);
            metricsService.recordError("ARCHIVE_DELETE", "redis-archive");
        }
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    private long archivedId(String entry) {
        try {
            return objectMapper.readTree(entry).path("id").asLong(-1);
        } catch (JsonProcessingException e) {
            return -1;
        }
    }

    private static String historyKey(String roomId) {
        return HISTORY_KEY_PREFIX + roomId;
    }
}

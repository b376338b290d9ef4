package com.demo.chat.service;

import com.demo.chat.domain.Message;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConditionalOnProperty(name = "chat.archive.redis.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpMessageArchive implements MessageArchive {

    @Override
    public void append(Message message) {
        // history lives in memory only
    }

    @Override
    public void replace(Message message) {
        // history lives in memory only
    }

    @Override
    public List<Message> load(String roomId, int limit) {
        return List.of();
    }

    @Override
    public void purge(String roomId) {
        // nothing archived
    }

    @Override
    public boolean isDurable() {
        return false;
    }
}

package com.demo.chat.service;

import com.demo.chat.domain.TypingMark;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ephemeral "is typing" marks per room. Expired marks are invisible to
 * readers immediately and physically removed by {@link #sweep(Instant)}.
 */
@Service
public class TypingTracker {

    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Instant>> marks = new ConcurrentHashMap<>();
    private final Clock clock;

    public TypingTracker(Clock clock) {
        this.clock = clock;
    }

    public TypingMark setTyping(String roomId, String userId, Duration ttl) {
        Instant expiresAt = clock.instant().plus(ttl);
        marks.compute(roomId, (id, users) -> {
            ConcurrentHashMap<String, Instant> target = users != null ? users : new ConcurrentHashMap<>();
            target.put(userId, expiresAt);
            return target;
        });
        return new TypingMark(roomId, userId, expiresAt);
    }

    /**
     * @return true if the user had a mark in the room
     */
    public boolean clearTyping(String roomId, String userId) {
        boolean[] removed = new boolean[1];
        marks.computeIfPresent(roomId, (id, users) -> {
            removed[0] = users.remove(userId) != null;
            return users.isEmpty() ? null : users;
        });
        return removed[0];
    }

    public List<String> activeTypers(String roomId, Instant now) {
        Map<String, Instant> users = marks.get(roomId);
        if (users == null) {
            return List.of();
        }
        List<String> active = new ArrayList<>();
        users.forEach((userId, expiresAt) -> {
            if (!expiresAt.isBefore(now)) {
                active.add(userId);
            }
        });
        return active;
    }

    public void clearRoom(String roomId) {
        marks.remove(roomId);
    }

    /**
     * Removes and returns every mark that expired before {@code now}.
     */
    public List<TypingMark> sweep(Instant now) {
        List<TypingMark> expired = new ArrayList<>();
        for (String roomId : marks.keySet()) {
            marks.computeIfPresent(roomId, (id, users) -> {
                users.entrySet().removeIf(entry -> {
                    if (entry.getValue().isBefore(now)) {
                        expired.add(new TypingMark(id, entry.getKey(), entry.getValue()));
                        return true;
                    }
                    return false;
                });
                return users.isEmpty() ? null : users;
            });
        }
        return expired;
    }
}

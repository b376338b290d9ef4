package com.demo.chat.service;

import com.demo.chat.domain.PresenceRecord;
import com.demo.chat.domain.UserStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-user presence, independent of how many connections a user holds.
 * Callers decide when a user goes offline; this store only records it.
 */
@Service
@Slf4j
public class PresenceStore {

    private final ConcurrentHashMap<String, PresenceRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public PresenceStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Moves an offline or unknown user to online. A user who is already
     * away or busy keeps that status; the display name is refreshed.
     */
    public PresenceRecord markOnline(String userId, String displayName) {
        PresenceRecord updated = records.compute(userId, (id, current) -> {
            if (current == null || !current.isOnline()) {
                return PresenceRecord.builder()
                    .userId(id)
                    .displayName(displayName)
                    .status(UserStatus.ONLINE)
                    .lastSeenAt(clock.instant())
                    .build();
            }
            return current.toBuilder().displayName(displayName).build();
        });
        log.debug("Presence online: userId={}, status={}", userId, updated.getStatus());
        return updated;
    }

    /**
     * @return the status the user had before going offline
     */
    public UserStatus markOffline(String userId) {
        AtomicReference<UserStatus> previous = new AtomicReference<>(UserStatus.OFFLINE);
        records.computeIfPresent(userId, (id, current) -> {
            previous.set(current.getStatus());
            return current.toBuilder()
                .status(UserStatus.OFFLINE)
                .lastSeenAt(clock.instant())
                .build();
        });
        log.debug("Presence offline: userId={}, previous={}", userId, previous.get());
        return previous.get();
    }

    /**
     * Explicit status change from an online user. Offline is reserved for
     * the last connection closing, so it is rejected here.
     */
    public PresenceRecord setStatus(String userId, UserStatus status) {
        if (status == UserStatus.OFFLINE) {
            throw new IllegalArgumentException("Offline is set by disconnect only");
        }
        return records.compute(userId, (id, current) -> {
            PresenceRecord base = current != null ? current : PresenceRecord.unknown(id);
            return base.toBuilder()
                .status(status)
                .lastSeenAt(clock.instant())
                .build();
        });
    }

    public PresenceRecord get(String userId) {
        PresenceRecord record = records.get(userId);
        return record != null ? record : PresenceRecord.unknown(userId);
    }

    public long onlineCount() {
        return records.values().stream().filter(PresenceRecord::isOnline).count();
    }
}

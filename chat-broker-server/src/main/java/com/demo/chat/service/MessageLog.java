package com.demo.chat.service;

import com.demo.chat.domain.ChatException;
import com.demo.chat.domain.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Bounded, ordered message history per room.
 *
 * Each room owns a fixed-capacity ring guarded by its own monitor. Message
 * ids come from one global counter but are taken inside the room's monitor,
 * so id order equals append order within a room.
 *
 * Archive writes are handed to a single-writer executor while the monitor is
 * held, so the archive sees a room's changes in log order without the room
 * waiting on archive I/O.
 */
@Service
@Slf4j
public class MessageLog {

    private final ConcurrentHashMap<String, RoomHistory> histories = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final MessageArchive archive;
    private final Executor archiveExecutor;
    private final Clock clock;
    private final int capacity;

    public MessageLog(MessageArchive archive,
                      @Qualifier("archiveExecutor") Executor archiveExecutor,
                      Clock clock,
                      @Value("${chat.history.max-messages-per-room:1000}") int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("chat.history.max-messages-per-room must be positive");
        }
        this.archive = archive;
        this.archiveExecutor = archiveExecutor;
        this.clock = clock;
        this.capacity = capacity;
    }

    /**
     * Creates the room's log if absent, seeding it from the archive.
     */
    public void open(String roomId) {
        histories.computeIfAbsent(roomId, id -> {
            RoomHistory history = new RoomHistory(capacity);
            List<Message> archived = new ArrayList<>(archive.load(id, capacity));
            archived.sort(Comparator.comparingLong(Message::getId));
            for (Message message : archived) {
                history.restore(message);
                sequence.accumulateAndGet(message.getId(), Math::max);
            }
            if (!archived.isEmpty()) {
                log.info("Room history restored: roomId={}, messages={}", id, archived.size());
            }
            return history;
        });
    }

    /**
     * Stores the message with a fresh id and the server receive time.
     *
     * @throws ChatException ROOM_NOT_FOUND when the room has no open log
     */
    public Message append(String roomId, Message draft) {
        RoomHistory history = histories.get(roomId);
        if (history == null) {
            throw ChatException.roomNotFound(roomId);
        }
        synchronized (history) {
            Message stored = draft.toBuilder()
                .id(sequence.incrementAndGet())
                .roomId(roomId)
                .createdAt(clock.instant())
                .build();
            history.add(stored);
            archiveLater("append", stored, archive::append);
            return stored;
        }
    }

    /**
     * Newest {@code limit} messages, oldest first.
     */
    public List<Message> tail(String roomId, int limit) {
        RoomHistory history = histories.get(roomId);
        if (history == null || limit <= 0) {
            return List.of();
        }
        synchronized (history) {
            int from = Math.max(0, history.size() - limit);
            return history.slice(from, history.size());
        }
    }

    /**
     * Up to {@code limit} messages older than {@code beforeId}, oldest first.
     * A null cursor pages from the newest message.
     */
    public List<Message> before(String roomId, Long beforeId, int limit) {
        RoomHistory history = histories.get(roomId);
        if (history == null || limit <= 0) {
            return List.of();
        }
        synchronized (history) {
            int end = beforeId == null ? history.size() : history.lowerBound(beforeId);
            int from = Math.max(0, end - limit);
            return history.slice(from, end);
        }
    }

    /**
     * Lazily filtered view over a snapshot of the room taken now. Iterating
     * it again starts over; later appends are not visible.
     */
    public Iterable<Message> search(String roomId, Predicate<Message> predicate) {
        RoomHistory history = histories.get(roomId);
        if (history == null) {
            return List.of();
        }
        List<Message> snapshot;
        synchronized (history) {
            snapshot = history.slice(0, history.size());
        }
        return () -> snapshot.stream().filter(predicate).iterator();
    }

    public Optional<Message> find(String roomId, long messageId) {
        RoomHistory history = histories.get(roomId);
        if (history == null) {
            return Optional.empty();
        }
        synchronized (history) {
            int index = history.indexOf(messageId);
            return index < 0 ? Optional.empty() : Optional.of(history.get(index));
        }
    }

    /**
     * Replaces a message with {@code change.apply(current)}. The change runs
     * under the room's monitor and may throw to veto the amendment.
     *
     * @return the replacement, or empty if the message is not in the log
     */
    public Optional<Message> amend(String roomId, long messageId, UnaryOperator<Message> change) {
        RoomHistory history = histories.get(roomId);
        if (history == null) {
            return Optional.empty();
        }
        synchronized (history) {
            int index = history.indexOf(messageId);
            if (index < 0) {
                return Optional.empty();
            }
            Message current = history.get(index);
            Message replacement = change.apply(current).toBuilder()
                .id(current.getId())
                .roomId(current.getRoomId())
                .createdAt(current.getCreatedAt())
                .build();
            history.set(index, replacement);
            archiveLater("replace", replacement, archive::replace);
            return Optional.of(replacement);
        }
    }

    public void drop(String roomId) {
        RoomHistory removed = histories.remove(roomId);
        if (removed != null) {
            log.debug("Room history dropped: roomId={}", roomId);
        }
        if (archive.isDurable()) {
            submitToArchive(() -> archive.purge(roomId), "purge", roomId);
        }
    }

    public int size(String roomId) {
        RoomHistory history = histories.get(roomId);
        if (history == null) {
            return 0;
        }
        synchronized (history) {
            return history.size();
        }
    }

    public boolean isOpen(String roomId) {
        return histories.containsKey(roomId);
    }

    public int getCapacity() {
        return capacity;
    }

    private void archiveLater(String operation, Message message, Consumer<Message> write) {
        if (archive.isDurable()) {
            submitToArchive(() -> write.accept(message), operation, message.getRoomId());
        }
    }

    private void submitToArchive(Runnable write, String operation, String roomId) {
        try {
            archiveExecutor.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException e) {
                    log.error("Archive {} failed: roomId={}", operation, roomId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Archive {} dropped: roomId={}, reason={}", operation, roomId, e.getMessage());
        }
    }

    /**
     * Ring buffer of messages ordered by id. Not thread-safe on its own.
     */
    private static final class RoomHistory {

        private final Message[] slots;
        private int head;
        private int size;

        RoomHistory(int capacity) {
            this.slots = new Message[capacity];
        }

        void add(Message message) {
            if (size == slots.length) {
                slots[head] = message;
                head = (head + 1) % slots.length;
            } else {
                slots[(head + size) % slots.length] = message;
                size++;
            }
        }

        void restore(Message message) {
            if (size > 0 && get(size - 1).getId() >= message.getId()) {
                return;
            }
            add(message);
        }

        int size() {
            return size;
        }

        Message get(int index) {
            return slots[(head + index) % slots.length];
        }

        void set(int index, Message message) {
            slots[(head + index) % slots.length] = message;
        }

        List<Message> slice(int from, int to) {
            List<Message> result = new ArrayList<>(to - from);
            for (int i = from; i < to; i++) {
                result.add(get(i));
            }
            return result;
        }

        /**
         * Position of the first message whose id is not below {@code id}.
         */
        int lowerBound(long id) {
            int low = 0;
            int high = size;
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (get(mid).getId() < id) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            return low;
        }

        int indexOf(long id) {
            int index = lowerBound(id);
            return index < size && get(index).getId() == id ? index : -1;
        }
    }
}

package com.demo.chat.infrastructure;

import lombok.extern.slf4j.Slf4j;

import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Delivers a room's message events in the order the log applied them.
 *
 * A change and the queueing of its delivery happen under the room's lane
 * lock, so the lane queue holds deliveries in log order. Delivery itself runs
 * outside the lock: whichever caller wins the lane's drain flag sends every
 * queued event, the others return at once.
 */
@Slf4j
final class RoomEventSequencer {

    private final ConcurrentHashMap<String, Lane> lanes = new ConcurrentHashMap<>();

    /**
     * Applies {@code change} and queues {@code delivery} of its result. If the
     * change throws, nothing is queued and the exception reaches the caller.
     */
    <T> T sequence(String roomId, Supplier<T> change, Consumer<T> delivery) {
        Lane lane = lanes.computeIfAbsent(roomId, id -> new Lane());
        T result;
        synchronized (lane) {
            result = change.get();
            lane.pending.add(() -> delivery.accept(result));
        }
        lane.drain(roomId);
        return result;
    }

    void forget(String roomId) {
        lanes.remove(roomId);
    }

    int activeLanes() {
        return lanes.size();
    }

    private static final class Lane {

        private final Queue<Runnable> pending = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean();

        void drain(String roomId) {
            while (!pending.isEmpty() && draining.compareAndSet(false, true)) {
                try {
                    Runnable next;
                    while ((next = pending.poll()) != null) {
                        try {
                            next.run();
                        } catch (RuntimeException e) {
                            log.error("Room event delivery failed: roomId={}", roomId, e);
                        }
                    }
                } finally {
                    draining.set(false);
                }
            }
        }
    }
}

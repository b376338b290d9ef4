package com.demo.chat.service;

import com.demo.chat.domain.ChatException;
import com.demo.chat.domain.ErrorCode;
import com.demo.chat.domain.JoinOutcome;
import com.demo.chat.domain.LeaveOutcome;
import com.demo.chat.domain.Room;
import com.demo.chat.domain.RoomVisibility;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Room metadata and membership.
 *
 * Every membership change on a room runs inside a {@link ConcurrentHashMap}
 * atomic update on that room's key, so join, leave and empty-room deletion
 * on one room are linearized while unrelated rooms proceed independently.
 */
@Service
@Slf4j
public class RoomStore {

    public static final String SYSTEM_USER = "system";

    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final List<String> defaultRoomIds;
    private final Clock clock;

    public RoomStore(@Value("${chat.rooms.defaults:general,random}") List<String> defaultRoomIds,
                     Clock clock) {
        this.defaultRoomIds = List.copyOf(defaultRoomIds);
        this.clock = clock;
        this.defaultRoomIds.forEach(this::seedDefaultRoom);
        log.info("RoomStore initialized: defaultRooms={}", this.defaultRoomIds);
    }

    private void seedDefaultRoom(String roomId) {
        rooms.put(roomId, Room.builder()
            .roomId(roomId)
            .name(Character.toUpperCase(roomId.charAt(0)) + roomId.substring(1))
            .description(defaultDescription(roomId))
            .visibility(RoomVisibility.PUBLIC)
            .createdBy(SYSTEM_USER)
            .createdAt(clock.instant())
            .defaultRoom(true)
            .build());
    }

    private static String defaultDescription(String roomId) {
        switch (roomId) {
            case "general":
                return "General discussion";
            case "random":
                return "Off-topic discussions";
            default:
                return "Default room";
        }
    }

    public List<String> defaultRoomIds() {
        return defaultRoomIds;
    }

    /**
     * Returns the room, creating an implicit public room when it is unknown.
     */
    public Room getOrCreate(String roomId, String creator) {
        return rooms.computeIfAbsent(roomId, id -> implicitRoom(id, creator));
    }

    /**
     * @return true if the user was not a member before
     * @throws ChatException ROOM_NOT_FOUND when the room does not exist
     */
    public boolean join(String roomId, String userId) {
        boolean[] added = new boolean[1];
        Room room = rooms.computeIfPresent(roomId, (id, current) -> {
            added[0] = current.addMember(userId);
            return current;
        });
        if (room == null) {
            throw ChatException.roomNotFound(roomId);
        }
        return added[0];
    }

    /**
     * Creates the room if needed and adds the user, as one atomic step.
     * {@code onCreated} runs while the new room's slot is still locked, so
     * per-room resources exist before any other caller can see the room.
     */
    public JoinOutcome joinOrCreate(String roomId, String userId, Consumer<Room> onCreated) {
        boolean[] created = new boolean[1];
        boolean[] joined = new boolean[1];
        Room room = rooms.compute(roomId, (id, current) -> {
            Room target = current;
            if (target == null) {
                target = implicitRoom(id, userId);
                onCreated.accept(target);
                created[0] = true;
            }
            joined[0] = target.addMember(userId);
            return target;
        });
        if (created[0]) {
            log.info("Room created on join: roomId={}, createdBy={}", roomId, userId);
        }
        return new JoinOutcome(room, created[0], joined[0]);
    }

    public boolean create(Room room) {
        return rooms.putIfAbsent(room.getRoomId(), room) == null;
    }

    /**
     * Explicit creation with the creator as first member.
     *
     * @throws ChatException ROOM_ALREADY_EXISTS when the id is taken
     */
    public Room createAndJoin(Room draft, String creatorId, Consumer<Room> onCreated) {
        boolean[] created = new boolean[1];
        Room room = rooms.compute(draft.getRoomId(), (id, current) -> {
            if (current != null) {
                return current;
            }
            onCreated.accept(draft);
            draft.addMember(creatorId);
            created[0] = true;
            return draft;
        });
        if (!created[0]) {
            throw new ChatException(ErrorCode.ROOM_ALREADY_EXISTS, "Room already exists: " + draft.getRoomId());
        }
        log.info("Room created: roomId={}, visibility={}, createdBy={}",
            room.getRoomId(), room.getVisibility().getValue(), creatorId);
        return room;
    }

    /**
     * @throws ChatException ROOM_NOT_FOUND when the room does not exist
     */
    public LeaveOutcome leave(String roomId, String userId) {
        boolean[] left = new boolean[1];
        boolean[] empty = new boolean[1];
        Room room = rooms.computeIfPresent(roomId, (id, current) -> {
            left[0] = current.removeMember(userId);
            empty[0] = current.isEmpty();
            return current;
        });
        if (room == null) {
            throw ChatException.roomNotFound(roomId);
        }
        return new LeaveOutcome(left[0], empty[0] && !room.isDefaultRoom());
    }

    /**
     * Removes the room if it is still empty and not a default room. The
     * callback runs before the slot is released, so a concurrent join either
     * sees the old room before deletion or creates a fresh one afterwards.
     */
    public boolean deleteIfEmpty(String roomId, Consumer<Room> onDeleted) {
        boolean[] deleted = new boolean[1];
        rooms.computeIfPresent(roomId, (id, current) -> {
            if (current.isDefaultRoom() || !current.isEmpty()) {
                return current;
            }
            onDeleted.accept(current);
            deleted[0] = true;
            return null;
        });
        if (deleted[0]) {
            log.info("Empty room deleted: roomId={}", roomId);
        }
        return deleted[0];
    }

    public Set<String> members(String roomId) {
        Room room = rooms.get(roomId);
        return room != null ? room.memberSnapshot() : Set.of();
    }

    public boolean isMember(String roomId, String userId) {
        Room room = rooms.get(roomId);
        return room != null && room.hasMember(userId);
    }

    public boolean exists(String roomId) {
        return rooms.containsKey(roomId);
    }

    public Optional<Room> find(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public List<Room> roomsOf(String userId) {
        return rooms.values().stream()
            .filter(room -> room.hasMember(userId))
            .sorted(Comparator.comparing(Room::getCreatedAt).thenComparing(Room::getRoomId))
            .collect(Collectors.toList());
    }

    /**
     * Public rooms plus the non-public rooms the user belongs to.
     */
    public List<Room> visibleTo(String userId) {
        return rooms.values().stream()
            .filter(room -> room.isPublic() || room.hasMember(userId))
            .sorted(Comparator.comparing(Room::getCreatedAt).thenComparing(Room::getRoomId))
            .collect(Collectors.toList());
    }

    public List<Room> publicRooms() {
        return rooms.values().stream()
            .filter(Room::isPublic)
            .sorted(Comparator.comparing(Room::getCreatedAt).thenComparing(Room::getRoomId))
            .collect(Collectors.toList());
    }

    public int count() {
        return rooms.size();
    }

    private Room implicitRoom(String roomId, String creator) {
        return Room.builder()
            .roomId(roomId)
            .name("Room " + roomId.substring(0, Math.min(8, roomId.length())))
            .description("A new chat room")
            .visibility(RoomVisibility.PUBLIC)
            .createdBy(creator)
            .createdAt(clock.instant())
            .defaultRoom(false)
            .build();
    }
}

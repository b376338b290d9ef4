package com.demo.chat.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Room metadata plus its membership set. The member set is only mutated by
 * {@code RoomStore} inside an atomic update on the room's key; everyone else
 * reads {@link #memberSnapshot()}.
 */
@Getter
public class Room {

    private final String roomId;
    private final String name;
    private final String description;
    private final RoomVisibility visibility;
    private final String createdBy;
    private final Instant createdAt;
    private final boolean defaultRoom;
    private final Set<String> members = ConcurrentHashMap.newKeySet();

    @Builder
    public Room(String roomId, String name, String description, RoomVisibility visibility,
                String createdBy, Instant createdAt, boolean defaultRoom) {
        this.roomId = roomId;
        this.name = name;
        this.description = description;
        this.visibility = visibility != null ? visibility : RoomVisibility.PUBLIC;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
        this.defaultRoom = defaultRoom;
    }

    public Set<String> memberSnapshot() {
        return Set.copyOf(members);
    }

    public boolean hasMember(String userId) {
        return members.contains(userId);
    }

    public int memberCount() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public boolean isPublic() {
        return visibility == RoomVisibility.PUBLIC;
    }

    /**
     * Only called by the room store while it holds the room's slot.
     */
    public boolean addMember(String userId) {
        return members.add(userId);
    }

    public boolean removeMember(String userId) {
        return members.remove(userId);
    }
}

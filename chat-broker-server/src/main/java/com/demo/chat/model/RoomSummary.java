package com.demo.chat.model;

import com.demo.chat.domain.Room;
import com.demo.chat.domain.RoomVisibility;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RoomSummary {

    String id;
    String name;
    String description;
    RoomVisibility visibility;
    String createdBy;
    Instant createdAt;
    int memberCount;
    boolean defaultRoom;

    public static RoomSummary from(Room room) {
        return RoomSummary.builder()
            .id(room.getRoomId())
            .name(room.getName())
            .description(room.getDescription())
            .visibility(room.getVisibility())
            .createdBy(room.getCreatedBy())
            .createdAt(room.getCreatedAt())
            .memberCount(room.memberCount())
            .defaultRoom(room.isDefaultRoom())
            .build();
    }
}

package com.demo.chat.controller;

import com.demo.chat.domain.PresenceRecord;
import com.demo.chat.model.MemberSummary;
import com.demo.chat.model.RoomSummary;
import com.demo.chat.service.PresenceStore;
import com.demo.chat.service.RoomStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only views of rooms and presence for dashboards and tooling.
 */
@RestController
@RequestMapping("/api")
public class RoomQueryController {

    private final RoomStore roomStore;
    private final PresenceStore presenceStore;

    public RoomQueryController(RoomStore roomStore, PresenceStore presenceStore) {
        this.roomStore = roomStore;
        this.presenceStore = presenceStore;
    }

    @GetMapping("/rooms")
    public List<RoomSummary> rooms() {
        return roomStore.publicRooms().stream()
            .map(RoomSummary::from)
            .collect(Collectors.toList());
    }

    @GetMapping("/users/{userId}/presence")
    public MemberSummary presence(@PathVariable String userId) {
        PresenceRecord record = presenceStore.get(userId);
        return MemberSummary.from(record);
    }
}

package com.demo.chat.controller;

import com.demo.chat.infrastructure.ConnectionRegistry;
import com.demo.chat.service.MessageArchive;
import com.demo.chat.service.PresenceStore;
import com.demo.chat.service.RoomStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class HealthController {

    private final ConnectionRegistry connectionRegistry;
    private final RoomStore roomStore;
    private final PresenceStore presenceStore;
    private final MessageArchive messageArchive;

    public HealthController(ConnectionRegistry connectionRegistry,
                            RoomStore roomStore,
                            PresenceStore presenceStore,
                            MessageArchive messageArchive) {
        this.connectionRegistry = connectionRegistry;
        this.roomStore = roomStore;
        this.presenceStore = presenceStore;
        this.messageArchive = messageArchive;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "healthy");
        response.put("connections", connectionRegistry.count());
        response.put("onlineUsers", presenceStore.onlineCount());
        response.put("rooms", roomStore.count());
        response.put("archive", messageArchive.isDurable() ? "redis" : "memory");
        return response;
    }
}

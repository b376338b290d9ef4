package com.demo.chat.support;

import com.demo.chat.domain.CloseReason;
import com.demo.chat.infrastructure.ConnectionTransport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory transport that keeps every frame sent to each connection.
 */
public class RecordingTransport implements ConnectionTransport {

    private final ObjectMapper objectMapper;
    private final Map<String, List<JsonNode>> sent = new ConcurrentHashMap<>();
    private final Map<String, CloseReason> closed = new ConcurrentHashMap<>();
    private final List<String> pinged = new CopyOnWriteArrayList<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private final Set<String> brokenPings = ConcurrentHashMap.newKeySet();

    public RecordingTransport(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean send(String connectionId, String frame) {
        if (closed.containsKey(connectionId) || failing.contains(connectionId)) {
            return false;
        }
        try {
            sent.computeIfAbsent(connectionId, id -> new CopyOnWriteArrayList<>()).add(objectMapper.readTree(frame));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Transport received invalid JSON: " + frame, e);
        }
        return true;
    }

    @Override
    public void ping(String connectionId) {
        if (brokenPings.contains(connectionId)) {
            throw new IllegalStateException("Ping failed for " + connectionId);
        }
        pinged.add(connectionId);
    }

    @Override
    public void close(String connectionId, CloseReason reason) {
        closed.putIfAbsent(connectionId, reason);
    }

    public void failSendsTo(String connectionId) {
        failing.add(connectionId);
    }

    public void failPingsTo(String connectionId) {
        brokenPings.add(connectionId);
    }

    public List<JsonNode> frames(String connectionId) {
        return new ArrayList<>(sent.getOrDefault(connectionId, List.of()));
    }

    public List<JsonNode> framesOfType(String connectionId, String type) {
        return frames(connectionId).stream()
            .filter(frame -> type.equals(frame.path("type").asText()))
            .collect(Collectors.toList());
    }

    public JsonNode lastFrame(String connectionId) {
        List<JsonNode> frames = frames(connectionId);
        if (frames.isEmpty()) {
            throw new AssertionError("No frames sent to " + connectionId);
        }
        return frames.get(frames.size() - 1);
    }

    public CloseReason closeReason(String connectionId) {
        return closed.get(connectionId);
    }

    public List<String> pinged() {
        return List.copyOf(pinged);
    }

    public void clear() {
        sent.clear();
        pinged.clear();
    }
}

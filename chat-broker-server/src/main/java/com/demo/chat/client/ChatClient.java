package com.demo.chat.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Minimal Java client for the broker.
 *
 * Every request carries a fresh {@code requestId}; the first frame echoing
 * it completes the request, and an {@code ERROR} frame completes it
 * exceptionally. Frames without a matching request (broadcasts) are queued
 * for {@link #awaitEvent(String, Duration)}.
 */
@Slf4j
public class ChatClient implements AutoCloseable {

    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final Map<String, CompletableFuture<IncomingFrame>> pendingRequests = new ConcurrentHashMap<>();
    private final BlockingQueue<IncomingFrame> events = new LinkedBlockingQueue<>();
    private final CompletableFuture<CloseStatus> closed = new CompletableFuture<>();
    private volatile WebSocketSession session;

    private ChatClient(ObjectMapper objectMapper, Duration requestTimeout) {
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    public static ChatClient connect(URI endpoint, ObjectMapper objectMapper, Duration requestTimeout)
            throws InterruptedException, ExecutionException, TimeoutException {
        ChatClient client = new ChatClient(objectMapper, requestTimeout);
        StandardWebSocketClient webSocketClient = new StandardWebSocketClient();
        client.session = webSocketClient.execute(client.new Handler(), new WebSocketHttpHeaders(), endpoint)
            .get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        return client;
    }

    /**
     * Sends a frame and returns the reply correlated by request id.
     */
    public CompletableFuture<IncomingFrame> request(String type, Map<String, ?> payload) {
        String requestId = UUID.randomUUID().toString();
        CompletableFuture<IncomingFrame> reply = new CompletableFuture<>();
        pendingRequests.put(requestId, reply);
        try {
            send(type, payload, requestId);
        } catch (IOException e) {
            pendingRequests.remove(requestId);
            reply.completeExceptionally(e);
            return reply;
        }
        return reply
            .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((frame, error) -> pendingRequests.remove(requestId));
    }

    /**
     * Fire-and-forget send without correlation.
     */
    public void send(String type, Map<String, ?> payload) throws IOException {
        send(type, payload, null);
    }

    public synchronized void sendRaw(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    /**
     * Waits for the next uncorrelated frame of the given type; frames of
     * other types received meanwhile are dropped.
     */
    public IncomingFrame awaitEvent(String type, Duration timeout) throws InterruptedException, TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            IncomingFrame frame = remaining > 0 ? events.poll(remaining, TimeUnit.NANOSECONDS) : null;
            if (frame == null) {
                throw new TimeoutException("No " + type + " event within " + timeout);
            }
            if (type.equals(frame.getType())) {
                return frame;
            }
        }
    }

    public CompletableFuture<CloseStatus> closeFuture() {
        return closed;
    }

    public boolean isOpen() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    @Override
    public void close() throws IOException {
        WebSocketSession current = session;
        if (current != null && current.isOpen()) {
            current.close(CloseStatus.NORMAL);
        }
    }

    private synchronized void send(String type, Map<String, ?> payload, String requestId) throws IOException {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("type", type);
        envelope.set("payload", objectMapper.valueToTree(payload != null ? payload : Map.of()));
        if (requestId != null) {
            envelope.put("requestId", requestId);
        }
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(envelope)));
    }

    private void dispatch(String text) {
        IncomingFrame frame;
        try {
            JsonNode node = objectMapper.readTree(text);
            frame = new IncomingFrame(
                node.path("type").asText(),
                node.path("payload"),
                node.hasNonNull("requestId") ? node.get("requestId").asText() : null,
                node.path("timestamp").asLong());
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable frame: {}", e.getOriginalMessage());
            return;
        }

        CompletableFuture<IncomingFrame> pending =
            frame.getRequestId() != null ? pendingRequests.remove(frame.getRequestId()) : null;
        if (pending == null) {
            events.add(frame);
        } else if (frame.isError()) {
            pending.completeExceptionally(new ChatClientException(
                frame.getPayload().path("code").asText(), frame.getPayload().path("message").asText()));
        } else {
            pending.complete(frame);
        }
    }

    private class Handler extends TextWebSocketHandler {

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            dispatch(message.getPayload());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            pendingRequests.values().forEach(pending ->
                pending.completeExceptionally(new IOException("Connection closed: " + status)));
            pendingRequests.clear();
            closed.complete(status);
        }
    }
}

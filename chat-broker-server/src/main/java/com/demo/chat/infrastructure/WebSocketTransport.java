package com.demo.chat.infrastructure;

import com.demo.chat.domain.CloseReason;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator.OverflowStrategy;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConnectionTransport} over Spring WebSocket sessions.
 *
 * Each session is wrapped in a {@link ConcurrentWebSocketSessionDecorator}
 * so concurrent senders are serialized and a peer that stops reading is cut
 * off once it exceeds the send time or buffer limit.
 */
@Component
@Slf4j
public class WebSocketTransport implements ConnectionTransport {

    private final ConcurrentHashMap<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public WebSocketTransport(@Value("${chat.transport.send-time-limit-ms:10000}") int sendTimeLimitMs,
                              @Value("${chat.transport.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    public void attach(WebSocketSession session) {
        sessions.put(session.getId(), new ConcurrentWebSocketSessionDecorator(
            session, sendTimeLimitMs, bufferSizeLimit, OverflowStrategy.TERMINATE));
    }

    public void detach(String connectionId) {
        sessions.remove(connectionId);
    }

    @Override
    public boolean send(String connectionId, String frame) {
        WebSocketSession session = sessions.get(connectionId);
        if (session == null || !session.isOpen()) {
            return false;
        }
        try {
            session.sendMessage(new TextMessage(frame));
            return true;
        } catch (SessionLimitExceededException e) {
            log.warn("Slow consumer terminated: connectionId={}, reason={}", connectionId, e.getMessage());
            closeQuietly(connectionId, session, e.getStatus());
            return false;
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send frame: connectionId={}, error={}", connectionId, e.getMessage());
            return false;
        }
    }

    @Override
    public void ping(String connectionId) {
        WebSocketSession session = sessions.get(connectionId);
        if (session == null || !session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new PingMessage(ByteBuffer.allocate(0)));
        } catch (SessionLimitExceededException e) {
            log.warn("Slow consumer terminated on ping: connectionId={}, reason={}", connectionId, e.getMessage());
            closeQuietly(connectionId, session, e.getStatus());
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to ping: connectionId={}, error={}", connectionId, e.getMessage());
        }
    }

    @Override
    public void close(String connectionId, CloseReason reason) {
        WebSocketSession session = sessions.get(connectionId);
        if (session == null || !session.isOpen()) {
            return;
        }
        closeQuietly(connectionId, session, new CloseStatus(reason.getCode(), reason.getDescription()));
    }

    private void closeQuietly(String connectionId, WebSocketSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException | IllegalStateException e) {
            log.warn("Error closing session: connectionId={}, error={}", connectionId, e.getMessage());
        }
    }

    public int openSessions() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing {} WebSocket sessions", sessions.size());
        sessions.keySet().forEach(id -> close(id, CloseReason.SHUTDOWN));
        sessions.clear();
    }
}

package com.demo.chat.handler;

import com.demo.chat.domain.CloseReason;
import com.demo.chat.infrastructure.ChatDispatcher;
import com.demo.chat.infrastructure.WebSocketTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.InetSocketAddress;

/**
 * Adapts Spring WebSocket callbacks to the dispatcher. The session id is
 * used as connection id.
 */
@Component
@Slf4j
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private final ChatDispatcher dispatcher;
    private final WebSocketTransport transport;

    public ChatWebSocketHandler(ChatDispatcher dispatcher, WebSocketTransport transport) {
        this.dispatcher = dispatcher;
        this.transport = transport;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        InetSocketAddress remote = session.getRemoteAddress();
        String remoteAddress = remote != null ? remote.getHostString() : "unknown";
        transport.attach(session);
        dispatcher.onOpen(session.getId(), remoteAddress);
        log.info("WebSocket connected: sessionId={}, remote={}", session.getId(), remoteAddress);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        dispatcher.onFrame(session.getId(), message.getPayload());
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        dispatcher.onPong(session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Transport error: sessionId={}, error={}", session.getId(), exception.getMessage());
        dispatcher.disconnect(session.getId(), CloseReason.SERVER_ERROR);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("WebSocket closed: sessionId={}, status={}", session.getId(), status);
        dispatcher.onClose(session.getId(), CloseReason.NORMAL);
        transport.detach(session.getId());
    }
}

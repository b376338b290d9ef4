package com.demo.chat.infrastructure;

import com.demo.chat.domain.ActionType;
import com.demo.chat.domain.AuthResult;
import com.demo.chat.domain.ChatException;
import com.demo.chat.domain.ClientFrame;
import com.demo.chat.domain.CloseReason;
import com.demo.chat.domain.Connection;
import com.demo.chat.domain.ErrorCode;
import com.demo.chat.domain.EventType;
import com.demo.chat.domain.JoinOutcome;
import com.demo.chat.domain.LeaveOutcome;
import com.demo.chat.domain.Message;
import com.demo.chat.domain.PresenceRecord;
import com.demo.chat.domain.Reaction;
import com.demo.chat.domain.Room;
import com.demo.chat.domain.ServerFrame;
import com.demo.chat.domain.TypingMark;
import com.demo.chat.model.AuthenticatePayload;
import com.demo.chat.model.CreateRoomPayload;
import com.demo.chat.model.EditMessagePayload;
import com.demo.chat.model.MemberSummary;
import com.demo.chat.model.MessageRefPayload;
import com.demo.chat.model.ReactMessagePayload;
import com.demo.chat.model.RoomHistoryPayload;
import com.demo.chat.model.RoomPayload;
import com.demo.chat.model.RoomSummary;
import com.demo.chat.model.SearchMessagesPayload;
import com.demo.chat.model.SendMessagePayload;
import com.demo.chat.model.TypingStatusPayload;
import com.demo.chat.model.UpdateStatusPayload;
import com.demo.chat.service.ActionRateLimiter;
import com.demo.chat.service.ChatEventPublisher;
import com.demo.chat.service.CredentialValidator;
import com.demo.chat.service.MessageLog;
import com.demo.chat.service.MetricsService;
import com.demo.chat.service.PresenceStore;
import com.demo.chat.service.RoomStore;
import com.demo.chat.service.TypingTracker;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Protocol state machine of the broker.
 *
 * Every inbound frame goes through the same gate: envelope and type check,
 * authentication check, rate limit, payload validation. Handlers then call
 * the stores and fan events out via room → members → connections. Message
 * events of one room reach every member in log order.
 * A {@link ChatException} becomes an {@code ERROR} frame for the sender; any
 * other exception terminates only the offending connection.
 */
@Component
@Slf4j
public class ChatDispatcher {

    private static final int USER_LOCK_STRIPES = 64;

    private final ConnectionRegistry registry;
    private final PresenceStore presenceStore;
    private final RoomStore roomStore;
    private final MessageLog messageLog;
    private final TypingTracker typingTracker;
    private final ActionRateLimiter rateLimiter;
    private final ConnectionTransport transport;
    private final FrameCodec codec;
    private final CredentialValidator credentialValidator;
    private final ChatEventPublisher eventPublisher;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Executor authExecutor;
    private final Duration typingTtl;
    private final int joinHistorySize;
    private final Object[] userLocks = new Object[USER_LOCK_STRIPES];
    private final RoomEventSequencer roomEvents = new RoomEventSequencer();

    public ChatDispatcher(ConnectionRegistry registry,
                          PresenceStore presenceStore,
                          RoomStore roomStore,
                          MessageLog messageLog,
                          TypingTracker typingTracker,
                          ActionRateLimiter rateLimiter,
                          ConnectionTransport transport,
                          FrameCodec codec,
                          CredentialValidator credentialValidator,
                          ChatEventPublisher eventPublisher,
                          MetricsService metricsService,
                          Clock clock,
                          @Qualifier("authExecutor") Executor authExecutor,
                          @Value("${chat.typing.ttl:5s}") Duration typingTtl,
                          @Value("${chat.history.join-replay:100}") int joinHistorySize) {
        this.registry = registry;
        this.presenceStore = presenceStore;
        this.roomStore = roomStore;
        this.messageLog = messageLog;
        this.typingTracker = typingTracker;
        this.rateLimiter = rateLimiter;
        this.transport = transport;
        this.codec = codec;
        this.credentialValidator = credentialValidator;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.clock = clock;
        this.authExecutor = authExecutor;
        this.typingTtl = typingTtl;
        this.joinHistorySize = joinHistorySize;
        for (int i = 0; i < USER_LOCK_STRIPES; i++) {
            userLocks[i] = new Object();
        }
        roomStore.defaultRoomIds().forEach(messageLog::open);
    }

    // ===== Connection lifecycle =====

    public void onOpen(String connectionId, String remoteAddress) {
        registry.register(new Connection(connectionId, remoteAddress, clock.instant()));
        metricsService.recordWebSocketConnection(connectionId);
    }

    public void onPong(String connectionId) {
        registry.touch(connectionId, clock.instant());
    }

    /**
     * Closes the transport and runs disconnect cleanup right away.
     */
    public void disconnect(String connectionId, CloseReason reason) {
        transport.close(connectionId, reason);
        onClose(connectionId, reason);
    }

    /**
     * Disconnect cleanup. Safe to call more than once for the same connection.
     */
    public void onClose(String connectionId, CloseReason reason) {
        Connection connection = registry.find(connectionId).orElse(null);
        if (connection == null || !connection.release()) {
            return;
        }
        rateLimiter.evict(connectionId);

        String userId = connection.getUserId();
        if (userId == null) {
            registry.unregister(connectionId);
            metricsService.recordWebSocketDisconnection(connectionId, reason.name());
            return;
        }

        boolean lastConnection;
        PresenceRecord offline = null;
        synchronized (userLock(userId)) {
            lastConnection = registry.unregister(connectionId).isPresent();
            if (lastConnection) {
                presenceStore.markOffline(userId);
                offline = presenceStore.get(userId);
            }
        }
        metricsService.recordWebSocketDisconnection(connectionId, reason.name());

        String displayName = connection.getDisplayName();
        List<Room> rooms = roomStore.roomsOf(userId);
        for (Room room : rooms) {
            if (typingTracker.clearTyping(room.getRoomId(), userId)) {
                broadcastToRoom(room.getRoomId(), typingUpdate(room.getRoomId(), userId, displayName, false), userId, null);
            }
        }
        if (!lastConnection) {
            return;
        }

        log.info("User offline: userId={}, rooms={}", userId, rooms.size());
        eventPublisher.publishPresence(offline);
        ServerFrame statusChanged = frame(EventType.USER_STATUS_CHANGED, statusPayload(offline), null);
        for (Room room : rooms) {
            broadcastToRoom(room.getRoomId(), statusChanged, userId, null);
        }
        for (Room room : rooms) {
            if (registry.hasConnections(userId)) {
                // the user came back while we were cleaning up
                break;
            }
            removeFromRoom(room.getRoomId(), userId, displayName);
        }
    }

    // ===== Inbound frames =====

    public void onFrame(String connectionId, String raw) {
        Connection connection = registry.find(connectionId).orElse(null);
        if (connection == null || connection.isClosed()) {
            log.debug("Ignoring frame for closed connection: connectionId={}", connectionId);
            return;
        }
        connection.touch(clock.instant());

        String requestId = null;
        try {
            JsonNode envelope = codec.readEnvelope(raw);
            requestId = codec.requestIdOf(envelope);
            ActionType action = codec.actionOf(envelope);
            metricsService.recordFrameReceived(action.name());

            if (action.requiresAuthentication() && !connection.isAuthenticated()) {
                throw new ChatException(ErrorCode.UNAUTHORIZED, "Authentication required");
            }
            if (!rateLimiter.tryAcquire(connectionId, action)) {
                throw new ChatException(ErrorCode.RATE_LIMIT_EXCEEDED, "Too many " + action + " requests");
            }

            route(connection, codec.decode(envelope, action));

        } catch (ChatException e) {
            log.debug("Rejected frame: connectionId={}, code={}, message={}",
                connectionId, e.getCode(), e.getMessage());
            metricsService.recordError(e.getCode().name(), "dispatcher");
            sendError(connectionId, e.getCode(), e.getMessage(), requestId);
        } catch (RuntimeException e) {
            log.error("Error handling frame: connectionId={}", connectionId, e);
            metricsService.recordError(ErrorCode.INTERNAL_ERROR.name(), "dispatcher");
            sendError(connectionId, ErrorCode.INTERNAL_ERROR, "Internal server error", requestId);
            disconnect(connectionId, CloseReason.SERVER_ERROR);
        }
    }

    private void route(Connection connection, ClientFrame frame) {
        switch (frame.getAction()) {
            case AUTHENTICATE:
                handleAuthenticate(connection, frame.payloadAs(AuthenticatePayload.class), frame.getRequestId());
                break;
            case JOIN_ROOM:
                handleJoinRoom(connection, frame.payloadAs(RoomPayload.class), frame.getRequestId());
                break;
            case LEAVE_ROOM:
                handleLeaveRoom(connection, frame.payloadAs(RoomPayload.class), frame.getRequestId());
                break;
            case SEND_MESSAGE:
                handleSendMessage(connection, frame.payloadAs(SendMessagePayload.class), frame.getRequestId());
                break;
            case TYPING_STATUS:
                handleTypingStatus(connection, frame.payloadAs(TypingStatusPayload.class));
                break;
            case PING:
                reply(connection, EventType.PONG, Map.of("serverTime", clock.millis()), frame.getRequestId());
                break;
            case CREATE_ROOM:
                handleCreateRoom(connection, frame.payloadAs(CreateRoomPayload.class), frame.getRequestId());
                break;
            case GET_ROOM_HISTORY:
                handleRoomHistory(connection, frame.payloadAs(RoomHistoryPayload.class), frame.getRequestId());
                break;
            case SEARCH_MESSAGES:
                handleSearch(connection, frame.payloadAs(SearchMessagesPayload.class), frame.getRequestId());
                break;
            case UPDATE_STATUS:
                handleUpdateStatus(connection, frame.payloadAs(UpdateStatusPayload.class), frame.getRequestId());
                break;
            case EDIT_MESSAGE:
                handleEditMessage(connection, frame.payloadAs(EditMessagePayload.class), frame.getRequestId());
                break;
            case DELETE_MESSAGE:
                handleDeleteMessage(connection, frame.payloadAs(MessageRefPayload.class), frame.getRequestId());
                break;
            case REACT_MESSAGE:
                handleReaction(connection, frame.payloadAs(ReactMessagePayload.class), frame.getRequestId());
                break;
            default:
                throw new ChatException(ErrorCode.INVALID_MESSAGE, "Unsupported message type: " + frame.getAction());
        }
    }

    // ===== Authentication =====

    private void handleAuthenticate(Connection connection, AuthenticatePayload payload, String requestId) {
        if (connection.isAuthenticated()) {
            throw new ChatException(ErrorCode.FORBIDDEN, "Connection is already authenticated");
        }
        if (!connection.beginAuthentication()) {
            throw new ChatException(ErrorCode.FORBIDDEN, "Authentication already in progress");
        }
        log.debug("Authenticating: connectionId={}, username={}, userAgent={}",
            connection.getConnectionId(), payload.getUsername(), payload.getUserAgent());

        CompletableFuture<AuthResult> validation = CompletableFuture.supplyAsync(
            () -> credentialValidator.validateCredential(payload.getToken(), payload.getUsername()),
            authExecutor);
        connection.trackAuthentication(validation);
        validation.whenComplete((result, error) -> {
            try {
                completeAuthentication(connection, result, error, requestId);
            } catch (RuntimeException e) {
                log.error("Error completing authentication: connectionId={}", connection.getConnectionId(), e);
                sendError(connection.getConnectionId(), ErrorCode.INTERNAL_ERROR, "Internal server error", requestId);
                disconnect(connection.getConnectionId(), CloseReason.SERVER_ERROR);
            }
        });
    }

    private void completeAuthentication(Connection connection, AuthResult result, Throwable error, String requestId) {
        String connectionId = connection.getConnectionId();
        if (error != null || result == null || !result.isValid()) {
            if (!connection.abortAuthentication()) {
                log.debug("Discarding auth result for closed connection: connectionId={}", connectionId);
                return;
            }
            String reason = error != null ? "Credential validation failed" : result != null ? result.getReason() : "Invalid credential";
            if (error != null) {
                log.warn("Credential validation error: connectionId={}", connectionId, error);
            } else {
                log.warn("Authentication failed: connectionId={}, reason={}", connectionId, reason);
            }
            metricsService.recordError(ErrorCode.AUTHENTICATION_FAILED.name(), "dispatcher");
            sendError(connectionId, ErrorCode.AUTHENTICATION_FAILED, reason, requestId);
            disconnect(connectionId, CloseReason.AUTHENTICATION_FAILED);
            return;
        }

        String userId = result.getUserId();
        PresenceRecord presence;
        synchronized (userLock(userId)) {
            if (!connection.completeAuthentication(userId, result.getDisplayName())) {
                log.debug("Discarding auth result for closed connection: connectionId={}", connectionId);
                return;
            }
            registry.setUser(connectionId, userId);
            presence = presenceStore.markOnline(userId, result.getDisplayName());
        }
        log.info("Authenticated: connectionId={}, userId={}, username={}",
            connectionId, userId, result.getDisplayName());
        eventPublisher.publishPresence(presence);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", userId);
        payload.put("username", presence.getDisplayName());
        payload.put("status", presence.getStatus());
        payload.put("rooms", roomStore.visibleTo(userId).stream().map(RoomSummary::from).collect(Collectors.toList()));
        reply(connection, EventType.AUTH_SUCCESS, payload, requestId);
    }

    // ===== Rooms =====

    private void handleJoinRoom(Connection connection, RoomPayload payload, String requestId) {
        String roomId = payload.getRoomId();
        String userId = connection.getUserId();
        JoinOutcome outcome = roomStore.joinOrCreate(roomId, userId, room -> messageLog.open(room.getRoomId()));
        if (outcome.isCreated()) {
            eventPublisher.publishRoomCreated(outcome.getRoom());
        }
        if (outcome.isJoined()) {
            log.info("User joined room: userId={}, roomId={}", userId, roomId);
            broadcastToRoom(roomId, frame(EventType.USER_JOINED, membershipPayload(userId, connection.getDisplayName(), roomId), null), userId, null);
        }
        reply(connection, EventType.ROOM_JOINED, roomSnapshot(outcome.getRoom()), requestId);
    }

    private void handleLeaveRoom(Connection connection, RoomPayload payload, String requestId) {
        String roomId = payload.getRoomId();
        String userId = connection.getUserId();
        if (!roomStore.exists(roomId)) {
            throw ChatException.roomNotFound(roomId);
        }
        if (!removeFromRoom(roomId, userId, connection.getDisplayName())) {
            throw ChatException.notAMember(roomId);
        }
        reply(connection, EventType.ROOM_LEFT, Map.of("roomId", roomId), requestId);
    }

    /**
     * Removes the user and notifies the remaining members, deleting the room
     * with its history and typing marks when it ends up empty.
     */
    private boolean removeFromRoom(String roomId, String userId, String displayName) {
        LeaveOutcome outcome;
        try {
            outcome = roomStore.leave(roomId, userId);
        } catch (ChatException e) {
            return false;
        }
        if (!outcome.isLeft()) {
            return false;
        }
        log.info("User left room: userId={}, roomId={}", userId, roomId);
        if (typingTracker.clearTyping(roomId, userId)) {
            broadcastToRoom(roomId, typingUpdate(roomId, userId, displayName, false), userId, null);
        }
        broadcastToRoom(roomId, frame(EventType.USER_LEFT, membershipPayload(userId, displayName, roomId), null), null, null);
        if (outcome.isRoomNowEmpty()) {
            boolean deleted = roomStore.deleteIfEmpty(roomId, room -> {
                messageLog.drop(room.getRoomId());
                typingTracker.clearRoom(room.getRoomId());
                roomEvents.forget(room.getRoomId());
            });
            if (deleted) {
                eventPublisher.publishRoomDeleted(roomId);
            }
        }
        return true;
    }

    private void handleCreateRoom(Connection connection, CreateRoomPayload payload, String requestId) {
        String userId = connection.getUserId();
        Room draft = Room.builder()
            .roomId(payload.getRoomId() != null ? payload.getRoomId() : UUID.randomUUID().toString())
            .name(payload.getName().trim())
            .description(payload.getDescription() != null ? payload.getDescription() : "")
            .visibility(payload.getVisibility())
            .createdBy(userId)
            .createdAt(clock.instant())
            .defaultRoom(false)
            .build();
        Room room = roomStore.createAndJoin(draft, userId, created -> messageLog.open(created.getRoomId()));
        eventPublisher.publishRoomCreated(room);
        reply(connection, EventType.ROOM_CREATED, roomSnapshot(room), requestId);
    }

    // ===== Messages =====

    private void handleSendMessage(Connection connection, SendMessagePayload payload, String requestId) {
        String roomId = payload.getRoomId();
        String userId = connection.getUserId();
        requireMember(roomId, userId);

        Message draft = Message.builder()
            .roomId(roomId)
            .senderId(userId)
            .senderDisplayName(connection.getDisplayName())
            .content(payload.getContent())
            .kind(payload.kindOrDefault())
            .metadata(payload.getMetadata() != null ? Map.copyOf(payload.getMetadata()) : Map.of())
            .build();
        Message stored = roomEvents.sequence(roomId, () -> messageLog.append(roomId, draft),
            message -> broadcastToRoom(roomId, frame(EventType.NEW_MESSAGE, message, requestId), null, null));
        log.debug("Message stored: roomId={}, messageId={}, senderId={}", roomId, stored.getId(), userId);

        eventPublisher.publishMessage("MESSAGE_SENT", stored);
    }

    private void handleEditMessage(Connection connection, EditMessagePayload payload, String requestId) {
        String roomId = payload.getRoomId();
        String userId = connection.getUserId();
        requireMember(roomId, userId);

        Message updated = roomEvents.sequence(roomId,
            () -> messageLog.amend(roomId, payload.getMessageId(), current -> {
                requireLive(current);
                if (!current.isSentBy(userId)) {
                    throw new ChatException(ErrorCode.FORBIDDEN, "Only the sender can edit a message");
                }
                return current.toBuilder()
                    .content(payload.getContent())
                    .editedAt(clock.instant())
                    .build();
            }).orElseThrow(() -> ChatException.messageNotFound(payload.getMessageId())),
            message -> broadcastToRoom(roomId, frame(EventType.MESSAGE_UPDATED, message, requestId), null, null));

        eventPublisher.publishMessage("MESSAGE_EDITED", updated);
    }

    private void handleDeleteMessage(Connection connection, MessageRefPayload payload, String requestId) {
        String roomId = payload.getRoomId();
        String userId = connection.getUserId();
        requireMember(roomId, userId);

        Message tombstone = roomEvents.sequence(roomId,
            () -> messageLog.amend(roomId, payload.getMessageId(), current -> {
                requireLive(current);
                if (!current.isSentBy(userId)) {
                    throw new ChatException(ErrorCode.FORBIDDEN, "Only the sender can delete a message");
                }
                return current.toBuilder()
                    .content("")
                    .metadata(Map.of())
                    .reactions(List.of())
                    .deleted(true)
                    .editedAt(clock.instant())
                    .build();
            }).orElseThrow(() -> ChatException.messageNotFound(payload.getMessageId())),
            message -> {
                Map<String, Object> deleted = Map.of("roomId", roomId, "messageId", message.getId());
                broadcastToRoom(roomId, frame(EventType.MESSAGE_DELETED, deleted, requestId), null, null);
            });

        eventPublisher.publishMessage("MESSAGE_DELETED", tombstone);
    }

    private void handleReaction(Connection connection, ReactMessagePayload payload, String requestId) {
        String roomId = payload.getRoomId();
        String userId = connection.getUserId();
        requireMember(roomId, userId);

        roomEvents.sequence(roomId,
            () -> messageLog.amend(roomId, payload.getMessageId(), current -> {
                requireLive(current);
                List<Reaction> reactions = new ArrayList<>(current.getReactions());
                boolean removed = reactions.removeIf(reaction ->
                    reaction.getUserId().equals(userId) && reaction.getEmoji().equals(payload.getEmoji()));
                if (!removed) {
                    reactions.add(Reaction.builder().emoji(payload.getEmoji()).userId(userId).build());
                }
                return current.toBuilder().reactions(List.copyOf(reactions)).build();
            }).orElseThrow(() -> ChatException.messageNotFound(payload.getMessageId())),
            message -> broadcastToRoom(roomId, frame(EventType.MESSAGE_UPDATED, message, requestId), null, null));
    }

    private void handleRoomHistory(Connection connection, RoomHistoryPayload payload, String requestId) {
        String roomId = payload.getRoomId();
        requireMember(roomId, connection.getUserId());

        int limit = payload.limitOrDefault();
        List<Message> page = messageLog.before(roomId, payload.getBeforeId(), limit + 1);
        boolean hasMore = page.size() > limit;
        if (hasMore) {
            page = page.subList(1, page.size());
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("roomId", roomId);
        result.put("messages", page);
        result.put("hasMore", hasMore);
        reply(connection, EventType.ROOM_HISTORY, result, requestId);
    }

    private void handleSearch(Connection connection, SearchMessagesPayload payload, String requestId) {
        String roomId = payload.getRoomId();
        requireMember(roomId, connection.getUserId());

        String needle = payload.getQuery().toLowerCase(Locale.ROOT);
        int limit = payload.limitOrDefault();
        List<Message> results = new ArrayList<>();
        int total = 0;
        for (Message message : messageLog.search(roomId, m -> !m.isDeleted()
                && m.getContent() != null && m.getContent().toLowerCase(Locale.ROOT).contains(needle))) {
            total++;
            if (results.size() < limit) {
                results.add(message);
            }
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("roomId", roomId);
        result.put("query", payload.getQuery());
        result.put("results", results);
        result.put("total", total);
        reply(connection, EventType.SEARCH_RESULTS, result, requestId);
    }

    // ===== Typing and presence =====

    private void handleTypingStatus(Connection connection, TypingStatusPayload payload) {
        String roomId = payload.getRoomId();
        String userId = connection.getUserId();
        requireMember(roomId, userId);

        boolean typing = payload.getIsTyping();
        if (typing) {
            typingTracker.setTyping(roomId, userId, typingTtl);
        } else {
            typingTracker.clearTyping(roomId, userId);
        }
        broadcastToRoom(roomId, typingUpdate(roomId, userId, connection.getDisplayName(), typing), userId, null);
    }

    private void handleUpdateStatus(Connection connection, UpdateStatusPayload payload, String requestId) {
        String userId = connection.getUserId();
        PresenceRecord presence;
        synchronized (userLock(userId)) {
            presence = presenceStore.setStatus(userId, payload.getStatus());
        }
        log.info("Status updated: userId={}, status={}", userId, presence.getStatus().getValue());
        eventPublisher.publishPresence(presence);

        reply(connection, EventType.STATUS_UPDATED, statusPayload(presence), requestId);
        ServerFrame changed = frame(EventType.USER_STATUS_CHANGED, statusPayload(presence), null);
        for (Room room : roomStore.roomsOf(userId)) {
            broadcastToRoom(room.getRoomId(), changed, null, connection.getConnectionId());
        }
    }

    /**
     * Broadcasts {@code isTyping=false} for marks the sweeper found expired.
     */
    public void expireTyping(Instant now) {
        for (TypingMark mark : typingTracker.sweep(now)) {
            String displayName = presenceStore.get(mark.getUserId()).getDisplayName();
            broadcastToRoom(mark.getRoomId(), typingUpdate(mark.getRoomId(), mark.getUserId(), displayName, false),
                mark.getUserId(), null);
        }
    }

    // ===== Fan-out =====

    /**
     * Sends one serialized frame to every open connection of every member,
     * skipping the excluded user's connections and the excluded connection.
     * A failed send to one target never stops the others.
     */
    private void broadcastToRoom(String roomId, ServerFrame frame, String excludedUserId, String excludedConnectionId) {
        String text = codec.encode(frame);
        int delivered = 0;
        for (String memberId : roomStore.members(roomId)) {
            if (memberId.equals(excludedUserId)) {
                continue;
            }
            for (String connectionId : registry.connectionsOf(memberId)) {
                if (connectionId.equals(excludedConnectionId)) {
                    continue;
                }
                if (transport.send(connectionId, text)) {
                    delivered++;
                } else {
                    metricsService.recordSendFailure(frame.getType().name());
                }
            }
        }
        metricsService.recordFrameSent(frame.getType().name(), delivered);
    }

    private void reply(Connection connection, EventType type, Object payload, String requestId) {
        ServerFrame response = frame(type, payload, requestId);
        if (transport.send(connection.getConnectionId(), codec.encode(response))) {
            metricsService.recordFrameSent(type.name(), 1);
        } else {
            metricsService.recordSendFailure(type.name());
        }
    }

    private void sendError(String connectionId, ErrorCode code, String message, String requestId) {
        ServerFrame error = ServerFrame.error(code, message, requestId, clock.millis());
        if (!transport.send(connectionId, codec.encode(error))) {
            log.debug("Could not deliver error: connectionId={}, code={}", connectionId, code);
        }
    }

    // ===== Helpers =====

    private void requireMember(String roomId, String userId) {
        if (!roomStore.exists(roomId)) {
            throw ChatException.roomNotFound(roomId);
        }
        if (!roomStore.isMember(roomId, userId)) {
            throw ChatException.notAMember(roomId);
        }
    }

    private static void requireLive(Message message) {
        if (message.isDeleted()) {
            throw ChatException.messageNotFound(message.getId());
        }
    }

    private ServerFrame frame(EventType type, Object payload, String requestId) {
        return ServerFrame.of(type, payload, requestId, clock.millis());
    }

    private Map<String, Object> roomSnapshot(Room room) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("room", RoomSummary.from(room));
        payload.put("messages", messageLog.tail(room.getRoomId(), joinHistorySize));
        payload.put("members", room.memberSnapshot().stream()
            .map(presenceStore::get)
            .map(MemberSummary::from)
            .collect(Collectors.toList()));
        return payload;
    }

    private ServerFrame typingUpdate(String roomId, String userId, String displayName, boolean typing) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("roomId", roomId);
        payload.put("userId", userId);
        payload.put("username", displayName);
        payload.put("isTyping", typing);
        return frame(EventType.TYPING_UPDATE, payload, null);
    }

    private Map<String, Object> membershipPayload(String userId, String displayName, String roomId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", userId);
        payload.put("username", displayName);
        payload.put("roomId", roomId);
        payload.put("timestamp", clock.instant());
        return payload;
    }

    private static Map<String, Object> statusPayload(PresenceRecord presence) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", presence.getUserId());
        payload.put("username", presence.getDisplayName());
        payload.put("status", presence.getStatus());
        payload.put("lastSeenAt", presence.getLastSeenAt());
        return payload;
    }

    private Object userLock(String userId) {
        return userLocks[Math.floorMod(userId.hashCode(), USER_LOCK_STRIPES)];
    }
}

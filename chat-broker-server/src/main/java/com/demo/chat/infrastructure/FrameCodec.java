package com.demo.chat.infrastructure;

import com.demo.chat.domain.ActionType;
import com.demo.chat.domain.ChatException;
import com.demo.chat.domain.ClientFrame;
import com.demo.chat.domain.ErrorCode;
import com.demo.chat.domain.ServerFrame;
import com.demo.chat.domain.ValidationResult;
import com.demo.chat.model.ActionPayload;
import com.demo.chat.model.AuthenticatePayload;
import com.demo.chat.model.CreateRoomPayload;
import com.demo.chat.model.EditMessagePayload;
import com.demo.chat.model.MessageRefPayload;
import com.demo.chat.model.PingPayload;
import com.demo.chat.model.ReactMessagePayload;
import com.demo.chat.model.RoomHistoryPayload;
import com.demo.chat.model.RoomPayload;
import com.demo.chat.model.SearchMessagesPayload;
import com.demo.chat.model.SendMessagePayload;
import com.demo.chat.model.TypingStatusPayload;
import com.demo.chat.model.UpdateStatusPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * JSON envelope codec. Decoding happens in steps so the dispatcher can run
 * its auth and rate checks between reading the type and binding the payload.
 */
@Component
public class FrameCodec {

    private static final Map<ActionType, Class<? extends ActionPayload>> PAYLOAD_TYPES = new EnumMap<>(ActionType.class);

    static {
        PAYLOAD_TYPES.put(ActionType.AUTHENTICATE, AuthenticatePayload.class);
        PAYLOAD_TYPES.put(ActionType.JOIN_ROOM, RoomPayload.class);
        PAYLOAD_TYPES.put(ActionType.LEAVE_ROOM, RoomPayload.class);
        PAYLOAD_TYPES.put(ActionType.SEND_MESSAGE, SendMessagePayload.class);
        PAYLOAD_TYPES.put(ActionType.TYPING_STATUS, TypingStatusPayload.class);
        PAYLOAD_TYPES.put(ActionType.PING, PingPayload.class);
        PAYLOAD_TYPES.put(ActionType.CREATE_ROOM, CreateRoomPayload.class);
        PAYLOAD_TYPES.put(ActionType.GET_ROOM_HISTORY, RoomHistoryPayload.class);
        PAYLOAD_TYPES.put(ActionType.SEARCH_MESSAGES, SearchMessagesPayload.class);
        PAYLOAD_TYPES.put(ActionType.UPDATE_STATUS, UpdateStatusPayload.class);
        PAYLOAD_TYPES.put(ActionType.EDIT_MESSAGE, EditMessagePayload.class);
        PAYLOAD_TYPES.put(ActionType.DELETE_MESSAGE, MessageRefPayload.class);
        PAYLOAD_TYPES.put(ActionType.REACT_MESSAGE, ReactMessagePayload.class);
    }

    private final ObjectMapper objectMapper;
    private final ObjectMapper payloadMapper;

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.payloadMapper = objectMapper.copy()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    /**
     * @throws ChatException INVALID_MESSAGE unless the text is a JSON object
     */
    public JsonNode readEnvelope(String raw) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw invalid("Malformed JSON");
        }
        if (envelope == null || !envelope.isObject()) {
            throw invalid("Frame must be a JSON object");
        }
        return envelope;
    }

    public String requestIdOf(JsonNode envelope) {
        JsonNode requestId = envelope.get("requestId");
        return requestId != null && requestId.isTextual() ? requestId.asText() : null;
    }

    /**
     * @throws ChatException INVALID_MESSAGE for a missing or unknown type
     */
    public ActionType actionOf(JsonNode envelope) {
        JsonNode type = envelope.get("type");
        if (type == null || !type.isTextual() || type.asText().isEmpty()) {
            throw invalid("Frame type is required");
        }
        return ActionType.fromWire(type.asText())
            .orElseThrow(() -> invalid("Unknown message type: " + type.asText()));
    }

    /**
     * Binds and validates the payload for {@code action}. Unknown fields are
     * rejected.
     */
    public ClientFrame decode(JsonNode envelope, ActionType action) {
        JsonNode payloadNode = envelope.get("payload");
        if (payloadNode == null || payloadNode.isNull()) {
            payloadNode = objectMapper.createObjectNode();
        }
        if (!payloadNode.isObject()) {
            throw invalid("Payload must be a JSON object");
        }
        ActionPayload payload;
        try {
            payload = payloadMapper.treeToValue(payloadNode, PAYLOAD_TYPES.get(action));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw invalid("Invalid payload for " + action + ": " + rootMessage(e));
        }
        ValidationResult validation = payload.validate();
        if (!validation.isValid()) {
            throw invalid("Invalid payload for " + action + ": " + validation.getErrorMessage());
        }
        return new ClientFrame(action, payload, requestIdOf(envelope));
    }

    public String encode(ServerFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + frame.getType() + " frame", e);
        }
    }

    private static ChatException invalid(String message) {
        return new ChatException(ErrorCode.INVALID_MESSAGE, message);
    }

    private static String rootMessage(Exception e) {
        if (e instanceof JsonProcessingException) {
            return ((JsonProcessingException) e).getOriginalMessage();
        }
        return e.getMessage();
    }
}

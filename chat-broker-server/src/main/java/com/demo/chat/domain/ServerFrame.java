package com.demo.chat.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Outbound envelope: {@code {type, payload, requestId?, timestamp}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServerFrame {

    private EventType type;
    private Object payload;
    private String requestId;
    private long timestamp;

    public static ServerFrame of(EventType type, Object payload, String requestId, long timestamp) {
        return ServerFrame.builder()
            .type(type)
            .payload(payload)
            .requestId(requestId)
            .timestamp(timestamp)
            .build();
    }

    public static ServerFrame error(ErrorCode code, String message, String requestId, long timestamp) {
        return of(EventType.ERROR, Map.of("code", code.name(), "message", message), requestId, timestamp);
    }
}

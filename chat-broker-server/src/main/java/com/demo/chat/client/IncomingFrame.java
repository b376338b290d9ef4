package com.demo.chat.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class IncomingFrame {

    String type;
    JsonNode payload;
    String requestId;
    long timestamp;

    public boolean isError() {
        return "ERROR".equals(type);
    }
}

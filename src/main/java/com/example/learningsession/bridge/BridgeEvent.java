package com.example.learningsession.bridge;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Wire form of everything the bridge carries. {@code operationId} is unique per
 * logical operation; receivers use it to drop duplicates.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BridgeEvent {
    String operationId;
    String sessionId;
    BridgeEventType type;
    Map<String, Object> payload;
    Instant occurredAt;

    void validate() {
        if (operationId == null || operationId.isBlank()) {
            throw new IllegalArgumentException("operationId is required");
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
    }

    public Object payloadValue(String key) {
        return payload == null ? null : payload.get(key);
    }

    public String payloadString(String key) {
        Object value = payloadValue(key);
        return value != null ? value.toString() : null;
    }
}

package com.example.learningsession.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("bridge_outbox")
public class OutboxEvent {
    @Id
    private String id;
    private String operationId;
    private String sessionId;
    private String type; // BridgeEventType name
    private Instant ts;
    private Map<String,Object> payload;
    private boolean processed;
    private int attempts;
    private String lastError;
}

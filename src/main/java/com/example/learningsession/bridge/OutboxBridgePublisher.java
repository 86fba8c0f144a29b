package com.example.learningsession.bridge;

import com.example.learningsession.model.OutboxEvent;
import com.example.learningsession.repo.OutboxRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Publishing path for origins that do not share memory with the live session,
 * such as an upload worker. Events are written to the outbox collection and
 * handed to {@link EventBroadcastBridge} by the projector.
 */
@Service
public class OutboxBridgePublisher {

    private static final Logger logger = LoggerFactory.getLogger(OutboxBridgePublisher.class);

    private final OutboxRepo outboxRepo;

    public OutboxBridgePublisher(OutboxRepo outboxRepo) {
        this.outboxRepo = outboxRepo;
    }

    public OutboxEvent enqueue(BridgeEvent event) {
        event.validate();
        OutboxEvent outboxEvent = OutboxEvent.builder()
                .id(UUID.randomUUID().toString())
                .operationId(event.getOperationId())
                .sessionId(event.getSessionId())
                .type(event.getType().name())
                .ts(event.getOccurredAt() != null ? event.getOccurredAt() : Instant.now())
                .payload(event.getPayload() == null ? Map.of() : new HashMap<>(event.getPayload()))
                .processed(false)
                .build();
        OutboxEvent saved = outboxRepo.save(outboxEvent);
        logger.debug("Queued {} {} for session {}", event.getType(), event.getOperationId(), event.getSessionId());
        return saved;
    }

    public Map<String, Object> getOutboxStats() {
        return Map.of(
            "total", outboxRepo.count(),
            "unprocessed", outboxRepo.countByProcessedFalse()
        );
    }
}

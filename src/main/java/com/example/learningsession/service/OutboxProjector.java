package com.example.learningsession.service;

import com.example.learningsession.bridge.BridgeEvent;
import com.example.learningsession.bridge.BridgeEventType;
import com.example.learningsession.bridge.DeliveryReport;
import com.example.learningsession.bridge.EventBroadcastBridge;
import com.example.learningsession.model.OutboxEvent;
import com.example.learningsession.repo.OutboxRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Drains the bridge outbox into {@link EventBroadcastBridge}. An event whose
 * publish throws, or whose cache processing fails, stays unprocessed and is
 * picked up by the next run.
 */
@Service
public class OutboxProjector {

    private static final Logger logger = LoggerFactory.getLogger(OutboxProjector.class);

    private final OutboxRepo outboxRepo;
    private final EventBroadcastBridge bridge;

    public OutboxProjector(OutboxRepo outboxRepo, EventBroadcastBridge bridge) {
        this.outboxRepo = outboxRepo;
        this.bridge = bridge;
    }

    @Scheduled(fixedDelayString = "${app.bridge.outbox-poll-ms:2000}", initialDelay = 5000L)
    public void run() {
        List<OutboxEvent> events = outboxRepo.findTop50ByProcessedFalseOrderByTsAsc();
        for (OutboxEvent e : events) {
            BridgeEventType type;
            try {
                type = BridgeEventType.valueOf(e.getType());
            } catch (IllegalArgumentException | NullPointerException ex) {
                logger.warn("Skipping outbox event {} with unknown type {}", e.getId(), e.getType());
                e.setProcessed(true);
                e.setLastError("Unknown type " + e.getType());
                outboxRepo.save(e);
                continue;
            }
            try {
                DeliveryReport report = bridge.publish(BridgeEvent.builder()
                        .operationId(e.getOperationId())
                        .sessionId(e.getSessionId())
                        .type(type)
                        .payload(e.getPayload())
                        .occurredAt(e.getTs())
                        .build());
                if (report.isProcessorFailed()) {
                    // cache processors are idempotent per operation id, so the next run may replay it
                    e.setAttempts(e.getAttempts() + 1);
                    e.setLastError("Processor failed for " + e.getOperationId());
                    outboxRepo.save(e);
                    logger.warn("Outbox event {} ({}) left queued after processor failure on attempt {}",
                            e.getId(), e.getOperationId(), e.getAttempts());
                    continue;
                }
                e.setProcessed(true);
                e.setLastError(null);
                outboxRepo.save(e);
            } catch (IllegalArgumentException ex) {
                logger.warn("Discarding malformed outbox event {}: {}", e.getId(), ex.getMessage());
                e.setProcessed(true);
                e.setLastError(ex.getMessage());
                outboxRepo.save(e);
            } catch (RuntimeException ex) {
                e.setAttempts(e.getAttempts() + 1);
                e.setLastError(ex.getMessage());
                outboxRepo.save(e);
                logger.warn("Outbox event {} ({}) failed on attempt {}: {}",
                        e.getId(), e.getOperationId(), e.getAttempts(), ex.getMessage());
            }
        }
    }
}

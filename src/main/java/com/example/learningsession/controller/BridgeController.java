package com.example.learningsession.controller;

import com.example.learningsession.bridge.BridgeEvent;
import com.example.learningsession.bridge.EventBroadcastBridge;
import com.example.learningsession.bridge.OutboxBridgePublisher;
import com.example.learningsession.model.OutboxEvent;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for events raised outside the live session, such as upload
 * progress from a background worker.
 */
@RestController
@RequestMapping("/bridge")
public class BridgeController {

    private final EventBroadcastBridge bridge;
    private final OutboxBridgePublisher outboxPublisher;

    public BridgeController(EventBroadcastBridge bridge, OutboxBridgePublisher outboxPublisher) {
        this.bridge = bridge;
        this.outboxPublisher = outboxPublisher;
    }

    @PostMapping("/events")
    public ResponseEntity<Map<String, Object>> publish(@RequestBody BridgeEvent event,
                                                       @RequestParam(defaultValue = "false") boolean deferred) {
        if (deferred) {
            OutboxEvent queued = outboxPublisher.enqueue(event);
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(Map.of("queued", true, "outboxId", queued.getId(), "operationId", queued.getOperationId()));
        }
        return ResponseEntity.ok(bridge.publish(event).toMap());
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>(bridge.getBridgeStats());
        stats.put("outbox", outboxPublisher.getOutboxStats());
        return stats;
    }
}

package com.example.learningsession.mcp;

import com.example.learningsession.bridge.EventBroadcastBridge;
import com.example.learningsession.bridge.OutboxBridgePublisher;
import com.example.learningsession.session.SessionContext;
import com.example.learningsession.session.SessionRegistry;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Service
public class CoordinatorTools {

    private final EventBroadcastBridge bridge;
    private final OutboxBridgePublisher outboxPublisher;
    private final SessionRegistry sessionRegistry;

    public CoordinatorTools(EventBroadcastBridge bridge, OutboxBridgePublisher outboxPublisher,
                            SessionRegistry sessionRegistry) {
        this.bridge = bridge;
        this.outboxPublisher = outboxPublisher;
        this.sessionRegistry = sessionRegistry;
    }

    @Tool(description = "Get event bridge statistics: delivery pool, observers, event counters and outbox backlog")
    public Map<String, Object> bridge_stats() {
        Map<String, Object> stats = new LinkedHashMap<>(bridge.getBridgeStats());
        stats.put("outbox", outboxPublisher.getOutboxStats());
        stats.put("openSessions", sessionRegistry.activeSessionCount());
        return stats;
    }

    @Tool(description = "Get the current context of an open viewing session")
    public Map<String, Object> session_context(String sessionId) {
        Optional<SessionContext> context = sessionRegistry.find(sessionId).map(m -> m.getContext());
        return context.<Map<String, Object>>map(c -> Map.of("found", true, "context", c))
                .orElseGet(() -> Map.of("found", false, "sessionId", String.valueOf(sessionId)));
    }
}

package com.example.learningsession.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * A single ledger entry. Instances are immutable; a lifecycle transition
 * produces a new revision through {@link #withLifecycleState(LifecycleState)}.
 */
@Value
@Builder(toBuilder = true)
public class Message {
    String id;
    String sessionId;
    MessageKind kind;
    @With
    LifecycleState lifecycleState;
    OriginTimestamp originTimestamp;
    // null for session-level notices
    Double videoPositionSeconds;
    AgentType agentType;
    String triggerId;
    String text;
    @Singular("payloadEntry")
    Map<String, Object> payload;

    public boolean isAgentPrompt() {
        return kind == MessageKind.AGENT_PROMPT;
    }
}

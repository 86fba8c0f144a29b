package com.example.learningsession.trigger;

import com.example.learningsession.model.AgentType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * An authored {@code (timestamp, agentType)} pair with the prompt's payload.
 */
@Value
@Builder
public class TriggerPoint {
    String id;
    double timestampSeconds;
    AgentType agentType;
    Map<String, Object> agentPayload;

    public static String defaultId(String videoId, double timestampSeconds, AgentType agentType) {
        return videoId + "@" + timestampSeconds + ":" + agentType;
    }
}

package com.example.learningsession.session;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time copy of a session's state. The state machine is the only
 * owner of the live values; everything else reads them through this.
 */
@Value
@Builder
public class SessionContext {
    String sessionId;
    String userId;
    String videoId;
    String courseId;
    String activeAgentMessageId;
    boolean playbackSuspended;
    double positionSeconds;
    int observerCount;
    boolean triggersEnabled;
    int pendingPromptCount;
    int messageCount;
    long lastSequenceNumber;
}

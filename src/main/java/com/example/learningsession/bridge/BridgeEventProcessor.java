package com.example.learningsession.bridge;

import java.util.List;

/**
 * Runs synchronously inside {@link EventBroadcastBridge#publish} before any
 * observer sees the event. Whatever a processor writes is visible to observers
 * by the time they are notified.
 */
public interface BridgeEventProcessor {

    boolean supports(BridgeEventType type);

    /**
     * @return the cache entries this event changed; empty when it was already applied
     */
    List<CacheUpdate> process(BridgeEvent event);
}

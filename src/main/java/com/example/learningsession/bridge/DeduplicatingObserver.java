package com.example.learningsession.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies each operation id at most once to the wrapped observer. Remembers the
 * most recent {@code window} operation ids.
 */
class DeduplicatingObserver implements SessionObserver {

    private static final Logger logger = LoggerFactory.getLogger(DeduplicatingObserver.class);

    private final SessionObserver delegate;
    private final Map<String, Boolean> seen;

    DeduplicatingObserver(SessionObserver delegate, int window) {
        this.delegate = delegate;
        int capacity = Math.max(window, 1);
        this.seen = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    @Override
    public synchronized void onEvent(BridgeEvent event) {
        if (seen.containsKey(event.getOperationId())) {
            logger.debug("Skipping duplicate operation {}", event.getOperationId());
            return;
        }
        delegate.onEvent(event);
        // only remembered once applied, so a failed attempt can be retried
        seen.put(event.getOperationId(), Boolean.TRUE);
    }

    @Override
    public boolean isConnected() {
        return delegate.isConnected();
    }
}

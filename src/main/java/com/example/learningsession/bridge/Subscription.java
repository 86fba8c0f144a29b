package com.example.learningsession.bridge;

import java.util.function.Consumer;

/**
 * Handle returned by {@link EventBroadcastBridge#subscribe}. Cancelling is idempotent.
 */
public class Subscription {

    private final String id;
    private final String sessionId;
    private final SessionObserver observer;
    private final Consumer<Subscription> canceller;

    Subscription(String id, String sessionId, SessionObserver observer, Consumer<Subscription> canceller) {
        this.id = id;
        this.sessionId = sessionId;
        this.observer = observer;
        this.canceller = canceller;
    }

    public void cancel() {
        canceller.accept(this);
    }

    public String getId() { return id; }
    public String getSessionId() { return sessionId; }

    SessionObserver getObserver() { return observer; }
}

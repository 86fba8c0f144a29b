package com.example.learningsession.bridge;

/**
 * A live reader of one session's events: a viewing tab, a background cache, a
 * persistence hook.
 */
public interface SessionObserver {

    /**
     * Applies one event. Implementations must tolerate the same operation
     * being delivered more than once.
     */
    void onEvent(BridgeEvent event);

    /**
     * A disconnected observer is detached and misses every later event; it
     * rehydrates from the ledger and the activity store when it comes back.
     */
    default boolean isConnected() {
        return true;
    }
}

package com.example.learningsession.model;

/**
 * Lifecycle of a ledger message.
 * <pre>
 * UNACTIVATED --> ACTIVATED --> PERMANENT
 *                           --> REJECTED
 * </pre>
 */
public enum LifecycleState {
    UNACTIVATED,
    ACTIVATED,
    PERMANENT,
    REJECTED;

    public boolean canTransitionTo(LifecycleState next) {
        if (next == null) {
            return false;
        }
        switch (this) {
            case UNACTIVATED:
                return next == ACTIVATED;
            case ACTIVATED:
                return next == PERMANENT || next == REJECTED;
            default:
                return false;
        }
    }
}
